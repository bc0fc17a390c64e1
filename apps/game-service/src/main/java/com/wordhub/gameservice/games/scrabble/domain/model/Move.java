package com.wordhub.gameservice.games.scrabble.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.wordhub.gameservice.games.scrabble.domain.enums.MoveType;

import java.time.Instant;
import java.util.List;

/**
 * 已提交的一步（只追加，不修改）。
 *
 * @param moveNumber      房间内单调递增的序号（从 1 开始）
 * @param exchangedCount  换牌张数（换了哪些牌不公开）
 * @param challengeUpheld 仅 CHALLENGE：true 表示质疑成功、上一步被撤回
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Move(int moveNumber,
                   MoveType type,
                   String playerId,
                   List<PlacedTile> placements,
                   int exchangedCount,
                   List<String> words,
                   int score,
                   Instant timestamp,
                   Boolean challengeUpheld) {

    public Move {
        placements = placements == null ? List.of() : List.copyOf(placements);
        words = words == null ? List.of() : List.copyOf(words);
    }
}

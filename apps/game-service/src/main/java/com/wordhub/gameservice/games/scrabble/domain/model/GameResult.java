package com.wordhub.gameservice.games.scrabble.domain.model;

import com.wordhub.gameservice.games.scrabble.domain.enums.CompletionReason;

import java.util.Map;

/**
 * 终局结果。
 *
 * @param winnerId    胜者；平局或中止时为 null
 * @param loserId     负者；按分数判定的平局时为 null
 * @param reason      结束原因
 * @param finalScores 终局结算后的分数（playerId → 分）
 */
public record GameResult(String winnerId, String loserId, CompletionReason reason, Map<String, Integer> finalScores) {

    public boolean isDraw() {
        return winnerId == null && reason != CompletionReason.ABORTED;
    }
}

package com.wordhub.gameservice.games.scrabble.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.wordhub.gameservice.clock.ClockSnapshot;
import com.wordhub.gameservice.games.scrabble.domain.enums.GameMode;
import com.wordhub.gameservice.games.scrabble.domain.enums.RoomStatus;

import java.time.Instant;
import java.util.List;

/**
 * 房间全貌（STATE 事件载荷 / REST 查询结果）。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RoomView(String roomId,
                       RoomStatus status,
                       GameMode mode,
                       String dictionaryId,
                       List<String> board,
                       List<PlayerView> players,
                       String currentPlayerId,
                       int consecutivePasses,
                       int moveNumber,
                       int bagSize,
                       ClockSnapshot clock,
                       Move lastMove,
                       GameResult result,
                       Instant createdAt,
                       long epoch) {
}

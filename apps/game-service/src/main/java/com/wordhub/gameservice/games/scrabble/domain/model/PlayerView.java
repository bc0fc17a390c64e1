package com.wordhub.gameservice.games.scrabble.domain.model;

/**
 * 对外公开的玩家信息（不含字架内容）。
 */
public record PlayerView(int seat,
                         String playerId,
                         String displayName,
                         boolean bot,
                         int score,
                         int rackSize,
                         boolean connected,
                         long timeRemainingMs,
                         boolean currentTurn) {
}

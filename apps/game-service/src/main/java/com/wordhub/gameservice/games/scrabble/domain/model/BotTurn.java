package com.wordhub.gameservice.games.scrabble.domain.model;

/**
 * 轮到机器人：哪个机器人、在哪个房间版本上。
 */
public record BotTurn(String roomId, String botId, long epoch) {
}

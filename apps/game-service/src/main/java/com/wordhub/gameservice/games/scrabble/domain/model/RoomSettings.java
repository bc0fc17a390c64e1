package com.wordhub.gameservice.games.scrabble.domain.model;

import com.wordhub.gameservice.games.scrabble.domain.enums.GameMode;

import java.time.Duration;

/**
 * 建房参数。
 *
 * @param initialClockMs  每方初始用时（毫秒），对局中不再补充
 * @param autoStart       第二人入座时自动开始
 * @param lockTimeout     获取房间锁的最长等待
 * @param disconnectGrace 人类玩家断线后判负前的宽限期
 */
public record RoomSettings(GameMode mode,
                           String dictionaryId,
                           String boardConfigId,
                           String tileSetId,
                           long initialClockMs,
                           boolean autoStart,
                           Duration lockTimeout,
                           Duration disconnectGrace) {
}

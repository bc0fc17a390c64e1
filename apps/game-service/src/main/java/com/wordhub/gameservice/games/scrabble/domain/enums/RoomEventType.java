package com.wordhub.gameservice.games.scrabble.domain.enums;

/**
 * 出站事件类型。前六种广播给房间，后三种只发给单个玩家。
 */
public enum RoomEventType {
    STATE,
    MOVE,
    TURN,
    TIMER_SYNC,
    TIMER_EXPIRED,
    GAME_COMPLETED,
    RACK,
    PONG,
    ERROR
}

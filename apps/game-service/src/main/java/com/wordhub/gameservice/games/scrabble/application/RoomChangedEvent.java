package com.wordhub.gameservice.games.scrabble.application;

/**
 * 房间状态可能已变化（走子、入座、暂停、结束等）。
 * 由服务层在每次操作后发布，计时协调器与机器人调度器据此重新对齐。
 */
public record RoomChangedEvent(String roomId) {
}

package com.wordhub.gameservice.games.scrabble.domain.event;

import java.util.List;

/**
 * 出站事件的接收方。房间在持锁状态下按产生顺序调用，实现不得回调房间。
 */
@FunctionalInterface
public interface RoomEventSink {

    void publish(List<RoomEvent> events);
}

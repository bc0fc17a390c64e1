package com.wordhub.gameservice.games.scrabble.domain.event;

import com.wordhub.gameservice.games.scrabble.domain.enums.RoomEventType;

/**
 * 房间产生的出站事件。
 *
 * @param recipient 为 null 时广播给整个房间，否则只发给该玩家
 */
public record RoomEvent(String roomId, RoomEventType type, Object payload, String recipient) {

    public static RoomEvent broadcast(String roomId, RoomEventType type, Object payload) {
        return new RoomEvent(roomId, type, payload, null);
    }

    public static RoomEvent privateTo(String roomId, String playerId, RoomEventType type, Object payload) {
        return new RoomEvent(roomId, type, payload, playerId);
    }

    public boolean isBroadcast() {
        return recipient == null;
    }
}

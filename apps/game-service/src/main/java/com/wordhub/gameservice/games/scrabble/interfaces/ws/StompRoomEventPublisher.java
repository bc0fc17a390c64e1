package com.wordhub.gameservice.games.scrabble.interfaces.ws;

import com.wordhub.gameservice.games.scrabble.domain.event.RoomEvent;
import com.wordhub.gameservice.games.scrabble.domain.event.RoomEventSink;
import com.wordhub.gameservice.games.scrabble.interfaces.ws.dto.ScrabbleMessages.BroadcastEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 把房间事件投递到 STOMP：
 *   - 广播：/topic/room.{roomId}
 *   - 私信：/user/{playerId}/queue/scrabble.rack | scrabble.pong | scrabble.errors
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StompRoomEventPublisher implements RoomEventSink {

    private final SimpMessagingTemplate messaging;

    @Override
    public void publish(List<RoomEvent> events) {
        for (RoomEvent e : events) {
            BroadcastEvent evt = new BroadcastEvent();
            evt.setRoomId(e.roomId());
            evt.setType(e.type().name());
            evt.setPayload(e.payload());
            if (e.isBroadcast()) {
                messaging.convertAndSend(topic(e.roomId()), evt);
            } else {
                messaging.convertAndSendToUser(e.recipient(), userQueue(e), evt);
            }
            log.trace("事件已投递: roomId={}, type={}, to={}", e.roomId(), e.type(), e.recipient());
        }
    }

    private String topic(String roomId) { return "/topic/room." + roomId; }

    private String userQueue(RoomEvent e) {
        switch (e.type()) {
            case RACK:
                return "/queue/scrabble.rack";
            case PONG:
                return "/queue/scrabble.pong";
            default:
                return "/queue/scrabble.errors";
        }
    }
}

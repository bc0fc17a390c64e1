package com.wordhub.gameservice.platform.ws;

import com.wordhub.gameservice.games.scrabble.service.ScrabbleService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 记录每个 STOMP 会话坐在哪些房间，连接断开时通知这些房间该玩家离线。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RoomSessionTracker {

    private final ScrabbleService scrabbleService;

    /** sessionId -> 绑定（同一会话可以在多个房间） */
    private final Map<String, Set<Binding>> sessions = new ConcurrentHashMap<>();

    public void bind(String sessionId, String roomId, String playerId) {
        if (sessionId == null || roomId == null || playerId == null) return;
        sessions.computeIfAbsent(sessionId, k -> ConcurrentHashMap.newKeySet()).add(new Binding(roomId, playerId));
    }

    public Set<Binding> bindings(String sessionId) {
        Set<Binding> b = sessions.get(sessionId);
        return b == null ? Set.of() : Set.copyOf(b);
    }

    @EventListener
    public void onDisconnect(SessionDisconnectEvent event) {
        sessionClosed(event.getSessionId());
    }

    /**
     * 会话关闭：逐个房间标记离线。
     */
    public void sessionClosed(String sessionId) {
        Set<Binding> bound = sessionId == null ? null : sessions.remove(sessionId);
        if (bound == null) return;
        for (Binding b : bound) {
            try {
                scrabbleService.playerDisconnected(b.roomId(), b.playerId());
            } catch (RuntimeException e) {
                log.warn("标记玩家离线失败: roomId={}, player={}", b.roomId(), b.playerId(), e);
            }
        }
    }

    public record Binding(String roomId, String playerId) {
    }
}

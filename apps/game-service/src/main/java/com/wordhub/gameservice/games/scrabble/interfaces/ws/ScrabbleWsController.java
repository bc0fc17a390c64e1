package com.wordhub.gameservice.games.scrabble.interfaces.ws;

import com.wordhub.gameservice.games.scrabble.domain.enums.RoomEventType;
import com.wordhub.gameservice.games.scrabble.domain.event.RoomEvent;
import com.wordhub.gameservice.games.scrabble.domain.event.RoomEventSink;
import com.wordhub.gameservice.games.scrabble.domain.exception.GameException;
import com.wordhub.gameservice.games.scrabble.domain.exception.RoomStateCorruptedException;
import com.wordhub.gameservice.games.scrabble.domain.model.RoomView;
import com.wordhub.gameservice.games.scrabble.interfaces.ws.dto.MoveCommandConverter;
import com.wordhub.gameservice.games.scrabble.interfaces.ws.dto.ScrabbleMessages.ErrorPayload;
import com.wordhub.gameservice.games.scrabble.interfaces.ws.dto.ScrabbleMessages.JoinCmd;
import com.wordhub.gameservice.games.scrabble.interfaces.ws.dto.ScrabbleMessages.MoveCmd;
import com.wordhub.gameservice.games.scrabble.interfaces.ws.dto.ScrabbleMessages.RoomCmd;
import com.wordhub.gameservice.games.scrabble.service.ScrabbleService;
import com.wordhub.gameservice.platform.ws.RoomSessionTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;

import java.util.List;
import java.util.Objects;

/**
 * Scrabble WebSocket 控制器
 * ----------------------------------------
 * 接收 /app/scrabble.* 指令，调用服务层；状态变化由房间事件统一推送，
 * 这里只负责身份解析与把被拒原因私发给提交者本人（不广播、不改状态）。
 */
@Controller
@RequiredArgsConstructor
@Slf4j
public class ScrabbleWsController {

    private final ScrabbleService scrabbleService;
    private final RoomEventSink sink;
    private final RoomSessionTracker sessionTracker;

    /**
     * 入座；roomId 为空时快速匹配。
     */
    @MessageMapping("/scrabble.join")
    public void join(JoinCmd cmd, SimpMessageHeaderAccessor sha) {
        final String userId = userId(sha);
        final String roomId = cmd.getRoomId();
        try {
            RoomView view = StringUtils.isBlank(roomId)
                    ? scrabbleService.quickJoin(userId, cmd.getDisplayName())
                    : scrabbleService.join(roomId, userId, cmd.getDisplayName());
            sessionTracker.bind(sha.getSessionId(), view.roomId(), userId);
        } catch (RuntimeException e) {
            handle(roomId, userId, e);
        }
    }

    @MessageMapping("/scrabble.start")
    public void start(RoomCmd cmd, SimpMessageHeaderAccessor sha) {
        final String userId = userId(sha);
        try {
            scrabbleService.start(cmd.getRoomId());
        } catch (RuntimeException e) {
            handle(cmd.getRoomId(), userId, e);
        }
    }

    /**
     * 出牌 / 换牌 / 质疑（也接受 PASS）。
     */
    @MessageMapping("/scrabble.move")
    public void move(MoveCmd cmd, SimpMessageHeaderAccessor sha) {
        final String userId = userId(sha);
        try {
            scrabbleService.submitMove(cmd.getRoomId(), MoveCommandConverter.toCommand(userId, cmd));
        } catch (RuntimeException e) {
            handle(cmd.getRoomId(), userId, e);
        }
    }

    @MessageMapping("/scrabble.pass")
    public void pass(RoomCmd cmd, SimpMessageHeaderAccessor sha) {
        final String userId = userId(sha);
        try {
            scrabbleService.pass(cmd.getRoomId(), userId);
        } catch (RuntimeException e) {
            handle(cmd.getRoomId(), userId, e);
        }
    }

    @MessageMapping("/scrabble.resign")
    public void resign(RoomCmd cmd, SimpMessageHeaderAccessor sha) {
        final String userId = userId(sha);
        try {
            scrabbleService.resign(cmd.getRoomId(), userId);
        } catch (RuntimeException e) {
            handle(cmd.getRoomId(), userId, e);
        }
    }

    /**
     * 心跳：刷新在线状态，回 PONG。
     */
    @MessageMapping("/scrabble.ping")
    public void ping(RoomCmd cmd, SimpMessageHeaderAccessor sha) {
        final String userId = userId(sha);
        try {
            scrabbleService.heartbeat(cmd.getRoomId(), userId);
            sessionTracker.bind(sha.getSessionId(), cmd.getRoomId(), userId);
        } catch (RuntimeException e) {
            handle(cmd.getRoomId(), userId, e);
        }
    }

    private String userId(SimpMessageHeaderAccessor sha) {
        return Objects.requireNonNull(sha.getUser(), "user is null").getName();
    }

    /**
     * 业务拒绝私发给本人；房间损坏只记日志（房间已被中止并广播）。
     */
    private void handle(String roomId, String userId, RuntimeException e) {
        if (e instanceof RoomStateCorruptedException) {
            log.error("房间状态损坏: roomId={}, player={}", roomId, userId, e);
            return;
        }
        ErrorPayload payload;
        if (e instanceof GameException) {
            GameException ge = (GameException) e;
            payload = new ErrorPayload(ge.getCode().name(), ge.getMessage(), ge.getDetail());
        } else if (e instanceof IllegalArgumentException) {
            payload = new ErrorPayload("BAD_REQUEST", e.getMessage(), null);
        } else {
            log.error("处理 STOMP 指令失败: roomId={}, player={}", roomId, userId, e);
            payload = new ErrorPayload("INTERNAL_ERROR", e.getMessage(), null);
        }
        log.debug("指令被拒: roomId={}, player={}, code={}", roomId, userId, payload.getCode());
        sink.publish(List.of(RoomEvent.privateTo(roomId, userId, RoomEventType.ERROR, payload)));
    }
}

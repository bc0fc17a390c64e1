package com.wordhub.gameservice.platform.ws;

import org.apache.commons.lang3.StringUtils;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.ChannelInterceptor;
import org.springframework.messaging.support.MessageHeaderAccessor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * WebSocket STOMP 身份拦截器
 *
 * 在 STOMP CONNECT 阶段读取 player-id 头并设置会话身份，供后续消息处理与 /user 私信使用。
 * 仅处理 CONNECT 命令，其他消息直接放行。
 * 缺少 player-id 时拒绝连接。
 */
@Component
public class PlayerIdentityChannelInterceptor implements ChannelInterceptor {

    public static final String PLAYER_ID_HEADER = "player-id";

    @Override
    public Message<?> preSend(Message<?> message, MessageChannel channel) {
        StompHeaderAccessor accessor = MessageHeaderAccessor.getAccessor(message, StompHeaderAccessor.class);
        if (accessor == null) {
            accessor = StompHeaderAccessor.wrap(message);
        }
        if (StompCommand.CONNECT.equals(accessor.getCommand())) {
            String playerId = firstHeader(accessor, PLAYER_ID_HEADER);
            if (StringUtils.isBlank(playerId)) {
                throw new IllegalArgumentException("missing " + PLAYER_ID_HEADER + " header");
            }
            accessor.setUser(new PlayerPrincipal(playerId.trim()));
        }
        return message;
    }

    /**
     * 从 STOMP header 中提取指定 key 的第一个值
     */
    private static String firstHeader(StompHeaderAccessor accessor, String key) {
        List<String> vals = accessor.getNativeHeader(key);
        return (vals == null || vals.isEmpty()) ? null : vals.get(0);
    }
}

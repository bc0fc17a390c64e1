package com.wordhub.gameservice.platform.ws;

import java.security.Principal;

/**
 * STOMP 会话身份：身份协作方给出的玩家 id。
 */
public record PlayerPrincipal(String playerId) implements Principal {

    @Override
    public String getName() {
        return playerId;
    }
}

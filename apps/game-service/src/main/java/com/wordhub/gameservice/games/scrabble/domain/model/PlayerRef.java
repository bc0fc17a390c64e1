package com.wordhub.gameservice.games.scrabble.domain.model;

import org.apache.commons.lang3.StringUtils;

/**
 * 玩家身份：人类用户或机器人，二者有且仅有一个。
 */
public record PlayerRef(String userId, String botId) {

    public PlayerRef {
        if (StringUtils.isBlank(userId) == StringUtils.isBlank(botId)) {
            throw new IllegalArgumentException("exactly one of userId/botId must be set");
        }
    }

    public static PlayerRef human(String userId) {
        return new PlayerRef(userId, null);
    }

    public static PlayerRef bot(String botId) {
        return new PlayerRef(null, botId);
    }

    public boolean isBot() {
        return botId != null;
    }

    /** 房间内的玩家标识 */
    public String id() {
        return isBot() ? botId : userId;
    }
}

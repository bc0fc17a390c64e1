package com.wordhub.gameservice.games.scrabble.application;

import com.wordhub.gameservice.games.scrabble.domain.enums.GameMode;

/**
 * 建房请求中可覆盖的参数；为 null 的字段使用 wordhub.game.* 默认值。
 */
public record RoomOptions(GameMode mode, String dictionaryId, Long initialClockMs) {

    public static RoomOptions defaults() {
        return new RoomOptions(null, null, null);
    }
}

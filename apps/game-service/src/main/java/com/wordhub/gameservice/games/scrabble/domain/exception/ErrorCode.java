package com.wordhub.gameservice.games.scrabble.domain.exception;

/**
 * 业务错误码及其对应的 HTTP 状态。
 */
public enum ErrorCode {

    NOT_YOUR_TURN(409),
    GAME_NOT_ACTIVE(409),
    INVALID_PLACEMENT(400),
    RACK_MISMATCH(400),
    INVALID_WORD(400),
    EXCHANGE_NOT_ALLOWED(400),
    CHALLENGE_NOT_ALLOWED(400),
    DICTIONARY_UNAVAILABLE(503),
    ROOM_NOT_FOUND(404),
    ROOM_FULL(409),
    ROOM_BUSY(409),
    BOT_NOT_FOUND(404);

    private final int httpStatus;

    ErrorCode(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }
}

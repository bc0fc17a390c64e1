package com.wordhub.gameservice.games.scrabble.domain.exception;

/**
 * 面向玩家的业务异常：走子被拒、房间不存在等。
 * 抛出时房间状态保持不变。
 */
public class GameException extends RuntimeException {

    private final ErrorCode code;
    /** 附加信息，如 INVALID_WORD 时的非法单词 */
    private final String detail;

    public GameException(ErrorCode code, String message) {
        this(code, message, null, null);
    }

    public GameException(ErrorCode code, String message, String detail) {
        this(code, message, detail, null);
    }

    public GameException(ErrorCode code, String message, String detail, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.detail = detail;
    }

    public ErrorCode getCode() {
        return code;
    }

    public String getDetail() {
        return detail;
    }
}

package com.wordhub.gameservice.games.scrabble.domain.model;

/**
 * 格子奖励。CENTER 为起始格，按双倍单词计分。
 */
public enum Premium {

    NONE(1, 1, null),
    DL(2, 1, "2L"),
    TL(3, 1, "3L"),
    DW(1, 2, "2W"),
    TW(1, 3, "3W"),
    CENTER(1, 2, "star");

    private final int letterMultiplier;
    private final int wordMultiplier;
    /** 棋盘配置文件中的写法 */
    private final String code;

    Premium(int letterMultiplier, int wordMultiplier, String code) {
        this.letterMultiplier = letterMultiplier;
        this.wordMultiplier = wordMultiplier;
        this.code = code;
    }

    public int letterMultiplier() { return letterMultiplier; }

    public int wordMultiplier() { return wordMultiplier; }

    public String code() { return code; }

    public static Premium fromCode(String code) {
        for (Premium p : values()) {
            if (p.code != null && p.code.equalsIgnoreCase(code)) return p;
        }
        throw new IllegalArgumentException("unknown premium code: " + code);
    }
}

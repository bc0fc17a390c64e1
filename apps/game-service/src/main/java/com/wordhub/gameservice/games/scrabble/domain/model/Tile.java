package com.wordhub.gameservice.games.scrabble.domain.model;

/**
 * 一张字母牌。
 * 空白牌在字架上 letter 为 '_'；摆上棋盘后 letter 为其代表的字母，points 恒为 0。
 */
public record Tile(char letter, int points, boolean blank) {

    public static final char BLANK = '_';

    public static Tile of(char letter, int points) {
        return new Tile(letter, points, false);
    }

    public static Tile blankTile() {
        return new Tile(BLANK, 0, true);
    }

    /** 字架上的表示：空白牌为 '_' */
    public char rackSymbol() {
        return blank ? BLANK : letter;
    }

    /** 摆上棋盘后的牌（空白牌指定字母） */
    public Tile asPlayed(char played) {
        return blank ? new Tile(played, 0, true) : this;
    }

    /** 退回字架时还原空白牌 */
    public Tile toRackTile() {
        return blank ? blankTile() : this;
    }
}

package com.wordhub.gameservice.games.scrabble.domain.model;

/**
 * 一次出牌中的单个落点（0 基坐标）。
 * blank=true 表示用空白牌代替 letter。
 */
public record PlacedTile(int row, int col, char letter, boolean blank) {

    public static PlacedTile of(int row, int col, char letter) {
        return new PlacedTile(row, col, letter, false);
    }

    public static PlacedTile blank(int row, int col, char letter) {
        return new PlacedTile(row, col, letter, true);
    }

    /** 需要从字架取出的牌面 */
    public char rackSymbol() {
        return blank ? Tile.BLANK : letter;
    }
}

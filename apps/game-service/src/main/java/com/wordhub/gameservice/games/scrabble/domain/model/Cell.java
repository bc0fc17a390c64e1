package com.wordhub.gameservice.games.scrabble.domain.model;

/**
 * 棋盘格：位置与奖励在加载配置后不再变化，只有 occupant 会变。
 */
public class Cell {

    private final int row;
    private final int col;
    private final Premium premium;
    private Tile occupant;

    public Cell(int row, int col, Premium premium) {
        this.row = row;
        this.col = col;
        this.premium = premium == null ? Premium.NONE : premium;
    }

    public int getRow() { return row; }

    public int getCol() { return col; }

    public Premium getPremium() { return premium; }

    public Tile getOccupant() { return occupant; }

    public boolean isEmpty() { return occupant == null; }

    void setOccupant(Tile occupant) { this.occupant = occupant; }

    Cell copy() {
        Cell c = new Cell(row, col, premium);
        c.occupant = occupant;
        return c;
    }
}

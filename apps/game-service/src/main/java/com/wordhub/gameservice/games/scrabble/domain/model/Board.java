package com.wordhub.gameservice.games.scrabble.domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * 拼字棋盘：size x size 的方格，坐标 0 基。
 * 只负责存取，不做合法性校验（由规则层判定）。
 */
public class Board {

    /** 空位在文本视图中的表示 */
    public static final char EMPTY = '.';

    private final Cell[][] cells;
    private final int size;
    private int tileCount;

    /**
     * @param cells 由棋盘配置加载的方阵（会被原样持有）
     */
    public Board(Cell[][] cells) {
        if (cells == null || cells.length == 0 || cells.length % 2 == 0) {
            throw new IllegalArgumentException("board must be a non-empty square with odd size");
        }
        for (Cell[] row : cells) {
            if (row.length != cells.length) {
                throw new IllegalArgumentException("board must be square");
            }
        }
        this.cells = cells;
        this.size = cells.length;
        for (Cell[] row : cells) {
            for (Cell c : row) {
                if (!c.isEmpty()) tileCount++;
            }
        }
    }

    public int size() { return size; }

    /** 中心格（起始格）坐标 */
    public int center() { return size / 2; }

    public boolean inBounds(int row, int col) {
        return row >= 0 && row < size && col >= 0 && col < size;
    }

    public Cell cell(int row, int col) { return cells[row][col]; }

    public Tile tileAt(int row, int col) { return cells[row][col].getOccupant(); }

    /** 越界视为空 */
    public boolean isEmpty(int row, int col) {
        return !inBounds(row, col) || cells[row][col].isEmpty();
    }

    public boolean hasTile(int row, int col) {
        return inBounds(row, col) && !cells[row][col].isEmpty();
    }

    /** 棋盘上尚无任何牌 */
    public boolean isBlank() { return tileCount == 0; }

    public int tileCount() { return tileCount; }

    public void place(int row, int col, Tile tile) {
        if (cells[row][col].isEmpty()) tileCount++;
        cells[row][col].setOccupant(tile);
    }

    /** 移除并返回该格的牌（质疑成功回退时使用） */
    public Tile remove(int row, int col) {
        Tile t = cells[row][col].getOccupant();
        if (t != null) {
            cells[row][col].setOccupant(null);
            tileCount--;
        }
        return t;
    }

    /** 深拷贝（供机器人模拟使用） */
    public Board copy() {
        Cell[][] c = new Cell[size][size];
        for (int r = 0; r < size; r++) {
            for (int col = 0; col < size; col++) {
                c[r][col] = cells[r][col].copy();
            }
        }
        return new Board(c);
    }

    /**
     * 文本视图：每行一个字符串，'.' 为空，空白牌为小写字母。
     */
    public List<String> rows() {
        List<String> out = new ArrayList<>(size);
        for (int r = 0; r < size; r++) {
            StringBuilder sb = new StringBuilder(size);
            for (int c = 0; c < size; c++) {
                Tile t = cells[r][c].getOccupant();
                if (t == null) sb.append(EMPTY);
                else sb.append(t.blank() ? Character.toLowerCase(t.letter()) : t.letter());
            }
            out.add(sb.toString());
        }
        return out;
    }
}

package com.wordhub.gameservice.games.scrabble.domain.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 字架：玩家手中未打出的牌（无序多重集合）。
 */
public class Rack {

    private final List<Tile> tiles = new ArrayList<>();

    public Rack() {
    }

    public Rack(Collection<Tile> initial) {
        tiles.addAll(initial);
    }

    public void addAll(Collection<Tile> more) {
        tiles.addAll(more);
    }

    /**
     * 多重集合包含判断：symbols 中每个牌面（空白牌为 '_'）的数量都不超过字架中的数量。
     */
    public boolean containsAll(Collection<Character> symbols) {
        Map<Character, Integer> have = counts();
        for (char s : symbols) {
            int left = have.getOrDefault(s, 0) - 1;
            if (left < 0) return false;
            have.put(s, left);
        }
        return true;
    }

    /**
     * 按牌面取出一张牌。
     * @throws IllegalStateException 字架中没有该牌（调用前应已校验）
     */
    public Tile take(char symbol) {
        for (int i = 0; i < tiles.size(); i++) {
            if (tiles.get(i).rackSymbol() == symbol) {
                return tiles.remove(i);
            }
        }
        throw new IllegalStateException("tile not in rack: " + symbol);
    }

    /** 按实例移除（质疑回退时取回新抽的牌） */
    public boolean removeExact(Tile tile) {
        return tiles.remove(tile);
    }

    public int size() { return tiles.size(); }

    public boolean isEmpty() { return tiles.isEmpty(); }

    /** 剩余牌面分值之和（终局结算用） */
    public int value() {
        int v = 0;
        for (Tile t : tiles) v += t.points();
        return v;
    }

    public List<Tile> tiles() {
        return Collections.unmodifiableList(tiles);
    }

    /** 牌面列表（空白牌为 '_'） */
    public List<Character> symbols() {
        List<Character> out = new ArrayList<>(tiles.size());
        for (Tile t : tiles) out.add(t.rackSymbol());
        return out;
    }

    public Rack copy() {
        return new Rack(tiles);
    }

    private Map<Character, Integer> counts() {
        Map<Character, Integer> m = new HashMap<>();
        for (Tile t : tiles) m.merge(t.rackSymbol(), 1, Integer::sum);
        return m;
    }
}

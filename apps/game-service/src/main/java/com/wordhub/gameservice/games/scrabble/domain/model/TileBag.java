package com.wordhub.gameservice.games.scrabble.domain.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * 牌袋：未抽出的牌。随机源由外部注入，测试可复现。
 */
public class TileBag {

    private final List<Tile> tiles;
    private final Random random;

    private TileBag(List<Tile> tiles, Random random) {
        this.tiles = tiles;
        this.random = random;
    }

    /** 按分布生成并洗牌 */
    public static TileBag fromDistribution(TileDistribution dist, Random random) {
        List<Tile> list = new ArrayList<>(dist.totalTiles());
        for (Map.Entry<Character, TileDistribution.LetterSpec> e : dist.letters().entrySet()) {
            char letter = e.getKey();
            for (int i = 0; i < e.getValue().count(); i++) {
                list.add(letter == Tile.BLANK ? Tile.blankTile() : Tile.of(letter, e.getValue().points()));
            }
        }
        Collections.shuffle(list, random);
        return new TileBag(list, random);
    }

    /** 固定顺序的牌袋（从末尾抽），用于测试 */
    public static TileBag ofTiles(List<Tile> tiles, Random random) {
        return new TileBag(new ArrayList<>(tiles), random);
    }

    /** 抽至多 n 张 */
    public List<Tile> draw(int n) {
        int k = Math.min(n, tiles.size());
        List<Tile> out = new ArrayList<>(k);
        for (int i = 0; i < k; i++) {
            out.add(tiles.remove(tiles.size() - 1));
        }
        return out;
    }

    /** 放回并重新洗牌 */
    public void putBack(Collection<Tile> returned) {
        for (Tile t : returned) tiles.add(t.toRackTile());
        Collections.shuffle(tiles, random);
    }

    /** 按原顺序放回末尾（质疑回退时使用，保持抽牌顺序） */
    public void restoreOnTop(List<Tile> drawn) {
        for (int i = drawn.size() - 1; i >= 0; i--) {
            tiles.add(drawn.get(i));
        }
    }

    public int size() { return tiles.size(); }

    public boolean isEmpty() { return tiles.isEmpty(); }
}

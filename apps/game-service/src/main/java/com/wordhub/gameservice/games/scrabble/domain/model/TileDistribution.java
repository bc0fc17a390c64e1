package com.wordhub.gameservice.games.scrabble.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一种语言的牌面分布：每个字母的张数与分值。空白牌键为 '_'。
 */
public record TileDistribution(String langId, Map<Character, LetterSpec> letters) {

    public record LetterSpec(int count, int points) {
        public LetterSpec {
            if (count < 0 || points < 0) {
                throw new IllegalArgumentException("count and points must be non-negative");
            }
        }
    }

    public TileDistribution {
        letters = Collections.unmodifiableMap(new LinkedHashMap<>(letters));
    }

    /** 字母分值；未知字母返回 -1 */
    public int pointsOf(char letter) {
        LetterSpec s = letters.get(Character.toUpperCase(letter));
        return s == null ? -1 : s.points();
    }

    public boolean contains(char letter) {
        return letters.containsKey(letter);
    }

    public int totalTiles() {
        return letters.values().stream().mapToInt(LetterSpec::count).sum();
    }
}

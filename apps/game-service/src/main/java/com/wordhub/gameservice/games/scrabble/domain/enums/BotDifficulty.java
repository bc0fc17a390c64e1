package com.wordhub.gameservice.games.scrabble.domain.enums;

/**
 * 机器人难度：默认思考时间区间（毫秒）与单步最多摆放的牌数。
 */
public enum BotDifficulty {

    BEGINNER(2000, 3000, 3),
    EASY(2500, 4000, 4),
    MEDIUM(3000, 5000, 5),
    HARD(5000, 10000, 6),
    EXPERT(8000, 15000, 7),
    MASTER(10000, 30000, 7);

    private final long minThinkMs;
    private final long maxThinkMs;
    private final int maxTiles;

    BotDifficulty(long minThinkMs, long maxThinkMs, int maxTiles) {
        this.minThinkMs = minThinkMs;
        this.maxThinkMs = maxThinkMs;
        this.maxTiles = maxTiles;
    }

    public long minThinkMs() { return minThinkMs; }

    public long maxThinkMs() { return maxThinkMs; }

    public int maxTiles() { return maxTiles; }
}

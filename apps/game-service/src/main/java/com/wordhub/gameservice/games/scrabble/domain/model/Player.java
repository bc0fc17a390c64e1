package com.wordhub.gameservice.games.scrabble.domain.model;

import lombok.Getter;

/**
 * 房间内的一个座位上的玩家。
 * 剩余时间不存这里：以房间时钟为准。
 */
@Getter
public class Player {

    private final int seat;
    private final PlayerRef ref;
    private final String displayName;
    private final Rack rack = new Rack();
    private int score;
    private boolean connected = true;
    /** 断线时刻（毫秒），在线时为 0 */
    private long disconnectedAt;

    public Player(int seat, PlayerRef ref, String displayName) {
        this.seat = seat;
        this.ref = ref;
        this.displayName = displayName == null ? ref.id() : displayName;
    }

    public String id() {
        return ref.id();
    }

    public boolean isBot() {
        return ref.isBot();
    }

    public void addScore(int delta) {
        score += delta;
    }

    /** 终局扣分允许把分数扣到 0 以下时截为 0 */
    public void subtractScore(int delta) {
        score = Math.max(0, score - delta);
    }

    public void markConnected() {
        connected = true;
        disconnectedAt = 0L;
    }

    public void markDisconnected(long now) {
        if (!connected) return;
        connected = false;
        disconnectedAt = now;
    }
}

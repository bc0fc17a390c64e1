package com.wordhub.gameservice.clock;

import java.util.OptionalInt;

/**
 * GameClock
 * ---------------------------------------
 * 单个房间的双方倒计时（棋钟）。
 *
 * 语义：
 *  - 计数单位为整数毫秒，只做整数减法，不累积浮点误差；
 *  - 任一时刻最多一方在走时；两侧计数均不为负，归零即该方终局；
 *  - 每次 tick 以 lastTick 为基准结算已流逝时间，再推进 lastTick；
 *  - switchSide 先为离场一方结算，再翻转走时方；
 *  - 归零通知对每一方只发出一次，后续 tick 再看到 0 也不会重复。
 *
 * 本类不加锁：由所属房间的单写者锁串行化调用。
 */
public class GameClock {

    private final long initialMs;
    private final long[] remaining = new long[2];
    private final boolean[] expiryReported = new boolean[2];

    /** 正在走时的一方；-1 表示尚未开始 */
    private int running = -1;
    private boolean paused = true;
    private long lastTick;

    public GameClock(long initialMs) {
        if (initialMs <= 0) {
            throw new IllegalArgumentException("initialMs must be positive: " + initialMs);
        }
        this.initialMs = initialMs;
        this.remaining[0] = initialMs;
        this.remaining[1] = initialMs;
    }

    /** 从 side 开始走时（仅在对局激活时调用一次） */
    public void start(int side, long now) {
        checkSide(side);
        if (running != -1) {
            throw new IllegalStateException("clock already started");
        }
        running = side;
        paused = false;
        lastTick = now;
    }

    /**
     * 切换走时方：先结算离场一方，再把走时交给另一方。
     * 已暂停时只翻转走时方，恢复后从新一方开始计时。
     */
    public void switchSide(long now) {
        if (running == -1) {
            throw new IllegalStateException("clock not started");
        }
        settle(now);
        running = 1 - running;
        lastTick = now;
    }

    /** 暂停：结算后冻结双方 */
    public void pause(long now) {
        if (paused) return;
        settle(now);
        paused = true;
    }

    /** 恢复：从 now 开始继续为当前方走时 */
    public void resume(long now) {
        if (!paused || running == -1) return;
        paused = false;
        lastTick = now;
    }

    /**
     * 结算流逝时间，并返回“本次新出现的”归零一方。
     * @param now 当前时间（毫秒）
     * @return 新归零的一方；无则 empty
     */
    public OptionalInt tick(long now) {
        settle(now);
        if (running == -1) return OptionalInt.empty();
        if (remaining[running] == 0 && !expiryReported[running]) {
            expiryReported[running] = true;
            return OptionalInt.of(running);
        }
        return OptionalInt.empty();
    }

    /** 只读快照 */
    public ClockSnapshot snapshot() {
        return new ClockSnapshot(remaining[0], remaining[1], paused ? -1 : running, paused);
    }

    public long remaining(int side) {
        checkSide(side);
        return remaining[side];
    }

    public int runningSide() {
        return running;
    }

    public boolean isPaused() {
        return paused;
    }

    public long initialMs() {
        return initialMs;
    }

    /** 当前走时方距归零还剩多少毫秒（未走时返回 -1） */
    public long msUntilExpiry(long now) {
        if (paused || running == -1) return -1;
        long elapsed = Math.max(0, now - lastTick);
        return Math.max(0, remaining[running] - elapsed);
    }

    private void settle(long now) {
        if (paused || running == -1) return;
        long elapsed = now - lastTick;
        // 系统时间回拨时不结算，也不回退 lastTick
        if (elapsed <= 0) return;
        remaining[running] = Math.max(0, remaining[running] - elapsed);
        lastTick = now;
    }

    private static void checkSide(int side) {
        if (side != 0 && side != 1) {
            throw new IllegalArgumentException("side must be 0 or 1: " + side);
        }
    }
}

package com.wordhub.gameservice.clock;

/**
 * 双方时钟的只读快照（timer-sync 推送载荷）。
 *
 * @param player1Ms   座位 0 剩余毫秒
 * @param player2Ms   座位 1 剩余毫秒
 * @param runningSide 正在走时的一方（0/1），未走时为 -1
 * @param paused      是否暂停
 */
public record ClockSnapshot(long player1Ms, long player2Ms, int runningSide, boolean paused) {

    public long remaining(int side) {
        return side == 0 ? player1Ms : player2Ms;
    }
}

package com.wordhub.gameservice.games.scrabble.domain.turn;

import com.wordhub.gameservice.clock.GameClock;
import com.wordhub.gameservice.games.scrabble.domain.enums.RoomStatus;
import com.wordhub.gameservice.games.scrabble.domain.exception.RoomStateCorruptedException;

/**
 * 房间状态机与回合游标。
 *
 * WAITING → ACTIVE → {COMPLETED | ABANDONED}，ACTIVE ⇄ PAUSED。
 * ACTIVE 期间游标在 0/1 之间严格交替，并与时钟的走时方保持一致；
 * 两者不一致或出现非法迁移时抛 {@link RoomStateCorruptedException}。
 */
public class TurnStateMachine {

    private final GameClock clock;
    private volatile RoomStatus status = RoomStatus.WAITING;
    private int cursor = -1;

    public TurnStateMachine(GameClock clock) {
        this.clock = clock;
    }

    /** 第二名玩家入座后开始：启动时钟 */
    public void activate(int startSide, long now) {
        require(status == RoomStatus.WAITING, "activate from " + status);
        cursor = startSide;
        clock.start(startSide, now);
        status = RoomStatus.ACTIVE;
    }

    /** 一步走子提交后交换回合，同时切换时钟 */
    public void advance(long now) {
        require(status == RoomStatus.ACTIVE, "advance in " + status);
        if (clock.runningSide() != cursor) {
            throw new RoomStateCorruptedException(
                    "turn cursor " + cursor + " disagrees with running clock side " + clock.runningSide());
        }
        clock.switchSide(now);
        cursor = 1 - cursor;
    }

    public void complete(long now) {
        require(status == RoomStatus.ACTIVE || status == RoomStatus.PAUSED, "complete from " + status);
        clock.pause(now);
        status = RoomStatus.COMPLETED;
    }

    /** 任何非终局状态都可放弃 */
    public void abandon(long now) {
        require(!status.isTerminal(), "abandon from " + status);
        if (cursor != -1) clock.pause(now);
        status = RoomStatus.ABANDONED;
    }

    public void pause(long now) {
        require(status == RoomStatus.ACTIVE, "pause from " + status);
        clock.pause(now);
        status = RoomStatus.PAUSED;
    }

    public void resume(long now) {
        require(status == RoomStatus.PAUSED, "resume from " + status);
        clock.resume(now);
        status = RoomStatus.ACTIVE;
    }

    /**
     * 内部不变量已被破坏时强制中止，不做迁移检查。
     */
    public void abort(long now) {
        if (status.isTerminal()) return;
        if (cursor != -1 && !clock.isPaused()) clock.pause(now);
        status = RoomStatus.ABANDONED;
    }

    public RoomStatus status() {
        return status;
    }

    /** 当前应走的座位；未开始为 -1 */
    public int currentSide() {
        return cursor;
    }

    public boolean isActive() {
        return status == RoomStatus.ACTIVE;
    }

    private static void require(boolean ok, String what) {
        if (!ok) throw new RoomStateCorruptedException("illegal transition: " + what);
    }
}

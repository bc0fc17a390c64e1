package com.wordhub.gameservice.engine.core;

/**
 * 游戏状态快照接口。
 * - 必须可 copy：AI 在房间锁之外对副本做推演，不能污染实盘。
 * - 具体游戏（如 ScrabbleState）实现此接口。
 */
public interface GameState {

    /**
     * 返回当前状态的深拷贝快照。
     */
    GameState copy();
}

package com.wordhub.gameservice.games.scrabble.domain.exception;

/**
 * 房间内部不变量被破坏（时钟为负、回合游标与时钟不一致、非法状态迁移）。
 * 不是玩家错误：房间会被中止。
 */
public class RoomStateCorruptedException extends IllegalStateException {

    public RoomStateCorruptedException(String message) {
        super(message);
    }
}

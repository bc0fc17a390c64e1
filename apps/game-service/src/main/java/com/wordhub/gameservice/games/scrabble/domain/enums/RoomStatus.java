package com.wordhub.gameservice.games.scrabble.domain.enums;

/**
 * 房间状态：只前进，不回退（ACTIVE 与 PAUSED 之间可往返）。
 */
public enum RoomStatus {

    WAITING,    // 等待第二名玩家
    ACTIVE,     // 对局中（允许走子）
    PAUSED,     // 管理员暂停（双方时钟冻结）
    COMPLETED,  // 正常结束
    ABANDONED;  // 放弃/中止

    public boolean isTerminal() {
        return this == COMPLETED || this == ABANDONED;
    }
}

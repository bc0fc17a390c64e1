package com.wordhub.gameservice.games.scrabble.domain.enums;

public enum CompletionReason {

    PASS_LIMIT,    // 连续弃权达到上限
    OUT_OF_TILES,  // 牌袋空且一方出完
    TIMEOUT,       // 一方时钟归零
    RESIGNATION,   // 认输
    FORFEIT,       // 断线超出宽限期
    ABORTED        // 房间状态损坏，强制中止
}

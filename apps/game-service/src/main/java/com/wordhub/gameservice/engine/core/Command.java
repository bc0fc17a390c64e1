package com.wordhub.gameservice.engine.core;

/**
 * 统一的“玩家/AI 输入指令”抽象。
 * - 真人与机器人提交的走子都表示为一条 Command，走同一条提交路径；
 * - 回合制游戏 frame 返回 0。
 */
public interface Command {

    String playerId();

    default long frame() {
        return 0L;
    }
}

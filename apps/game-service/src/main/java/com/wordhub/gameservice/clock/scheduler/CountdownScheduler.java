package com.wordhub.gameservice.clock.scheduler;

/**
 * CountdownScheduler
 * ---------------------------------------
 * 通用的“倒计时调度器”接口，完全独立于具体业务。
 *
 * 设计目标：
 *  - 每个 key 一条周期性同步 tick（固定间隔）加一个一次性截止回调；
 *  - 截止回调带版本号：上层每次重新 arm 都会换版本，旧版本的回调不会再触发；
 *  - 不关心消息广播、游戏规则等业务细节，由上层协调器负责。
 */
public interface CountdownScheduler {

    /**
     * 周期性同步回调。
     */
    interface TickListener {
        /**
         * @param key 业务键（如 "scrabble:{roomId}"）
         */
        void onTick(String key);
    }

    /**
     * 截止回调：到达 arm 时给定的截止时间后触发一次。
     */
    interface TimeoutHandler {
        /**
         * @param key     业务键
         * @param owner   被计时的一方
         * @param version arm 时的版本
         */
        void onTimeout(String key, String owner, String version);
    }

    /** 设置周期 tick 的监听器 */
    void setTickListener(TickListener listener);

    /**
     * 启动或替换指定 key 的截止回调（在 deadlineEpochMs 处触发一次）；周期 tick 已在运行时保持原节奏。
     * 截止时间已过时立即回调（在调度线程上）。
     */
    void startOrResume(String key, String owner, long deadlineEpochMs, String version, TimeoutHandler onTimeout);

    /** 停止指定 key 的周期 tick 与截止回调 */
    void stop(String key);

    /** 当前仍在调度的 key 数 */
    int activeCount();
}

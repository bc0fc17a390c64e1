package com.wordhub.gameservice.clock.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * CountdownSchedulerImpl
 * ---------------------------------------
 * 通用倒计时调度引擎的默认实现（单节点，内存态）。
 *
 * 职责：
 *  - 使用 ScheduledThreadPoolExecutor 按固定间隔触发同步 tick，节奏不随重新 arm 重置；
 *  - 为每个 key 维护一个一次性截止任务，版本不符的截止任务不会回调；
 *  - 暴露 tick/timeout 回调给上层业务协调器。
 *
 * 不做的事：
 *  - 不做任何业务逻辑（如广播、判负）。
 */
public class CountdownSchedulerImpl implements CountdownScheduler {

    private static final Logger log = LoggerFactory.getLogger(CountdownSchedulerImpl.class);

    // 调度器：同步 tick 与截止任务共用
    private final ScheduledThreadPoolExecutor scheduler;
    // 同步 tick 间隔（毫秒）
    private final long tickIntervalMs;
    private final Clock clock;

    private volatile TickListener tickListener;

    // key -> 当前截止状态
    private final ConcurrentMap<String, CountdownState> active = new ConcurrentHashMap<>();
    // key -> 周期同步任务
    private final ConcurrentMap<String, ScheduledFuture<?>> ticks = new ConcurrentHashMap<>();

    public CountdownSchedulerImpl(ScheduledThreadPoolExecutor scheduler, long tickIntervalMs, Clock clock) {
        if (tickIntervalMs <= 0) {
            throw new IllegalArgumentException("tickIntervalMs must be positive");
        }
        this.scheduler = scheduler;
        this.tickIntervalMs = tickIntervalMs;
        this.clock = clock;
    }

    @Override
    public void setTickListener(TickListener listener) {
        this.tickListener = listener;
    }

    @Override
    public void startOrResume(String key, String owner, long deadlineEpochMs, String version, TimeoutHandler onTimeout) {
        CountdownState state = new CountdownState(key, owner, version, deadlineEpochMs);
        // 先登记再调度，延迟为 0 的截止任务也能看到自己仍在位
        CountdownState previous = active.put(key, state);
        if (previous != null) previous.cancel();
        long delayMs = Math.max(0, deadlineEpochMs - clock.millis());
        state.deadlineTask = scheduler.schedule(
                () -> fireTimeout(state, onTimeout), delayMs, TimeUnit.MILLISECONDS);
        // 同步 tick 按 key 固定节奏运行，重新 arm 截止时间不会打断它
        ticks.computeIfAbsent(key, k -> scheduler.scheduleAtFixedRate(
                () -> fireTick(k), tickIntervalMs, tickIntervalMs, TimeUnit.MILLISECONDS));
        log.debug("countdown armed: key={}, owner={}, version={}, inMs={}", key, owner, version, delayMs);
    }

    @Override
    public void stop(String key) {
        CountdownState st = active.remove(key);
        if (st != null) st.cancel();
        ScheduledFuture<?> tick = ticks.remove(key);
        if (tick != null) tick.cancel(false);
    }

    @Override
    public int activeCount() {
        return active.size();
    }

    /**
     * 触发一帧 TICK 回调（若监听器存在且该 key 仍在计时）。
     */
    private void fireTick(String key) {
        if (!active.containsKey(key)) return;
        TickListener l = tickListener;
        if (l == null) return;
        try {
            l.onTick(key);
        } catch (RuntimeException e) {
            // 周期任务抛异常会被线程池静默取消，这里必须截住
            log.warn("countdown tick failed: key={}", key, e);
        }
    }

    /**
     * 截止回调：只有 arm 它的那个状态仍在位时才触发。
     */
    private void fireTimeout(CountdownState state, TimeoutHandler onTimeout) {
        if (active.get(state.key) != state || onTimeout == null) return;
        try {
            onTimeout.onTimeout(state.key, state.owner, state.version);
        } catch (RuntimeException e) {
            log.warn("countdown timeout handler failed: key={}, version={}", state.key, state.version, e);
        }
    }

    /**
     * 倒计时状态
     */
    static final class CountdownState {
        final String key;
        final String owner;
        final String version;
        final long deadlineEpochMs;
        volatile ScheduledFuture<?> deadlineTask;

        CountdownState(String key, String owner, String version, long deadlineEpochMs) {
            this.key = key;
            this.owner = owner;
            this.version = version;
            this.deadlineEpochMs = deadlineEpochMs;
        }

        void cancel() {
            // 不打断正在运行的回调
            if (deadlineTask != null) deadlineTask.cancel(false);
        }
    }
}

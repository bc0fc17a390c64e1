package com.wordhub.gameservice.games.scrabble.application;

import com.wordhub.gameservice.clock.scheduler.CountdownScheduler;
import com.wordhub.gameservice.games.scrabble.application.config.GameProperties;
import com.wordhub.gameservice.games.scrabble.domain.enums.RoomStatus;
import com.wordhub.gameservice.games.scrabble.domain.model.GameRoom;
import com.wordhub.gameservice.games.scrabble.service.ScrabbleService;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Lazy;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * TurnClockCoordinator
 * -------------------------------------------------
 * 倒计时业务协调器（应用编排层）：将通用倒计时引擎与拼字房间对接。
 *
 * 职责与边界：
 * 1) 启动时注册 tick 监听：每个周期调用一次 service.tick，由房间自己结算时钟并推送 TIMER_SYNC；
 * 2) 每次房间变化（RoomChangedEvent）后决定计时是否继续：
 *    - ACTIVE：按当前行动方剩余时间 arm 截止回调，版本号取房间 epoch；
 *    - 其他状态：停止该房间的计时；
 * 3) 截止回调到达时再 tick 一次，超时判负由房间内部完成；
 * 4) 周期清扫已结束且超过保留期的房间。
 *
 * 本类不持有任何对局状态，剩余时间以房间内的 GameClock 为准。
 */
@Component
public class TurnClockCoordinator {

    private static final Logger log = LoggerFactory.getLogger(TurnClockCoordinator.class);
    private static final String KEY_PREFIX = "scrabble:";

    private final CountdownScheduler scheduler;
    private final RoomRegistry registry;
    private final ScrabbleService scrabbleService;
    private final ScheduledThreadPoolExecutor executor;
    private final GameProperties props;
    private final Clock clock;

    // roomId -> 已 arm 的房间版本，避免每次 tick 重建计时
    private final ConcurrentMap<String, Long> armed = new ConcurrentHashMap<>();
    private volatile ScheduledFuture<?> sweeper;

    public TurnClockCoordinator(CountdownScheduler scheduler,
                                RoomRegistry registry,
                                @Lazy ScrabbleService scrabbleService,
                                @Qualifier("turnClockScheduler") ScheduledThreadPoolExecutor executor,
                                GameProperties props,
                                Clock clock) {
        this.scheduler = scheduler;
        this.registry = registry;
        this.scrabbleService = scrabbleService;
        this.executor = executor;
        this.props = props;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        scheduler.setTickListener(key -> scrabbleService.tick(extractRoomId(key)));
        long period = Math.max(1000L, props.getSyncInterval().toMillis());
        sweeper = executor.scheduleAtFixedRate(this::sweepFinished, period, period, TimeUnit.MILLISECONDS);
        log.info("协调器启动：同步间隔 {} ms，结束房间保留 {}", props.getSyncInterval().toMillis(), props.getFinishedRetention());
    }

    @PreDestroy
    public void shutdown() {
        ScheduledFuture<?> s = sweeper;
        if (s != null) s.cancel(false);
        log.info("协调器关闭：仍在计时的房间 {} 个", scheduler.activeCount());
    }

    @EventListener
    public void onRoomChanged(RoomChangedEvent event) {
        sync(event.roomId(), false);
    }

    /**
     * 把调度器与房间当前状态对齐。
     * @param force 即使版本未变也重新 arm（截止回调提前到达时使用）
     */
    void sync(String roomId, boolean force) {
        Optional<GameRoom> found = registry.find(roomId);
        if (found.isEmpty() || found.get().status() != RoomStatus.ACTIVE) {
            stop(roomId);
            return;
        }
        GameRoom room = found.get();
        armed.compute(roomId, (id, prev) -> {
            long epoch = room.epoch();
            if (!force && prev != null && prev >= epoch) {
                return prev;
            }
            long left = room.msUntilExpiry();
            String owner = room.currentPlayerId();
            if (left < 0 || owner == null) {
                scheduler.stop(key(id));
                return null;
            }
            scheduler.startOrResume(key(id), owner, clock.millis() + left, String.valueOf(epoch),
                    (k, o, v) -> onDeadline(k, o, v));
            return epoch;
        });
    }

    public void stop(String roomId) {
        armed.remove(roomId);
        scheduler.stop(key(roomId));
    }

    private void onDeadline(String key, String owner, String version) {
        String roomId = extractRoomId(key);
        log.debug("截止回调: roomId={}, owner={}, version={}", roomId, owner, version);
        RoomStatus status = scrabbleService.tick(roomId);
        if (status == RoomStatus.ACTIVE) {
            // 时钟尚未真正归零（调度提前），按剩余时间重新 arm
            sync(roomId, true);
        }
    }

    private void sweepFinished() {
        try {
            List<String> evicted = registry.evictFinished(clock.instant(), props.getFinishedRetention());
            for (String roomId : evicted) {
                stop(roomId);
            }
        } catch (RuntimeException e) {
            log.warn("清扫结束房间失败", e);
        }
    }

    private String key(String roomId) { return KEY_PREFIX + roomId; }

    private String extractRoomId(String key) {
        return key.startsWith(KEY_PREFIX) ? key.substring(KEY_PREFIX.length()) : key;
    }
}

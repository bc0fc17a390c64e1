package com.wordhub.gameservice.games.scrabble.application;

import com.wordhub.gameservice.games.scrabble.application.config.BotProfile;
import com.wordhub.gameservice.games.scrabble.application.config.GameProperties;
import com.wordhub.gameservice.games.scrabble.domain.ai.BotMoveGenerator;
import com.wordhub.gameservice.games.scrabble.domain.enums.MoveType;
import com.wordhub.gameservice.games.scrabble.domain.exception.GameException;
import com.wordhub.gameservice.games.scrabble.domain.model.BotTurn;
import com.wordhub.gameservice.games.scrabble.domain.model.GameRoom;
import com.wordhub.gameservice.games.scrabble.domain.model.MoveCommand;
import com.wordhub.gameservice.games.scrabble.domain.model.ScrabbleState;
import com.wordhub.gameservice.games.scrabble.domain.rule.MoveValidator;
import com.wordhub.gameservice.games.scrabble.service.ScrabbleService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Lazy;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * BotTurnScheduler
 * ---------------------------------------
 * 轮到机器人时，延迟一段“思考时间”后走一步。
 *
 *  - 每个房间最多一个待执行任务，任务绑定排期时的房间 epoch；
 *  - 等待期间不持有房间锁，只有最后的提交走房间的串行入口；
 *  - 房间版本变化（对手认输、超时、暂停等）后旧任务被取消，或在提交时因 epoch 不符成为空操作；
 *  - 找不到合法出牌时换牌（牌袋足够）或弃权，不会让回合卡住。
 *
 * 思考时间 = 随机延迟 + 搜索预算，总和不超过机器人的最大思考时间。
 * 机器人不发起质疑。
 */
@Slf4j
@Component
public class BotTurnScheduler {

    private final ScheduledExecutorService botScheduler;
    private final RoomRegistry registry;
    private final ScrabbleService scrabbleService;
    private final BotCatalog catalog;
    private final MoveValidator validator;
    private final GameProperties props;

    /**
     * 防抖：同一房间只保留一个待执行的机器人任务
     */
    private final ConcurrentMap<String, PendingBot> pending = new ConcurrentHashMap<>();

    public BotTurnScheduler(@Qualifier("botScheduler") ScheduledExecutorService botScheduler,
                            RoomRegistry registry,
                            @Lazy ScrabbleService scrabbleService,
                            BotCatalog catalog,
                            MoveValidator validator,
                            GameProperties props) {
        this.botScheduler = botScheduler;
        this.registry = registry;
        this.scrabbleService = scrabbleService;
        this.catalog = catalog;
        this.validator = validator;
        this.props = props;
    }

    @EventListener
    public void onRoomChanged(RoomChangedEvent event) {
        reconcile(event.roomId());
    }

    /**
     * 轮到机器人且尚未为这个版本排期时排期；不再轮到机器人时取消。
     */
    void reconcile(String roomId) {
        Optional<BotTurn> turn = registry.find(roomId).flatMap(GameRoom::botTurn);
        if (turn.isEmpty()) {
            cancel(roomId);
            return;
        }
        BotTurn t = turn.get();
        BotProfile profile;
        try {
            profile = catalog.get(t.botId());
        } catch (GameException e) {
            log.warn("机器人不在目录中，无法代走: roomId={}, botId={}", roomId, t.botId());
            return;
        }
        pending.compute(roomId, (id, prev) -> {
            if (prev != null && prev.epoch() == t.epoch()) return prev;
            if (prev != null) prev.future().cancel(false);
            long budget = computeBudget(profile);
            long delay = thinkDelay(profile, budget);
            ScheduledFuture<?> f = botScheduler.schedule(() -> runBotTurn(t, profile, budget), delay, TimeUnit.MILLISECONDS);
            log.debug("机器人排期: roomId={}, botId={}, epoch={}, delayMs={}, budgetMs={}", id, t.botId(), t.epoch(), delay, budget);
            return new PendingBot(t.epoch(), f);
        });
    }

    /** 取消房间的待执行任务（不打断正在提交的任务） */
    public void cancel(String roomId) {
        PendingBot p = pending.remove(roomId);
        if (p != null) {
            p.future().cancel(false);
        }
    }

    public boolean hasPending(String roomId) {
        return pending.containsKey(roomId);
    }

    public int pendingCount() {
        return pending.size();
    }

    long computeBudget(BotProfile profile) {
        return Math.max(1L, Math.min(props.getBotComputeBudget().toMillis(), profile.effectiveMaxThinkMs() / 4));
    }

    long thinkDelay(BotProfile profile, long budget) {
        long max = Math.max(0L, profile.effectiveMaxThinkMs() - budget);
        long min = Math.min(profile.effectiveMinThinkMs(), max);
        return min == max ? min : ThreadLocalRandom.current().nextLong(min, max + 1);
    }

    private void runBotTurn(BotTurn t, BotProfile profile, long budget) {
        String roomId = t.roomId();
        try {
            Optional<ScrabbleState> view = registry.find(roomId).flatMap(r -> r.botView(t.epoch()));
            if (view.isEmpty()) {
                log.debug("机器人任务已过期: roomId={}, epoch={}", roomId, t.epoch());
                return;
            }
            ScrabbleState state = view.get();
            MoveCommand cmd = new BotMoveGenerator(validator, profile.toStrategy(), ThreadLocalRandom.current())
                    .suggest(state, budget);
            if (cmd == null) {
                cmd = fallback(state);
            }
            submit(t, cmd.withPlayer(t.botId()));
        } catch (RuntimeException e) {
            log.error("机器人走子异常: roomId={}, botId={}", roomId, t.botId(), e);
        } finally {
            pending.computeIfPresent(roomId, (id, p) -> p.epoch() == t.epoch() ? null : p);
        }
    }

    private void submit(BotTurn t, MoveCommand cmd) {
        try {
            if (scrabbleService.submitBotMove(t.roomId(), t.epoch(), cmd).isEmpty()) {
                log.debug("机器人提交被忽略（房间版本已变化）: roomId={}, epoch={}", t.roomId(), t.epoch());
            }
        } catch (GameException e) {
            if (cmd.type() == MoveType.PASS) throw e;
            log.warn("机器人走子被拒，改为弃权: roomId={}, botId={}, code={}", t.roomId(), t.botId(), e.getCode());
            scrabbleService.submitBotMove(t.roomId(), t.epoch(), MoveCommand.pass(t.botId()));
        }
    }

    /**
     * 没有可出的牌：牌袋足够时整架换牌，否则弃权。
     */
    private MoveCommand fallback(ScrabbleState state) {
        if (state.bagSize() >= validator.rules().exchangeMinBag() && !state.rack().isEmpty()) {
            return MoveCommand.exchange(state.playerId(), state.rack().symbols());
        }
        return MoveCommand.pass(state.playerId());
    }

    private record PendingBot(long epoch, ScheduledFuture<?> future) {
    }
}

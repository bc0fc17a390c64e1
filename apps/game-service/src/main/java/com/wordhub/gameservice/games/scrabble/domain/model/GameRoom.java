package com.wordhub.gameservice.games.scrabble.domain.model;

import com.wordhub.gameservice.clock.GameClock;
import com.wordhub.gameservice.games.scrabble.domain.constants.GameMessages;
import com.wordhub.gameservice.games.scrabble.domain.enums.CompletionReason;
import com.wordhub.gameservice.games.scrabble.domain.enums.GameMode;
import com.wordhub.gameservice.games.scrabble.domain.enums.MoveType;
import com.wordhub.gameservice.games.scrabble.domain.enums.RoomEventType;
import com.wordhub.gameservice.games.scrabble.domain.enums.RoomStatus;
import com.wordhub.gameservice.games.scrabble.domain.event.RoomEvent;
import com.wordhub.gameservice.games.scrabble.domain.event.RoomEventSink;
import com.wordhub.gameservice.games.scrabble.domain.exception.ErrorCode;
import com.wordhub.gameservice.games.scrabble.domain.exception.GameException;
import com.wordhub.gameservice.games.scrabble.domain.exception.RoomStateCorruptedException;
import com.wordhub.gameservice.games.scrabble.domain.rule.EndGameScorer;
import com.wordhub.gameservice.games.scrabble.domain.rule.GameRules;
import com.wordhub.gameservice.games.scrabble.domain.rule.MoveContext;
import com.wordhub.gameservice.games.scrabble.domain.rule.MoveValidator;
import com.wordhub.gameservice.games.scrabble.domain.rule.ValidatedMove;
import com.wordhub.gameservice.games.scrabble.domain.turn.TurnStateMachine;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Random;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * GameRoom
 * ---------------------------------------
 * 一局拼字对局的聚合根：棋盘、牌袋、两个座位、回合状态机、棋钟、走子历史。
 *
 * 并发模型：
 *  - 每个房间一把锁，所有读写都在锁内串行执行（单写者）；
 *  - 等锁超过 lockTimeout 抛 ROOM_BUSY，不会无限阻塞；
 *  - 操作中产生的事件先进入 outbox，释放锁之前按顺序交给 {@link RoomEventSink}；
 *  - 每次成功的状态变更递增 epoch，机器人提交时据此丢弃过期结果。
 *
 * 走子被拒时不修改任何状态；内部不变量被破坏时房间被中止（ABANDONED）。
 */
@Slf4j
public class GameRoom {

    private final String id;
    private final RoomSettings settings;
    private final Board board;
    private final TileBag bag;
    private final MoveValidator validator;
    private final GameRules rules;
    private final Clock timeSource;
    private final Random random;
    private final RoomEventSink sink;
    private final Instant createdAt;

    private final Player[] seats = new Player[2];
    private final GameClock clock;
    private final TurnStateMachine turn;
    private final ReentrantLock lock = new ReentrantLock();
    private final List<Move> history = new ArrayList<>();
    private final List<RoomEvent> outbox = new ArrayList<>();
    private final MoveContext context = new Context();

    private int consecutivePasses;
    private int moveNumber;
    private volatile long epoch;
    /** 可被质疑的最近一次出牌 */
    private PlayUndo lastPlay;
    // 最后一人离开后置位，此后不再接受入座
    private boolean closed;
    private GameResult result;
    private volatile Instant finishedAt;

    public GameRoom(String id, RoomSettings settings, Board board, TileBag bag, MoveValidator validator,
                    Clock timeSource, Random random, RoomEventSink sink) {
        this.id = id;
        this.settings = settings;
        this.board = board;
        this.bag = bag;
        this.validator = validator;
        this.rules = validator.rules();
        this.timeSource = timeSource;
        this.random = random;
        this.sink = sink;
        this.createdAt = timeSource.instant();
        this.clock = new GameClock(settings.initialClockMs());
        this.turn = new TurnStateMachine(clock);
    }

    // ========== 入座 / 离开 / 开始 ==========

    /**
     * 入座。已在座时视为重连，返回原座位。
     * 第二人入座且 autoStart 时立即开始对局。
     *
     * @return 座位号
     */
    public int join(PlayerRef ref, String displayName) {
        return locked(() -> {
            int existing = seatOf(ref.id());
            if (existing >= 0) {
                seats[existing].markConnected();
                emitState();
                return existing;
            }
            if (closed) {
                throw new GameException(ErrorCode.ROOM_NOT_FOUND, GameMessages.formatRoomNotFound(id));
            }
            if (status().isTerminal()) {
                throw new GameException(ErrorCode.GAME_NOT_ACTIVE, GameMessages.GAME_NOT_ACTIVE);
            }
            int seat = seats[0] == null ? 0 : seats[1] == null ? 1 : -1;
            if (status() != RoomStatus.WAITING || seat < 0) {
                throw new GameException(ErrorCode.ROOM_FULL, GameMessages.ROOM_FULL);
            }
            seats[seat] = new Player(seat, ref, displayName);
            touch();
            log.info("玩家入座: roomId={}, seat={}, player={}, bot={}", id, seat, ref.id(), ref.isBot());
            if (isFull() && settings.autoStart()) {
                activateLocked();
            } else {
                emitState();
            }
            return seat;
        });
    }

    /**
     * 等待中离开房间。房间因此变空时随即关闭，之后的 join 一律 ROOM_NOT_FOUND。
     * @return 本次离开是否关闭了房间
     */
    public boolean leave(String playerId) {
        return locked(() -> {
            int seat = seatOf(playerId);
            if (seat < 0) return false;
            if (status() != RoomStatus.WAITING) {
                throw new GameException(ErrorCode.GAME_NOT_ACTIVE, GameMessages.LEAVE_NOT_ALLOWED);
            }
            seats[seat] = null;
            touch();
            emitState();
            closed = isEmpty();
            return closed;
        });
    }

    /** 手动开始（autoStart 关闭时使用）；已开始则忽略 */
    public void start() {
        locked(() -> {
            if (status() == RoomStatus.ACTIVE || status() == RoomStatus.PAUSED) return null;
            if (status() != RoomStatus.WAITING) {
                throw new GameException(ErrorCode.GAME_NOT_ACTIVE, GameMessages.GAME_NOT_ACTIVE);
            }
            if (!isFull()) {
                throw new GameException(ErrorCode.GAME_NOT_ACTIVE, GameMessages.ROOM_NOT_READY);
            }
            activateLocked();
            return null;
        });
    }

    // ========== 走子 ==========

    /**
     * 唯一的走子入口：结算时钟 → 校验 → 落地 → 推进回合。
     * @throws GameException 被拒（状态不变）
     */
    public Move submitMove(MoveCommand cmd) {
        return locked(() -> submitLocked(cmd));
    }

    /**
     * 机器人提交：房间版本与 expectedEpoch 不一致或对局已不在进行时不做任何事。
     */
    public Optional<Move> submitIfEpoch(long expectedEpoch, MoveCommand cmd) {
        return locked(() -> {
            expireLocked(timeSource.millis());
            if (epoch != expectedEpoch || status() != RoomStatus.ACTIVE) {
                return Optional.<Move>empty();
            }
            return Optional.of(submitLocked(cmd));
        });
    }

    /** 认输：对手获胜 */
    public void resign(String playerId) {
        locked(() -> {
            long now = timeSource.millis();
            expireLocked(now);
            int seat = requireSeat(playerId);
            if (status() != RoomStatus.ACTIVE) {
                throw new GameException(ErrorCode.GAME_NOT_ACTIVE, GameMessages.GAME_NOT_ACTIVE);
            }
            completeLocked(CompletionReason.RESIGNATION, seat, now);
            emitState();
            return null;
        });
    }

    // ========== 时钟 / 暂停 ==========

    /**
     * 周期驱动：结算时钟、检查断线宽限期，并推送一次 TIMER_SYNC。
     * @return 结算后的房间状态
     */
    public RoomStatus tick() {
        return locked(() -> {
            expireLocked(timeSource.millis());
            if (status() == RoomStatus.ACTIVE) {
                outbox.add(RoomEvent.broadcast(id, RoomEventType.TIMER_SYNC, clock.snapshot()));
            }
            return status();
        });
    }

    public void pause() {
        locked(() -> {
            long now = timeSource.millis();
            expireLocked(now);
            if (status() != RoomStatus.ACTIVE) {
                throw new GameException(ErrorCode.GAME_NOT_ACTIVE, GameMessages.GAME_NOT_ACTIVE);
            }
            turn.pause(now);
            touch();
            log.info("对局暂停: roomId={}", id);
            emitState();
            return null;
        });
    }

    public void resume() {
        locked(() -> {
            if (status() != RoomStatus.PAUSED) {
                throw new GameException(ErrorCode.GAME_NOT_ACTIVE, GameMessages.GAME_NOT_ACTIVE);
            }
            turn.resume(timeSource.millis());
            touch();
            log.info("对局恢复: roomId={}", id);
            emitState();
            return null;
        });
    }

    /**
     * 距当前走时方超时还剩多少毫秒；不在走时返回 -1。
     */
    public long msUntilExpiry() {
        return locked(() -> status() == RoomStatus.ACTIVE ? clock.msUntilExpiry(timeSource.millis()) : -1L);
    }

    // ========== 在线状态 ==========

    /** @return 是否在座 */
    public boolean markConnected(String playerId) {
        return locked(() -> {
            int seat = seatOf(playerId);
            if (seat < 0) return false;
            seats[seat].markConnected();
            return true;
        });
    }

    /** @return 是否在座 */
    public boolean markDisconnected(String playerId) {
        return locked(() -> {
            int seat = seatOf(playerId);
            if (seat < 0) return false;
            seats[seat].markDisconnected(timeSource.millis());
            return true;
        });
    }

    // ========== 机器人 ==========

    /** 当前是否轮到机器人 */
    public Optional<BotTurn> botTurn() {
        return locked(() -> {
            if (status() != RoomStatus.ACTIVE) return Optional.<BotTurn>empty();
            Player p = seats[turn.currentSide()];
            return p.isBot() ? Optional.of(new BotTurn(id, p.id(), epoch)) : Optional.<BotTurn>empty();
        });
    }

    /**
     * 机器人思考用的局面副本；版本已变化时返回 empty。
     */
    public Optional<ScrabbleState> botView(long expectedEpoch) {
        return locked(() -> {
            if (epoch != expectedEpoch || status() != RoomStatus.ACTIVE) return Optional.<ScrabbleState>empty();
            Player p = seats[turn.currentSide()];
            if (!p.isBot()) return Optional.<ScrabbleState>empty();
            return Optional.of(new ScrabbleState(id, epoch, p.id(), board.copy(), p.getRack().copy(),
                    bag.size(), settings.dictionaryId(), settings.mode()));
        });
    }

    // ========== 查询 ==========

    public RoomView view() {
        return locked(this::viewLocked);
    }

    /** 玩家本人的字架 */
    public RackView rackOf(String playerId) {
        return locked(() -> new RackView(id, seats[requireSeat(playerId)].getRack().symbols(), bag.size()));
    }

    /** quick match：等待中、恰有一名人类玩家、且不是本人 */
    public boolean isJoinableBy(String playerId) {
        return locked(() -> {
            if (status() != RoomStatus.WAITING || seatOf(playerId) >= 0) return false;
            int taken = 0;
            for (Player p : seats) {
                if (p != null) {
                    if (p.isBot()) return false;
                    taken++;
                }
            }
            return taken == 1;
        });
    }

    /** 在座的人类玩家 */
    public List<String> humanPlayerIds() {
        return locked(() -> {
            List<String> out = new ArrayList<>(2);
            for (Player p : seats) {
                if (p != null && !p.isBot()) out.add(p.id());
            }
            return out;
        });
    }

    /** 当前行动方；对局不在进行时为 null */
    public String currentPlayerId() {
        return locked(() -> status() == RoomStatus.ACTIVE ? seats[turn.currentSide()].id() : null);
    }

    public String id() { return id; }

    public RoomStatus status() { return turn.status(); }

    public long epoch() { return epoch; }

    public Instant createdAt() { return createdAt; }

    /** 进入终局的时刻；未结束为 null */
    public Instant finishedAt() { return finishedAt; }

    public RoomSettings settings() { return settings; }

    // ========== 内部：走子落地 ==========

    private Move submitLocked(MoveCommand cmd) {
        long now = timeSource.millis();
        expireLocked(now);
        if (status() != RoomStatus.ACTIVE) {
            throw new GameException(ErrorCode.GAME_NOT_ACTIVE, GameMessages.GAME_NOT_ACTIVE);
        }
        ValidatedMove vm = validator.validate(context, cmd);
        int seat = turn.currentSide();
        Player p = seats[seat];
        Move move;
        switch (vm.type()) {
            case PLAY:
                move = applyPlay(seat, p, vm, now);
                break;
            case EXCHANGE:
                move = applyExchange(p, vm, now);
                break;
            case PASS:
                move = applyPass(p, now);
                break;
            case CHALLENGE:
                move = applyChallenge(p, vm, now);
                break;
            default:
                throw new IllegalArgumentException("unsupported move type: " + vm.type());
        }
        touch();
        emitState();
        log.debug("走子提交: roomId={}, move={}", id, move);
        return move;
    }

    private Move applyPlay(int seat, Player p, ValidatedMove vm, long now) {
        List<Tile> used = new ArrayList<>(vm.placements().size());
        for (PlacedTile pt : vm.placements()) {
            Tile t = p.getRack().take(pt.rackSymbol());
            used.add(t);
            board.place(pt.row(), pt.col(), t.asPlayed(pt.letter()));
        }
        p.addScore(vm.score());
        List<Tile> drawn = bag.draw(rules.rackSize() - p.getRack().size());
        p.getRack().addAll(drawn);
        consecutivePasses = 0;

        Move move = record(MoveType.PLAY, p.id(), vm.placements(), 0, vm.wordTexts(), vm.score(), null, now);
        lastPlay = new PlayUndo(seat, vm.placements(), used, drawn, vm.score(), move);
        emitRack(p);
        if (bag.isEmpty() && p.getRack().isEmpty()) {
            completeLocked(CompletionReason.OUT_OF_TILES, seat, now);
        } else {
            advanceLocked(now);
        }
        return move;
    }

    private Move applyExchange(Player p, ValidatedMove vm, long now) {
        List<Tile> out = new ArrayList<>(vm.exchange().size());
        for (char s : vm.exchange()) out.add(p.getRack().take(s));
        // 先抽新牌再放回旧牌
        p.getRack().addAll(bag.draw(out.size()));
        bag.putBack(out);
        consecutivePasses = 0;
        lastPlay = null;

        Move move = record(MoveType.EXCHANGE, p.id(), List.of(), out.size(), List.of(), 0, null, now);
        emitRack(p);
        advanceLocked(now);
        return move;
    }

    private Move applyPass(Player p, long now) {
        consecutivePasses++;
        lastPlay = null;
        Move move = record(MoveType.PASS, p.id(), List.of(), 0, List.of(), 0, null, now);
        if (consecutivePasses >= rules.passLimit()) {
            completeLocked(CompletionReason.PASS_LIMIT, -1, now);
        } else {
            advanceLocked(now);
        }
        return move;
    }

    /**
     * 质疑成功：撤回上一步（牌回字架、新抽的牌回牌袋、扣分），质疑方继续行动；
     * 质疑失败：质疑方失去本回合。两种情况都不影响连续弃权计数。
     */
    private Move applyChallenge(Player challenger, ValidatedMove vm, long now) {
        PlayUndo u = lastPlay;
        lastPlay = null;
        if (!vm.challengeUpheld()) {
            Move move = record(MoveType.CHALLENGE, challenger.id(), List.of(), 0, u.move().words(), 0, Boolean.FALSE, now);
            advanceLocked(now);
            return move;
        }
        Player author = seats[u.seat()];
        for (PlacedTile pt : u.placements()) {
            board.remove(pt.row(), pt.col());
        }
        for (Tile d : u.drawn()) {
            if (!author.getRack().removeExact(d)) {
                throw new RoomStateCorruptedException("drawn tile missing from rack on challenge revert: " + d);
            }
        }
        bag.restoreOnTop(u.drawn());
        author.getRack().addAll(u.used());
        author.subtractScore(u.score());
        log.info("质疑成功: roomId={}, word={}, reverted={}", id, vm.invalidWord(), u.move().moveNumber());
        emitRack(author);
        return record(MoveType.CHALLENGE, challenger.id(), List.of(), 0, u.move().words(), -u.score(), Boolean.TRUE, now);
    }

    private Move record(MoveType type, String playerId, List<PlacedTile> placements, int exchanged,
                        List<String> words, int score, Boolean challengeUpheld, long now) {
        Move move = new Move(++moveNumber, type, playerId, placements, exchanged, words, score,
                Instant.ofEpochMilli(now), challengeUpheld);
        history.add(move);
        outbox.add(RoomEvent.broadcast(id, RoomEventType.MOVE, move));
        return move;
    }

    private void advanceLocked(long now) {
        turn.advance(now);
        Player next = seats[turn.currentSide()];
        outbox.add(RoomEvent.broadcast(id, RoomEventType.TURN, turnPayload(next)));
    }

    // ========== 内部：开局 / 终局 ==========

    private void activateLocked() {
        for (Player p : seats) {
            p.getRack().addAll(bag.draw(rules.rackSize()));
        }
        int startSide = random.nextInt(2);
        turn.activate(startSide, timeSource.millis());
        touch();
        log.info("对局开始: roomId={}, first={}", id, seats[startSide].id());
        emitState();
        outbox.add(RoomEvent.broadcast(id, RoomEventType.TURN, turnPayload(seats[startSide])));
        for (Player p : seats) emitRack(p);
    }

    /**
     * 结算时钟；有一方归零即超时判负，人类玩家断线超过宽限期即判负放弃。
     */
    private void expireLocked(long now) {
        if (status() != RoomStatus.ACTIVE) return;
        OptionalInt expired = clock.tick(now);
        if (expired.isPresent()) {
            int side = expired.getAsInt();
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("side", side);
            payload.put("playerId", seats[side].id());
            outbox.add(RoomEvent.broadcast(id, RoomEventType.TIMER_EXPIRED, payload));
            completeLocked(CompletionReason.TIMEOUT, side, now);
            emitState();
            return;
        }
        long grace = settings.disconnectGrace().toMillis();
        for (Player p : seats) {
            if (!p.isBot() && !p.isConnected() && now - p.getDisconnectedAt() >= grace) {
                completeLocked(CompletionReason.FORFEIT, p.getSeat(), now);
                emitState();
                return;
            }
        }
    }

    private void completeLocked(CompletionReason reason, int decisiveSeat, long now) {
        if (reason == CompletionReason.FORFEIT) {
            turn.abandon(now);
        } else {
            turn.complete(now);
        }
        result = EndGameScorer.settle(seats, reason, decisiveSeat);
        finishedAt = Instant.ofEpochMilli(now);
        lastPlay = null;
        touch();
        log.info("对局结束: roomId={}, status={}, reason={}, winner={}", id, status(), reason, result.winnerId());
        outbox.add(RoomEvent.broadcast(id, RoomEventType.GAME_COMPLETED, result));
    }

    private void abortLocked(RoomStateCorruptedException e) {
        log.error("房间状态损坏，强制中止: roomId={}", id, e);
        long now = timeSource.millis();
        turn.abort(now);
        Map<String, Integer> scores = new LinkedHashMap<>();
        for (Player p : seats) {
            if (p != null) scores.put(p.id(), p.getScore());
        }
        result = new GameResult(null, null, CompletionReason.ABORTED, scores);
        finishedAt = Instant.ofEpochMilli(now);
        lastPlay = null;
        touch();
        outbox.add(RoomEvent.broadcast(id, RoomEventType.GAME_COMPLETED, result));
        emitState();
    }

    // ========== 内部：工具 ==========

    private <T> T locked(Supplier<T> action) {
        boolean acquired;
        try {
            acquired = lock.tryLock(settings.lockTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GameException(ErrorCode.ROOM_BUSY, GameMessages.ROOM_BUSY);
        }
        if (!acquired) {
            throw new GameException(ErrorCode.ROOM_BUSY, GameMessages.ROOM_BUSY);
        }
        try {
            return action.get();
        } catch (RoomStateCorruptedException e) {
            abortLocked(e);
            throw e;
        } finally {
            try {
                flush();
            } finally {
                lock.unlock();
            }
        }
    }

    private void flush() {
        if (outbox.isEmpty()) return;
        List<RoomEvent> batch = new ArrayList<>(outbox);
        outbox.clear();
        try {
            sink.publish(batch);
        } catch (RuntimeException e) {
            log.warn("房间事件发送失败: roomId={}, count={}", id, batch.size(), e);
        }
    }

    private void touch() {
        epoch++;
    }

    private void emitState() {
        outbox.add(RoomEvent.broadcast(id, RoomEventType.STATE, viewLocked()));
    }

    private void emitRack(Player p) {
        if (p.isBot()) return;
        outbox.add(RoomEvent.privateTo(id, p.id(), RoomEventType.RACK,
                new RackView(id, p.getRack().symbols(), bag.size())));
    }

    private Map<String, Object> turnPayload(Player next) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("playerId", next.id());
        m.put("seat", next.getSeat());
        m.put("moveNumber", moveNumber);
        return m;
    }

    private RoomView viewLocked() {
        List<PlayerView> players = new ArrayList<>(2);
        int current = turn.currentSide();
        boolean live = status() == RoomStatus.ACTIVE;
        for (Player p : seats) {
            if (p == null) continue;
            players.add(new PlayerView(p.getSeat(), p.id(), p.getDisplayName(), p.isBot(), p.getScore(),
                    p.getRack().size(), p.isConnected(), clock.remaining(p.getSeat()),
                    live && p.getSeat() == current));
        }
        String currentId = live ? seats[current].id() : null;
        Move last = history.isEmpty() ? null : history.get(history.size() - 1);
        return new RoomView(id, status(), settings.mode(), settings.dictionaryId(), board.rows(), players,
                currentId, consecutivePasses, moveNumber, bag.size(), clock.snapshot(), last, result,
                createdAt, epoch);
    }

    private int seatOf(String playerId) {
        for (int i = 0; i < seats.length; i++) {
            if (seats[i] != null && seats[i].id().equals(playerId)) return i;
        }
        return -1;
    }

    private int requireSeat(String playerId) {
        int seat = seatOf(playerId);
        if (seat < 0) {
            throw new GameException(ErrorCode.NOT_YOUR_TURN, GameMessages.NOT_IN_ROOM);
        }
        return seat;
    }

    private boolean isFull() {
        return seats[0] != null && seats[1] != null;
    }

    private boolean isEmpty() {
        return seats[0] == null && seats[1] == null;
    }

    /**
     * 上一次出牌的撤回信息。
     */
    private record PlayUndo(int seat, List<PlacedTile> placements, List<Tile> used, List<Tile> drawn,
                            int score, Move move) {
    }

    /**
     * 交给校验器的只读视图。
     */
    private final class Context implements MoveContext {

        @Override
        public Board board() { return board; }

        @Override
        public int seatOf(String playerId) { return GameRoom.this.seatOf(playerId); }

        @Override
        public Rack rackOf(int seat) { return seats[seat].getRack(); }

        @Override
        public int currentSide() { return turn.currentSide(); }

        @Override
        public int bagSize() { return bag.size(); }

        @Override
        public String dictionaryId() { return settings.dictionaryId(); }

        @Override
        public GameMode mode() { return settings.mode(); }

        @Override
        public Optional<Move> challengeablePlay() {
            return Optional.ofNullable(lastPlay).map(PlayUndo::move);
        }
    }
}

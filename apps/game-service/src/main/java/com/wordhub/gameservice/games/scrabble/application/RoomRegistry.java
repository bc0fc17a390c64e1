package com.wordhub.gameservice.games.scrabble.application;

import com.wordhub.gameservice.games.scrabble.domain.constants.GameMessages;
import com.wordhub.gameservice.games.scrabble.domain.enums.RoomStatus;
import com.wordhub.gameservice.games.scrabble.domain.exception.ErrorCode;
import com.wordhub.gameservice.games.scrabble.domain.exception.GameException;
import com.wordhub.gameservice.games.scrabble.domain.model.GameRoom;
import com.wordhub.gameservice.games.scrabble.domain.model.PlayerRef;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * RoomRegistry
 * ---------------------------------------
 * 进程内的房间表：建房、按 id 查找、快速匹配、清理已结束的房间。
 *
 * 房间之间互不影响；快速匹配用一把注册表锁串行化“找房或建房”，
 * 保证两个并发的匹配请求不会各建一个房间而错过彼此。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RoomRegistry {

    private final GameRoomFactory factory;

    private final Map<String, GameRoom> rooms = new ConcurrentHashMap<>();
    private final ReentrantLock matchLock = new ReentrantLock();

    public GameRoom create(RoomOptions options) {
        GameRoom room = factory.create(options);
        rooms.put(room.id(), room);
        log.info("房间创建: roomId={}, mode={}, dictionary={}", room.id(),
                room.settings().mode(), room.settings().dictionaryId());
        return room;
    }

    /**
     * @throws GameException ROOM_NOT_FOUND
     */
    public GameRoom get(String roomId) {
        return find(roomId).orElseThrow(() ->
                new GameException(ErrorCode.ROOM_NOT_FOUND, GameMessages.formatRoomNotFound(roomId)));
    }

    public Optional<GameRoom> find(String roomId) {
        return roomId == null ? Optional.empty() : Optional.ofNullable(rooms.get(roomId));
    }

    /**
     * 快速匹配：坐进最早创建的可加入房间，没有则新建一个并坐下。
     * @return 玩家所在的房间
     */
    public GameRoom quickJoin(PlayerRef ref, String displayName) {
        matchLock.lock();
        try {
            List<GameRoom> candidates = new ArrayList<>(rooms.values());
            candidates.sort(Comparator.comparing(GameRoom::createdAt));
            for (GameRoom room : candidates) {
                if (!room.isJoinableBy(ref.id())) continue;
                try {
                    room.join(ref, displayName);
                    return room;
                } catch (GameException e) {
                    // 房间刚被别的入口坐满或结束，继续找下一个
                    log.debug("快速匹配跳过房间: roomId={}, code={}", room.id(), e.getCode());
                }
            }
            GameRoom room = create(RoomOptions.defaults());
            room.join(ref, displayName);
            return room;
        } finally {
            matchLock.unlock();
        }
    }

    /**
     * 只移除仍是同一实例的房间；房间已被替换或移除时不做任何事。
     */
    public void remove(GameRoom room) {
        if (rooms.remove(room.id(), room)) {
            log.info("房间移除: roomId={}", room.id());
        }
    }

    public List<GameRoom> all() {
        return new ArrayList<>(rooms.values());
    }

    public int size() {
        return rooms.size();
    }

    /**
     * 移除结束时间早于 now - retention 的终局房间。
     * @return 被移除的房间 id
     */
    public List<String> evictFinished(Instant now, Duration retention) {
        Instant cutoff = now.minus(retention);
        List<String> evicted = new ArrayList<>();
        for (GameRoom room : rooms.values()) {
            RoomStatus status = room.status();
            Instant finishedAt = room.finishedAt();
            if (status.isTerminal() && finishedAt != null && !finishedAt.isAfter(cutoff)) {
                if (rooms.remove(room.id(), room)) {
                    evicted.add(room.id());
                }
            }
        }
        if (!evicted.isEmpty()) {
            log.info("清理已结束房间: count={}", evicted.size());
        }
        return evicted;
    }
}

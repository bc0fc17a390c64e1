package com.wordhub.gameservice.games.scrabble.service.impl;

import com.wordhub.gameservice.games.scrabble.application.BotCatalog;
import com.wordhub.gameservice.games.scrabble.application.RoomChangedEvent;
import com.wordhub.gameservice.games.scrabble.application.RoomOptions;
import com.wordhub.gameservice.games.scrabble.application.RoomRegistry;
import com.wordhub.gameservice.games.scrabble.application.config.BotProfile;
import com.wordhub.gameservice.games.scrabble.domain.enums.RoomEventType;
import com.wordhub.gameservice.games.scrabble.domain.enums.RoomStatus;
import com.wordhub.gameservice.games.scrabble.domain.event.RoomEvent;
import com.wordhub.gameservice.games.scrabble.domain.event.RoomEventSink;
import com.wordhub.gameservice.games.scrabble.domain.model.GameRoom;
import com.wordhub.gameservice.games.scrabble.domain.model.Move;
import com.wordhub.gameservice.games.scrabble.domain.model.MoveCommand;
import com.wordhub.gameservice.games.scrabble.domain.model.PlayerRef;
import com.wordhub.gameservice.games.scrabble.domain.model.RackView;
import com.wordhub.gameservice.games.scrabble.domain.model.RoomView;
import com.wordhub.gameservice.games.scrabble.service.ScrabbleService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

@Slf4j
@Service
@RequiredArgsConstructor
public class ScrabbleServiceImpl implements ScrabbleService {

    private final RoomRegistry registry;
    private final BotCatalog botCatalog;
    private final RoomEventSink sink;
    private final ApplicationEventPublisher events;
    private final Clock clock;

    // ====== 房间与座位 ======

    @Override
    public RoomView createRoom(RoomOptions options) {
        GameRoom room = registry.create(options);
        return notifying(room.id(), room::view);
    }

    @Override
    public RoomView join(String roomId, String userId, String displayName) {
        GameRoom room = registry.get(roomId);
        return notifying(roomId, () -> {
            room.join(PlayerRef.human(userId), displayName);
            return room.view();
        });
    }

    @Override
    public RoomView quickJoin(String userId, String displayName) {
        GameRoom room = registry.quickJoin(PlayerRef.human(userId), displayName);
        return notifying(room.id(), room::view);
    }

    @Override
    public RoomView attachBot(String roomId, String botId) {
        BotProfile profile = botCatalog.get(botId);
        GameRoom room = registry.get(roomId);
        return notifying(roomId, () -> {
            room.join(PlayerRef.bot(profile.getId()), profile.getName());
            log.info("机器人入座: roomId={}, botId={}, difficulty={}", roomId, profile.getId(), profile.getDifficulty());
            return room.view();
        });
    }

    @Override
    public void leave(String roomId, String userId) {
        GameRoom room = registry.get(roomId);
        notifying(roomId, () -> {
            // leave 在房间锁内关闭空房，之后的 join 不会再坐进这个实例
            if (room.leave(userId)) {
                registry.remove(room);
            }
            return null;
        });
    }

    @Override
    public RoomView start(String roomId) {
        GameRoom room = registry.get(roomId);
        return notifying(roomId, () -> {
            room.start();
            return room.view();
        });
    }

    // ====== 走子 ======

    @Override
    public Move submitMove(String roomId, MoveCommand cmd) {
        GameRoom room = registry.get(roomId);
        return notifying(roomId, () -> room.submitMove(cmd));
    }

    @Override
    public Move pass(String roomId, String playerId) {
        return submitMove(roomId, MoveCommand.pass(playerId));
    }

    @Override
    public RoomView resign(String roomId, String playerId) {
        GameRoom room = registry.get(roomId);
        return notifying(roomId, () -> {
            room.resign(playerId);
            return room.view();
        });
    }

    @Override
    public Optional<Move> submitBotMove(String roomId, long epoch, MoveCommand cmd) {
        Optional<GameRoom> room = registry.find(roomId);
        if (room.isEmpty()) return Optional.empty();
        return notifying(roomId, () -> room.get().submitIfEpoch(epoch, cmd));
    }

    // ====== 暂停 / 计时 / 在线 ======

    @Override
    public RoomView pause(String roomId) {
        GameRoom room = registry.get(roomId);
        return notifying(roomId, () -> {
            room.pause();
            return room.view();
        });
    }

    @Override
    public RoomView resume(String roomId) {
        GameRoom room = registry.get(roomId);
        return notifying(roomId, () -> {
            room.resume();
            return room.view();
        });
    }

    @Override
    public RoomStatus tick(String roomId) {
        Optional<GameRoom> room = registry.find(roomId);
        if (room.isEmpty()) return null;
        return notifying(roomId, room.get()::tick);
    }

    @Override
    public void heartbeat(String roomId, String playerId) {
        GameRoom room = registry.get(roomId);
        if (room.markConnected(playerId)) {
            sink.publish(List.of(RoomEvent.privateTo(roomId, playerId, RoomEventType.PONG,
                    Map.of("serverTime", clock.millis()))));
        }
    }

    @Override
    public void playerDisconnected(String roomId, String playerId) {
        registry.find(roomId).ifPresent(room -> {
            if (room.markDisconnected(playerId)) {
                log.info("玩家断线: roomId={}, player={}", roomId, playerId);
            }
        });
    }

    // ====== 查询 ======

    @Override
    public RoomView getRoom(String roomId) {
        return registry.get(roomId).view();
    }

    @Override
    public RackView getRack(String roomId, String playerId) {
        return registry.get(roomId).rackOf(playerId);
    }

    @Override
    public List<RoomView> listRooms() {
        List<GameRoom> rooms = registry.all();
        rooms.sort(Comparator.comparing(GameRoom::createdAt));
        List<RoomView> out = new ArrayList<>(rooms.size());
        for (GameRoom r : rooms) out.add(r.view());
        return out;
    }

    @Override
    public List<BotProfile> listBots() {
        return botCatalog.list();
    }

    /**
     * 执行一次房间操作；无论成功与否都发布 RoomChangedEvent（被拒的操作也可能已结算超时）。
     */
    private <T> T notifying(String roomId, Supplier<T> action) {
        try {
            return action.get();
        } finally {
            events.publishEvent(new RoomChangedEvent(roomId));
        }
    }
}

package com.wordhub.gameservice.games.scrabble.service.impl;

import com.wordhub.gameservice.games.scrabble.application.RoomOptions;
import com.wordhub.gameservice.games.scrabble.domain.enums.CompletionReason;
import com.wordhub.gameservice.games.scrabble.domain.enums.GameMode;
import com.wordhub.gameservice.games.scrabble.domain.enums.RoomStatus;
import com.wordhub.gameservice.games.scrabble.domain.exception.ErrorCode;
import com.wordhub.gameservice.games.scrabble.domain.exception.GameException;
import com.wordhub.gameservice.games.scrabble.domain.model.RoomView;
import com.wordhub.gameservice.games.scrabble.service.ScrabbleService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * 服务层端到端：机器人自动代走、棋钟到点判负、快速匹配、离开。
 */
@SpringBootTest(properties = {
        "wordhub.game.bot-compute-budget=100ms",
        "wordhub.game.sync-interval=1s",
        "wordhub.bots[0].id=bot-fast",
        "wordhub.bots[0].name=Speedy",
        "wordhub.bots[0].difficulty=EASY",
        "wordhub.bots[0].min-think-ms=50",
        "wordhub.bots[0].max-think-ms=300"
})
class ScrabbleServiceImplTest {

    @Autowired
    private ScrabbleService service;

    @Test
    void botAnswersAutomatically() {
        String roomId = service.createRoom(RoomOptions.defaults()).roomId();
        service.join(roomId, "alice", "Alice");
        RoomView view = service.attachBot(roomId, "bot-fast");
        assertThat(view.status()).isEqualTo(RoomStatus.ACTIVE);

        if ("alice".equals(view.currentPlayerId())) {
            service.pass(roomId, "alice");
        }

        await().atMost(Duration.ofSeconds(10)).until(() -> {
            RoomView v = service.getRoom(roomId);
            return "alice".equals(v.currentPlayerId()) && v.lastMove() != null
                    && "bot-fast".equals(v.lastMove().playerId());
        });
        service.resign(roomId, "alice");
    }

    @Test
    void runningOutOfTimeEndsTheGameWithoutAnyRequest() {
        String roomId = service.createRoom(new RoomOptions(GameMode.CLASSIC, "TWL", 300L)).roomId();
        service.join(roomId, "alice", "Alice");
        RoomView active = service.join(roomId, "bob", "Bob");
        String slow = active.currentPlayerId();

        await().atMost(Duration.ofSeconds(5)).until(() -> service.getRoom(roomId).status() == RoomStatus.COMPLETED);

        RoomView done = service.getRoom(roomId);
        assertThat(done.result().reason()).isEqualTo(CompletionReason.TIMEOUT);
        assertThat(done.result().loserId()).isEqualTo(slow);
    }

    @Test
    void quickJoinPairsPlayersAndLeaveDropsEmptyRoom() {
        RoomView first = service.quickJoin("qa-1", null);
        RoomView second = service.quickJoin("qa-2", null);
        assertThat(second.roomId()).isEqualTo(first.roomId());
        assertThat(second.status()).isEqualTo(RoomStatus.ACTIVE);
        service.resign(first.roomId(), "qa-1");

        String lonely = service.createRoom(RoomOptions.defaults()).roomId();
        service.join(lonely, "qa-3", "Q3");
        service.leave(lonely, "qa-3");

        assertThatThrownBy(() -> service.getRoom(lonely))
                .isInstanceOf(GameException.class)
                .extracting("code").isEqualTo(ErrorCode.ROOM_NOT_FOUND);
    }

    @Test
    void rackIsPrivateToSeatedPlayers() {
        String roomId = service.createRoom(RoomOptions.defaults()).roomId();
        service.join(roomId, "alice", "Alice");
        service.join(roomId, "bob", "Bob");

        assertThat(service.getRack(roomId, "alice").tiles()).hasSize(7);
        assertThatThrownBy(() -> service.getRack(roomId, "mallory"))
                .isInstanceOf(GameException.class);
        service.resign(roomId, "bob");
    }

    @Test
    void pauseAndResumeThroughService() {
        String roomId = service.createRoom(RoomOptions.defaults()).roomId();
        service.join(roomId, "alice", "Alice");
        service.join(roomId, "bob", "Bob");

        assertThat(service.pause(roomId).status()).isEqualTo(RoomStatus.PAUSED);
        assertThat(service.tick(roomId)).isEqualTo(RoomStatus.PAUSED);
        assertThat(service.resume(roomId).status()).isEqualTo(RoomStatus.ACTIVE);
        assertThat(service.tick("no-such-room")).isNull();
        service.resign(roomId, "alice");
    }
}

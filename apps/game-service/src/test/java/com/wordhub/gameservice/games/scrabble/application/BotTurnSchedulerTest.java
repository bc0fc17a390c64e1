package com.wordhub.gameservice.games.scrabble.application;

import com.wordhub.gameservice.games.scrabble.application.config.BotCatalogProperties;
import com.wordhub.gameservice.games.scrabble.application.config.BotProfile;
import com.wordhub.gameservice.games.scrabble.application.config.GameProperties;
import com.wordhub.gameservice.games.scrabble.domain.enums.BotDifficulty;
import com.wordhub.gameservice.games.scrabble.domain.enums.GameMode;
import com.wordhub.gameservice.games.scrabble.domain.enums.MoveType;
import com.wordhub.gameservice.games.scrabble.domain.model.GameRoom;
import com.wordhub.gameservice.games.scrabble.domain.model.Move;
import com.wordhub.gameservice.games.scrabble.domain.model.MoveCommand;
import com.wordhub.gameservice.games.scrabble.domain.model.PlayerRef;
import com.wordhub.gameservice.games.scrabble.domain.rule.MoveValidator;
import com.wordhub.gameservice.games.scrabble.service.ScrabbleService;
import com.wordhub.gameservice.games.scrabble.support.ScrabbleFixtures.MutableClock;
import com.wordhub.gameservice.games.scrabble.support.ScrabbleFixtures.RecordingSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ScheduledThreadPoolExecutor;

import static com.wordhub.gameservice.games.scrabble.support.ScrabbleFixtures.bag;
import static com.wordhub.gameservice.games.scrabble.support.ScrabbleFixtures.room;
import static com.wordhub.gameservice.games.scrabble.support.ScrabbleFixtures.unavailableValidator;
import static com.wordhub.gameservice.games.scrabble.support.ScrabbleFixtures.validator;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BotTurnSchedulerTest {

    private static final String BOT = "bot-fast";
    private static final String FILLER = "EEEEEEEEEEEEEEEEEEEE";

    private final MutableClock clock = new MutableClock(1_000_000L);
    private final RecordingSink sink = new RecordingSink();
    private MoveValidator validator = validator();
    private final ScrabbleService service = mock(ScrabbleService.class);
    private final GameRoomFactory factory = mock(GameRoomFactory.class);
    private ScheduledThreadPoolExecutor executor;
    private RoomRegistry registry;
    private BotTurnScheduler scheduler;
    private String botRack = "CATDOGS";

    @BeforeEach
    void setUp() {
        executor = new ScheduledThreadPoolExecutor(1);
        registry = new RoomRegistry(factory);
        when(factory.create(any())).thenAnswer(inv ->
                room("r-bot", GameMode.CLASSIC, bag(FILLER, botRack, "CATDOGS"), validator, clock, sink));
        when(service.submitBotMove(anyString(), anyLong(), any())).thenAnswer(inv ->
                registry.get(inv.<String>getArgument(0))
                        .submitIfEpoch(inv.<Long>getArgument(1), inv.<MoveCommand>getArgument(2)));

        scheduler = newScheduler();
    }

    private BotTurnScheduler newScheduler() {
        BotCatalogProperties catalogProps = new BotCatalogProperties();
        catalogProps.setBots(List.of(new BotProfile(BOT, "Speedy", BotDifficulty.EASY, 150L, 250L, 0.0, 1.0, 0.0, 0.0)));
        GameProperties props = new GameProperties();
        props.setBotComputeBudget(Duration.ofMillis(50));
        return new BotTurnScheduler(executor, registry, service, new BotCatalog(catalogProps), validator, props);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void botPlaysWhenItIsItsTurn() {
        GameRoom room = botRoom();
        long epoch = room.epoch();

        scheduler.reconcile(room.id());

        assertThat(scheduler.hasPending(room.id())).isTrue();
        await().atMost(Duration.ofSeconds(5)).until(() -> "alice".equals(room.currentPlayerId()));
        Move last = room.view().lastMove();
        assertThat(last.playerId()).isEqualTo(BOT);
        assertThat(last.type()).isEqualTo(MoveType.PLAY);
        verify(service).submitBotMove(eq(room.id()), eq(epoch), any(MoveCommand.class));
        await().atMost(Duration.ofSeconds(1)).until(() -> !scheduler.hasPending(room.id()));
    }

    @Test
    void repeatedNotificationsForSameEpochScheduleOnce() {
        GameRoom room = botRoom();

        scheduler.reconcile(room.id());
        scheduler.reconcile(room.id());
        scheduler.reconcile(room.id());

        assertThat(scheduler.pendingCount()).isEqualTo(1);
        await().atMost(Duration.ofSeconds(5)).until(() -> "alice".equals(room.currentPlayerId()));
        verify(service, times(1)).submitBotMove(anyString(), anyLong(), any());
    }

    @Test
    void nothingScheduledOnHumanTurn() {
        GameRoom room = registry.create(RoomOptions.defaults());
        room.join(PlayerRef.human("alice"), "Alice");
        room.join(PlayerRef.bot(BOT), "Speedy");
        if (BOT.equals(room.currentPlayerId())) {
            room.submitMove(MoveCommand.pass(BOT));
        }

        scheduler.reconcile(room.id());

        assertThat(scheduler.hasPending(room.id())).isFalse();
    }

    @Test
    void exchangesWholeRackWhenNothingIsPlayable() {
        botRack = "EEEEEEE";
        GameRoom room = botRoom();

        scheduler.reconcile(room.id());

        await().atMost(Duration.ofSeconds(5)).until(() -> "alice".equals(room.currentPlayerId()));
        Move last = room.view().lastMove();
        assertThat(last.type()).isEqualTo(MoveType.EXCHANGE);
        assertThat(last.exchangedCount()).isEqualTo(7);
    }

    @Test
    void unavailableDictionaryStillProducesFallbackMove() {
        validator = unavailableValidator();
        scheduler = newScheduler();
        GameRoom room = botRoom();

        scheduler.reconcile(room.id());

        await().atMost(Duration.ofSeconds(5)).until(() -> "alice".equals(room.currentPlayerId()));
        Move last = room.view().lastMove();
        assertThat(last.playerId()).isEqualTo(BOT);
        assertThat(last.type()).isEqualTo(MoveType.EXCHANGE);
    }

    @Test
    void staleTaskDoesNothingAfterRoomMovedOn() {
        GameRoom room = botRoom();
        scheduler.reconcile(room.id());

        room.resign("alice");

        await().atMost(Duration.ofSeconds(5)).until(() -> !scheduler.hasPending(room.id()));
        verify(service, never()).submitBotMove(anyString(), anyLong(), any());
    }

    @Test
    void thinkTimeStaysWithinProfileBounds() {
        BotProfile profile = new BotProfile("b", "B", BotDifficulty.MEDIUM, 100L, 400L, 0.1, 1.0, 0.5, 0.3);

        long budget = scheduler.computeBudget(profile);

        assertThat(budget).isEqualTo(50);
        for (int i = 0; i < 50; i++) {
            long delay = scheduler.thinkDelay(profile, budget);
            assertThat(delay + budget).isBetween(100L, 400L);
        }
    }

    /** 人类先入座，机器人后入座；保证轮到机器人 */
    private GameRoom botRoom() {
        GameRoom room = registry.create(RoomOptions.defaults());
        room.join(PlayerRef.human("alice"), "Alice");
        room.join(PlayerRef.bot(BOT), "Speedy");
        if ("alice".equals(room.currentPlayerId())) {
            room.submitMove(MoveCommand.pass("alice"));
        }
        return room;
    }
}

package com.wordhub.gameservice.games.scrabble.support;

import com.wordhub.gameservice.games.scrabble.domain.dictionary.WordOracle;
import com.wordhub.gameservice.games.scrabble.domain.enums.GameMode;
import com.wordhub.gameservice.games.scrabble.domain.enums.RoomEventType;
import com.wordhub.gameservice.games.scrabble.domain.event.RoomEvent;
import com.wordhub.gameservice.games.scrabble.domain.event.RoomEventSink;
import com.wordhub.gameservice.games.scrabble.domain.model.Board;
import com.wordhub.gameservice.games.scrabble.domain.model.Cell;
import com.wordhub.gameservice.games.scrabble.domain.model.GameRoom;
import com.wordhub.gameservice.games.scrabble.domain.model.Premium;
import com.wordhub.gameservice.games.scrabble.domain.model.RoomSettings;
import com.wordhub.gameservice.games.scrabble.domain.model.Tile;
import com.wordhub.gameservice.games.scrabble.domain.model.TileBag;
import com.wordhub.gameservice.games.scrabble.domain.rule.GameRules;
import com.wordhub.gameservice.games.scrabble.domain.rule.MoveValidator;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * 领域测试共用的小工具：可调时钟、内存词典、朴素棋盘、固定顺序牌袋、事件收集器。
 */
public final class ScrabbleFixtures {

    public static final Set<String> WORDS = Set.of(
            "CAT", "CATS", "ACT", "AT", "TA", "DOG", "DOGS", "GO", "TO", "COD", "COT", "GOD",
            "SAT", "TAD", "DOT", "OAT", "SOD", "TOG", "COG", "ADO", "DO", "OD", "SO", "AS", "GAS");

    public static final Map<Character, Integer> POINTS = Map.ofEntries(
            Map.entry('A', 1), Map.entry('B', 3), Map.entry('C', 3), Map.entry('D', 2), Map.entry('E', 1),
            Map.entry('F', 4), Map.entry('G', 2), Map.entry('H', 4), Map.entry('I', 1), Map.entry('J', 8),
            Map.entry('K', 5), Map.entry('L', 1), Map.entry('M', 3), Map.entry('N', 1), Map.entry('O', 1),
            Map.entry('P', 3), Map.entry('Q', 10), Map.entry('R', 1), Map.entry('S', 1), Map.entry('T', 1),
            Map.entry('U', 1), Map.entry('V', 4), Map.entry('W', 4), Map.entry('X', 8), Map.entry('Y', 4),
            Map.entry('Z', 10));

    private ScrabbleFixtures() {
    }

    /** 同步执行的内存词典 */
    public static WordOracle oracle() {
        return new WordOracle((dict, word) -> WORDS.contains(word), Runnable::run, Duration.ofSeconds(1), 1000);
    }

    public static MoveValidator validator() {
        return new MoveValidator(oracle(), GameRules.standard());
    }

    public static MoveValidator validator(GameRules rules) {
        return new MoveValidator(oracle(), rules);
    }

    /** 词典协作方一直失败，任何需要查词的走子都会得到 DICTIONARY_UNAVAILABLE */
    public static MoveValidator unavailableValidator() {
        WordOracle down = new WordOracle((dict, word) -> {
            throw new IllegalStateException("dictionary down");
        }, Runnable::run, Duration.ofSeconds(1), 10);
        return new MoveValidator(down, GameRules.standard());
    }

    /** 只有中心格带奖励（双倍单词）的方形棋盘 */
    public static Board plainBoard(int size) {
        Cell[][] cells = new Cell[size][size];
        int center = size / 2;
        for (int r = 0; r < size; r++) {
            for (int c = 0; c < size; c++) {
                cells[r][c] = new Cell(r, c, r == center && c == center ? Premium.CENTER : Premium.NONE);
            }
        }
        return new Board(cells);
    }

    public static Tile tile(char letter) {
        return letter == Tile.BLANK ? Tile.blankTile() : Tile.of(letter, POINTS.get(letter));
    }

    public static List<Tile> tiles(String letters) {
        List<Tile> out = new ArrayList<>(letters.length());
        for (char c : letters.toCharArray()) out.add(tile(c));
        return out;
    }

    /**
     * 开局时座位 0 先抽 seat0，座位 1 再抽 seat1，之后从 filler 末尾补牌。
     */
    public static TileBag bag(String filler, String seat1, String seat0) {
        List<Tile> all = new ArrayList<>(tiles(filler));
        all.addAll(tiles(seat1));
        all.addAll(tiles(seat0));
        return TileBag.ofTiles(all, new Random(7));
    }

    public static RoomSettings settings(GameMode mode, long clockMs) {
        return new RoomSettings(mode, "TWL", "plain-15", "en", clockMs, true,
                Duration.ofMillis(500), Duration.ofSeconds(30));
    }

    public static GameRoom room(String id, GameMode mode, TileBag bag, MoveValidator validator,
                                Clock clock, RoomEventSink sink) {
        return new GameRoom(id, settings(mode, 60_000L), plainBoard(15), bag, validator, clock, new Random(42), sink);
    }

    /**
     * 可手动拨动的时钟。
     */
    public static final class MutableClock extends Clock {

        private volatile long millis;

        public MutableClock(long startMillis) {
            this.millis = startMillis;
        }

        public void advance(long ms) {
            millis += ms;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public long millis() {
            return millis;
        }

        @Override
        public Instant instant() {
            return Instant.ofEpochMilli(millis);
        }
    }

    /**
     * 收集房间发出的全部事件。
     */
    public static final class RecordingSink implements RoomEventSink {

        private final List<RoomEvent> events = new CopyOnWriteArrayList<>();

        @Override
        public void publish(List<RoomEvent> batch) {
            events.addAll(batch);
        }

        public List<RoomEvent> events() {
            return events;
        }

        public List<RoomEvent> ofType(RoomEventType type) {
            return events.stream().filter(e -> e.type() == type).collect(Collectors.toList());
        }

        public void clear() {
            events.clear();
        }
    }
}

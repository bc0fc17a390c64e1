package com.wordhub.gameservice.games.scrabble.application;

import com.wordhub.gameservice.games.scrabble.application.config.DictionaryProperties;
import com.wordhub.gameservice.games.scrabble.application.config.GameProperties;
import com.wordhub.gameservice.games.scrabble.domain.event.RoomEventSink;
import com.wordhub.gameservice.games.scrabble.domain.model.Board;
import com.wordhub.gameservice.games.scrabble.domain.model.GameRoom;
import com.wordhub.gameservice.games.scrabble.domain.model.RoomSettings;
import com.wordhub.gameservice.games.scrabble.domain.model.TileBag;
import com.wordhub.gameservice.games.scrabble.domain.repository.GameAssetRepository;
import com.wordhub.gameservice.games.scrabble.domain.rule.MoveValidator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Random;
import java.util.UUID;

/**
 * 组装一个新房间：棋盘与牌袋来自资产仓储，参数来自配置与建房请求。
 */
@Component
@RequiredArgsConstructor
public class GameRoomFactory {

    private final GameProperties props;
    private final DictionaryProperties dictionaryProps;
    private final GameAssetRepository assets;
    private final MoveValidator validator;
    private final RoomEventSink sink;
    private final Clock clock;

    public GameRoom create(RoomOptions options) {
        RoomOptions o = options == null ? RoomOptions.defaults() : options;
        RoomSettings settings = new RoomSettings(
                o.mode() != null ? o.mode() : props.getMode(),
                o.dictionaryId() != null ? o.dictionaryId() : props.getDictionaryId(),
                props.getBoardConfigId(),
                props.getTileSetId(),
                o.initialClockMs() != null ? o.initialClockMs() : props.getInitialClockMs(),
                props.isAutoStart(),
                props.getLockTimeout(),
                props.getDisconnectGrace());
        if ("classpath".equals(dictionaryProps.getSource())
                && !dictionaryProps.getWordLists().containsKey(settings.dictionaryId())) {
            throw new IllegalArgumentException("unknown dictionary: " + settings.dictionaryId());
        }
        if (settings.initialClockMs() <= 0) {
            throw new IllegalArgumentException("initialClockMs must be positive");
        }
        Random random = new SecureRandom();
        Board board = new Board(assets.loadBoardConfig(settings.boardConfigId()));
        TileBag bag = TileBag.fromDistribution(assets.loadTileDistribution(settings.tileSetId()), random);
        return new GameRoom(UUID.randomUUID().toString(), settings, board, bag, validator, clock, random, sink);
    }
}

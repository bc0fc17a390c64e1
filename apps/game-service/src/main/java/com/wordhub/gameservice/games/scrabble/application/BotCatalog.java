package com.wordhub.gameservice.games.scrabble.application;

import com.wordhub.gameservice.games.scrabble.application.config.BotCatalogProperties;
import com.wordhub.gameservice.games.scrabble.application.config.BotProfile;
import com.wordhub.gameservice.games.scrabble.domain.constants.GameMessages;
import com.wordhub.gameservice.games.scrabble.domain.enums.BotDifficulty;
import com.wordhub.gameservice.games.scrabble.domain.exception.ErrorCode;
import com.wordhub.gameservice.games.scrabble.domain.exception.GameException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 机器人目录：配置了 wordhub.bots[] 时以配置为准，否则使用内置的六档机器人。
 */
@Slf4j
@Component
public class BotCatalog {

    private final Map<String, BotProfile> profiles = new LinkedHashMap<>();

    public BotCatalog(BotCatalogProperties properties) {
        List<BotProfile> configured = properties.getBots();
        List<BotProfile> source = configured == null || configured.isEmpty() ? builtIn() : configured;
        for (BotProfile p : source) {
            profiles.put(p.getId(), p);
        }
        log.info("机器人目录加载完成: count={}, ids={}", profiles.size(), profiles.keySet());
    }

    /**
     * @throws GameException BOT_NOT_FOUND
     */
    public BotProfile get(String botId) {
        BotProfile p = botId == null ? null : profiles.get(botId);
        if (p == null) {
            throw new GameException(ErrorCode.BOT_NOT_FOUND, GameMessages.formatBotNotFound(botId));
        }
        return p;
    }

    public boolean contains(String botId) {
        return botId != null && profiles.containsKey(botId);
    }

    public List<BotProfile> list() {
        return Collections.unmodifiableList(new ArrayList<>(profiles.values()));
    }

    private static List<BotProfile> builtIn() {
        List<BotProfile> list = new ArrayList<>();
        list.add(new BotProfile("bot-beginner", "Robo Rookie", BotDifficulty.BEGINNER, null, null, 0.35, 1.0, 0.1, 0.1));
        list.add(new BotProfile("bot-easy", "Clevertron", BotDifficulty.EASY, null, null, 0.2, 1.0, 0.3, 0.2));
        list.add(new BotProfile("bot-medium", "LexiBot", BotDifficulty.MEDIUM, null, null, 0.1, 1.0, 0.5, 0.3));
        list.add(new BotProfile("bot-hard", "Wordsmith", BotDifficulty.HARD, null, null, 0.05, 1.0, 0.7, 0.5));
        list.add(new BotProfile("bot-expert", "Quizzler", BotDifficulty.EXPERT, null, null, 0.02, 1.0, 0.8, 0.6));
        list.add(new BotProfile("bot-master", "Grandmaster Glyph", BotDifficulty.MASTER, null, null, 0.0, 1.0, 1.0, 0.8));
        return list;
    }
}

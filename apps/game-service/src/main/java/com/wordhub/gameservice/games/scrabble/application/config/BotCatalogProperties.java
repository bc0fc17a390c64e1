package com.wordhub.gameservice.games.scrabble.application.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * 机器人目录（wordhub.bots[]）。为空时使用内置目录。
 */
@ConfigurationProperties(prefix = "wordhub")
public class BotCatalogProperties {

    private List<BotProfile> bots = new ArrayList<>();

    public List<BotProfile> getBots() {
        return bots;
    }

    public void setBots(List<BotProfile> bots) {
        this.bots = bots;
    }
}

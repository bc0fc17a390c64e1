package com.wordhub.gameservice.games.scrabble.application.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 词典协作方配置（wordhub.dictionary.*）。
 */
@ConfigurationProperties(prefix = "wordhub.dictionary")
public class DictionaryProperties {

    /**
     * classpath：内置词表；redis：每个词典一个 Redis Set
     */
    private String source = "classpath";

    /**
     * 单次查询超时，超时按词典不可用处理
     */
    private Duration lookupTimeout = Duration.ofMillis(500);

    private int cacheSize = 10_000;

    private int lookupThreads = 4;

    /**
     * 词典 id → 词表位置（Spring Resource 写法）
     */
    private Map<String, String> wordLists = new LinkedHashMap<>(Map.of(
            "TWL", "classpath:dictionaries/TWL.txt",
            "SOWPODS", "classpath:dictionaries/SOWPODS.txt"));

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public Duration getLookupTimeout() {
        return lookupTimeout;
    }

    public void setLookupTimeout(Duration lookupTimeout) {
        this.lookupTimeout = lookupTimeout;
    }

    public int getCacheSize() {
        return cacheSize;
    }

    public void setCacheSize(int cacheSize) {
        this.cacheSize = cacheSize;
    }

    public int getLookupThreads() {
        return lookupThreads;
    }

    public void setLookupThreads(int lookupThreads) {
        this.lookupThreads = lookupThreads;
    }

    public Map<String, String> getWordLists() {
        return wordLists;
    }

    public void setWordLists(Map<String, String> wordLists) {
        this.wordLists = wordLists;
    }
}

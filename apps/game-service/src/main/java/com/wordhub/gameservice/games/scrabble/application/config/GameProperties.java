package com.wordhub.gameservice.games.scrabble.application.config;

import com.wordhub.gameservice.games.scrabble.domain.enums.GameMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 对局规则与节奏相关配置（wordhub.game.*）。
 */
@ConfigurationProperties(prefix = "wordhub.game")
public class GameProperties {

    /**
     * 每方初始用时（毫秒），对局中不补充
     */
    private long initialClockMs = 600_000L;

    /**
     * 连续弃权达到该值即结束
     */
    private int passLimit = 6;

    private int rackSize = 7;

    /**
     * 一次打出整架牌的奖励分
     */
    private int bingoBonus = 50;

    /**
     * 换牌要求牌袋至少剩余的张数
     */
    private int exchangeMinBag = 7;

    /**
     * 棋钟同步广播间隔
     */
    private Duration syncInterval = Duration.ofSeconds(5);

    /**
     * 等待房间锁的最长时间，超时返回 ROOM_BUSY
     */
    private Duration lockTimeout = Duration.ofSeconds(5);

    /**
     * 人类玩家断线后判负前的宽限期
     */
    private Duration disconnectGrace = Duration.ofSeconds(60);

    /**
     * 结束的房间保留多久后从内存移除
     */
    private Duration finishedRetention = Duration.ofMinutes(5);

    /**
     * 机器人单步搜索预算（包含在思考时间内）
     */
    private Duration botComputeBudget = Duration.ofMillis(1000);

    private String dictionaryId = "TWL";

    private String boardConfigId = "standard-15";

    private String tileSetId = "en";

    private GameMode mode = GameMode.CLASSIC;

    /**
     * 第二人入座后是否自动开始
     */
    private boolean autoStart = true;

    public long getInitialClockMs() {
        return initialClockMs;
    }

    public void setInitialClockMs(long initialClockMs) {
        this.initialClockMs = initialClockMs;
    }

    public int getPassLimit() {
        return passLimit;
    }

    public void setPassLimit(int passLimit) {
        this.passLimit = passLimit;
    }

    public int getRackSize() {
        return rackSize;
    }

    public void setRackSize(int rackSize) {
        this.rackSize = rackSize;
    }

    public int getBingoBonus() {
        return bingoBonus;
    }

    public void setBingoBonus(int bingoBonus) {
        this.bingoBonus = bingoBonus;
    }

    public int getExchangeMinBag() {
        return exchangeMinBag;
    }

    public void setExchangeMinBag(int exchangeMinBag) {
        this.exchangeMinBag = exchangeMinBag;
    }

    public Duration getSyncInterval() {
        return syncInterval;
    }

    public void setSyncInterval(Duration syncInterval) {
        this.syncInterval = syncInterval;
    }

    public Duration getLockTimeout() {
        return lockTimeout;
    }

    public void setLockTimeout(Duration lockTimeout) {
        this.lockTimeout = lockTimeout;
    }

    public Duration getDisconnectGrace() {
        return disconnectGrace;
    }

    public void setDisconnectGrace(Duration disconnectGrace) {
        this.disconnectGrace = disconnectGrace;
    }

    public Duration getFinishedRetention() {
        return finishedRetention;
    }

    public void setFinishedRetention(Duration finishedRetention) {
        this.finishedRetention = finishedRetention;
    }

    public Duration getBotComputeBudget() {
        return botComputeBudget;
    }

    public void setBotComputeBudget(Duration botComputeBudget) {
        this.botComputeBudget = botComputeBudget;
    }

    public String getDictionaryId() {
        return dictionaryId;
    }

    public void setDictionaryId(String dictionaryId) {
        this.dictionaryId = dictionaryId;
    }

    public String getBoardConfigId() {
        return boardConfigId;
    }

    public void setBoardConfigId(String boardConfigId) {
        this.boardConfigId = boardConfigId;
    }

    public String getTileSetId() {
        return tileSetId;
    }

    public void setTileSetId(String tileSetId) {
        this.tileSetId = tileSetId;
    }

    public GameMode getMode() {
        return mode;
    }

    public void setMode(GameMode mode) {
        this.mode = mode;
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }
}

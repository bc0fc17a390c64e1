package com.wordhub.gameservice.games.scrabble.domain.ai;

/**
 * 机器人选步权重。
 *
 * @param scoreWeight        本步得分
 * @param rackLeaveWeight    出牌后剩余字架的质量
 * @param positionWeight     占用奖励格
 * @param mistakeProbability 不选最优、改从前几名中随机挑一个的概率
 * @param maxTiles           单步最多摆放的牌数
 */
public record BotStrategy(double scoreWeight,
                          double rackLeaveWeight,
                          double positionWeight,
                          double mistakeProbability,
                          int maxTiles) {

    public BotStrategy {
        if (mistakeProbability < 0 || mistakeProbability > 1) {
            throw new IllegalArgumentException("mistakeProbability must be within [0,1]");
        }
        if (maxTiles < 1) {
            throw new IllegalArgumentException("maxTiles must be positive");
        }
    }
}

package com.wordhub.gameservice.games.scrabble.domain.rule;

/**
 * 规则常量（来自配置）。
 *
 * @param passLimit      连续弃权达到该值即结束
 * @param rackSize       字架容量
 * @param bingoBonus     一次打出整架牌的奖励分
 * @param exchangeMinBag 允许换牌时牌袋至少剩余的张数
 */
public record GameRules(int passLimit, int rackSize, int bingoBonus, int exchangeMinBag) {

    public static GameRules standard() {
        return new GameRules(6, 7, 50, 7);
    }

    public GameRules {
        if (passLimit <= 0 || rackSize <= 0 || bingoBonus < 0 || exchangeMinBag < 0) {
            throw new IllegalArgumentException("invalid game rules");
        }
    }
}

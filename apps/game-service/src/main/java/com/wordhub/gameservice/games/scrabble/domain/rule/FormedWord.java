package com.wordhub.gameservice.games.scrabble.domain.rule;

/**
 * 一次出牌形成的单词（主词或交叉词）及其得分。
 */
public record FormedWord(String word, int row, int col, boolean horizontal, int score) {
}

package com.wordhub.gameservice.games.scrabble.domain.enums;

/**
 * 对局模式。
 * CLASSIC：提交时即查词典；CHALLENGE：提交时不查词典，由对手质疑。
 */
public enum GameMode {
    CLASSIC,
    CHALLENGE
}

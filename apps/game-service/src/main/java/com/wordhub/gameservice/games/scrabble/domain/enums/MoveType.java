package com.wordhub.gameservice.games.scrabble.domain.enums;

public enum MoveType {
    PLAY,
    EXCHANGE,
    PASS,
    CHALLENGE
}

package com.wordhub.gameservice.games.scrabble.domain.model;

import java.util.List;

/**
 * 私发给玩家本人的字架（空白牌为 '_'）。
 */
public record RackView(String roomId, List<Character> tiles, int bagSize) {
}

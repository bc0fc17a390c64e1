package com.wordhub.gameservice.games.scrabble.domain.model;

import com.wordhub.gameservice.engine.core.Command;
import com.wordhub.gameservice.games.scrabble.domain.enums.MoveType;

import java.util.List;

/**
 * 待校验的走子请求（玩家或机器人提交）。
 *
 * @param playerId   提交者
 * @param type       走子类型
 * @param placements PLAY 时的落点
 * @param exchange   EXCHANGE 时要换掉的牌面（空白牌为 '_'）
 */
public record MoveCommand(String playerId, MoveType type, List<PlacedTile> placements, List<Character> exchange)
        implements Command {

    public MoveCommand {
        placements = placements == null ? List.of() : List.copyOf(placements);
        exchange = exchange == null ? List.of() : List.copyOf(exchange);
    }

    public static MoveCommand play(String playerId, List<PlacedTile> placements) {
        return new MoveCommand(playerId, MoveType.PLAY, placements, null);
    }

    public static MoveCommand exchange(String playerId, List<Character> letters) {
        return new MoveCommand(playerId, MoveType.EXCHANGE, null, letters);
    }

    public static MoveCommand pass(String playerId) {
        return new MoveCommand(playerId, MoveType.PASS, null, null);
    }

    public static MoveCommand challenge(String playerId) {
        return new MoveCommand(playerId, MoveType.CHALLENGE, null, null);
    }

    public MoveCommand withPlayer(String id) {
        return new MoveCommand(id, type, placements, exchange);
    }
}

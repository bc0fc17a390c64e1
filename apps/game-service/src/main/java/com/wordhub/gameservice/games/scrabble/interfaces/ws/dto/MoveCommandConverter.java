package com.wordhub.gameservice.games.scrabble.interfaces.ws.dto;

import com.wordhub.gameservice.games.scrabble.domain.enums.MoveType;
import com.wordhub.gameservice.games.scrabble.domain.model.MoveCommand;
import com.wordhub.gameservice.games.scrabble.domain.model.PlacedTile;
import com.wordhub.gameservice.games.scrabble.interfaces.ws.dto.ScrabbleMessages.MoveCmd;
import com.wordhub.gameservice.games.scrabble.interfaces.ws.dto.ScrabbleMessages.PlacementDto;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * MoveCmd（线上格式）→ MoveCommand（领域命令）。提交者身份只取自连接，不取自消息体。
 */
public final class MoveCommandConverter {

    private MoveCommandConverter() {
    }

    public static MoveCommand toCommand(String playerId, MoveCmd cmd) {
        if (cmd == null || StringUtils.isBlank(cmd.getType())) {
            throw new IllegalArgumentException("move type is required");
        }
        MoveType type;
        try {
            type = MoveType.valueOf(cmd.getType().trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown move type: " + cmd.getType(), e);
        }
        switch (type) {
            case PLAY:
                return MoveCommand.play(playerId, toPlacements(cmd.getPlacements()));
            case EXCHANGE:
                return MoveCommand.exchange(playerId, toSymbols(cmd.getExchange()));
            case CHALLENGE:
                return MoveCommand.challenge(playerId);
            default:
                return MoveCommand.pass(playerId);
        }
    }

    private static List<PlacedTile> toPlacements(List<PlacementDto> dtos) {
        List<PlacedTile> out = new ArrayList<>();
        if (dtos == null) return out;
        for (PlacementDto d : dtos) {
            if (d == null) continue;
            char letter = Character.toUpperCase(d.getLetter());
            out.add(d.isBlank() ? PlacedTile.blank(d.getRow(), d.getCol(), letter)
                    : PlacedTile.of(d.getRow(), d.getCol(), letter));
        }
        return out;
    }

    private static List<Character> toSymbols(List<Character> raw) {
        List<Character> out = new ArrayList<>();
        if (raw == null) return out;
        for (Character c : raw) {
            if (c != null) out.add(Character.toUpperCase(c));
        }
        return out;
    }
}

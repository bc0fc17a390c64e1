package com.wordhub.gameservice.games.scrabble.domain.rule;

import com.wordhub.gameservice.games.scrabble.domain.enums.GameMode;
import com.wordhub.gameservice.games.scrabble.domain.model.Board;
import com.wordhub.gameservice.games.scrabble.domain.model.Move;
import com.wordhub.gameservice.games.scrabble.domain.model.Rack;

import java.util.Optional;

/**
 * 校验器所需的只读房间视图。
 */
public interface MoveContext {

    Board board();

    /** 座位号；不在房间中返回 -1 */
    int seatOf(String playerId);

    Rack rackOf(int seat);

    /** 当前应走的座位 */
    int currentSide();

    int bagSize();

    String dictionaryId();

    GameMode mode();

    /** 最近一步且尚未被质疑的出牌（之后没有其它走子） */
    Optional<Move> challengeablePlay();
}

package com.wordhub.gameservice.games.scrabble.domain.model;

import com.wordhub.gameservice.engine.core.GameState;
import com.wordhub.gameservice.games.scrabble.domain.enums.GameMode;

/**
 * 供机器人思考用的局面快照（与房间不共享任何可变对象）。
 *
 * @param epoch 生成快照时房间的版本，提交时用于判断是否已过期
 */
public record ScrabbleState(String roomId,
                            long epoch,
                            String playerId,
                            Board board,
                            Rack rack,
                            int bagSize,
                            String dictionaryId,
                            GameMode mode) implements GameState {

    @Override
    public ScrabbleState copy() {
        return new ScrabbleState(roomId, epoch, playerId, board.copy(), rack.copy(), bagSize, dictionaryId, mode);
    }
}

package com.wordhub.gameservice.games.scrabble.domain.repository;

import com.wordhub.gameservice.games.scrabble.domain.model.Cell;
import com.wordhub.gameservice.games.scrabble.domain.model.TileDistribution;

/**
 * 棋盘配置与牌面分布的读取协作方。
 */
public interface GameAssetRepository {

    /**
     * 每次返回一份新的空棋盘（调用方可直接持有并修改）。
     * @throws IllegalArgumentException 未知配置
     */
    Cell[][] loadBoardConfig(String configId);

    /**
     * @throws IllegalArgumentException 未知语言
     */
    TileDistribution loadTileDistribution(String langId);
}

package com.wordhub.gameservice.games.scrabble.application.config;

import com.wordhub.gameservice.games.scrabble.domain.ai.BotStrategy;
import com.wordhub.gameservice.games.scrabble.domain.enums.BotDifficulty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 机器人目录中的一项（wordhub.bots[]）。
 * 未配置思考时间时使用难度的默认区间。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BotProfile {

    private String id;
    private String name;
    private BotDifficulty difficulty = BotDifficulty.MEDIUM;
    private Long minThinkMs;
    private Long maxThinkMs;
    private double mistakeProbability = 0.1;
    private double scoreWeight = 1.0;
    private double rackLeaveWeight = 0.5;
    private double positionWeight = 0.3;

    public long effectiveMinThinkMs() {
        return minThinkMs != null ? minThinkMs : difficulty.minThinkMs();
    }

    public long effectiveMaxThinkMs() {
        long max = maxThinkMs != null ? maxThinkMs : difficulty.maxThinkMs();
        return Math.max(max, effectiveMinThinkMs());
    }

    public BotStrategy toStrategy() {
        return new BotStrategy(scoreWeight, rackLeaveWeight, positionWeight, mistakeProbability, difficulty.maxTiles());
    }
}

package com.wordhub.gameservice.engine.core;

/**
 * AI 建议器：根据当前状态副本给出一个建议的命令（如下一步走法）。
 * - budgetMs：时间预算（毫秒），超出预算时返回目前找到的最好结果；
 * - 找不到任何可行走法时返回 null，由调用方决定兜底（换牌/过）。
 */
public interface AiAdvisor<S extends GameState, C extends Command> {

    C suggest(S state, long budgetMs);
}

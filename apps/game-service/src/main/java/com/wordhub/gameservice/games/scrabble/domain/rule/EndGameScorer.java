package com.wordhub.gameservice.games.scrabble.domain.rule;

import com.wordhub.gameservice.games.scrabble.domain.enums.CompletionReason;
import com.wordhub.gameservice.games.scrabble.domain.model.GameResult;
import com.wordhub.gameservice.games.scrabble.domain.model.Player;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 终局结算。
 *  - OUT_OF_TILES：对手剩余牌分从对手扣除并加给出完的一方；
 *  - PASS_LIMIT：双方各扣自己剩余牌分；
 *  - TIMEOUT / RESIGNATION / FORFEIT：decisiveSeat 判负，分数不动；
 *  - ABORTED：无胜负。
 * 按分数判胜负时，同分比剩余牌分，低者胜；仍相同为平局。
 */
public final class EndGameScorer {

    private EndGameScorer() {
    }

    /**
     * @param players      两个座位（都不为 null）
     * @param decisiveSeat OUT_OF_TILES 时为出完的一方；判负类原因时为负方；其余忽略
     */
    public static GameResult settle(Player[] players, CompletionReason reason, int decisiveSeat) {
        Player a = players[0];
        Player b = players[1];
        int rackA = a.getRack().value();
        int rackB = b.getRack().value();

        switch (reason) {
            case OUT_OF_TILES: {
                Player goer = players[decisiveSeat];
                Player other = players[1 - decisiveSeat];
                int left = other.getRack().value();
                other.subtractScore(left);
                goer.addScore(left);
                return byScore(a, b, rackA, rackB, reason);
            }
            case PASS_LIMIT:
                a.subtractScore(rackA);
                b.subtractScore(rackB);
                return byScore(a, b, rackA, rackB, reason);
            case TIMEOUT:
            case RESIGNATION:
            case FORFEIT: {
                Player loser = players[decisiveSeat];
                Player winner = players[1 - decisiveSeat];
                return new GameResult(winner.id(), loser.id(), reason, scores(a, b));
            }
            case ABORTED:
            default:
                return new GameResult(null, null, reason, scores(a, b));
        }
    }

    private static GameResult byScore(Player a, Player b, int rackA, int rackB, CompletionReason reason) {
        int cmp = Integer.compare(a.getScore(), b.getScore());
        if (cmp == 0) {
            cmp = Integer.compare(rackB, rackA);
        }
        if (cmp == 0) {
            return new GameResult(null, null, reason, scores(a, b));
        }
        Player winner = cmp > 0 ? a : b;
        Player loser = cmp > 0 ? b : a;
        return new GameResult(winner.id(), loser.id(), reason, scores(a, b));
    }

    private static Map<String, Integer> scores(Player a, Player b) {
        Map<String, Integer> m = new LinkedHashMap<>();
        m.put(a.id(), a.getScore());
        m.put(b.id(), b.getScore());
        return m;
    }
}

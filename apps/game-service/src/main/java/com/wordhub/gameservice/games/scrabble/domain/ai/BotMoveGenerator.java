package com.wordhub.gameservice.games.scrabble.domain.ai;

import com.wordhub.gameservice.engine.core.AiAdvisor;
import com.wordhub.gameservice.games.scrabble.domain.exception.DictionaryUnavailableException;
import com.wordhub.gameservice.games.scrabble.domain.exception.GameException;
import com.wordhub.gameservice.games.scrabble.domain.model.Board;
import com.wordhub.gameservice.games.scrabble.domain.model.MoveCommand;
import com.wordhub.gameservice.games.scrabble.domain.model.PlacedTile;
import com.wordhub.gameservice.games.scrabble.domain.model.Premium;
import com.wordhub.gameservice.games.scrabble.domain.model.Rack;
import com.wordhub.gameservice.games.scrabble.domain.model.ScrabbleState;
import com.wordhub.gameservice.games.scrabble.domain.model.Tile;
import com.wordhub.gameservice.games.scrabble.domain.rule.MoveValidator;
import com.wordhub.gameservice.games.scrabble.domain.rule.ValidatedMove;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * BotMoveGenerator：
 * 1) 锚点 = 与已有字母相邻的空格（空棋盘时为中心格）；
 * 2) 对每个锚点、每个方向、每个长度，把字架字母的排列摆到连续空格上；
 * 3) 每个候选都走与真人相同的校验器（含词典），通过的才保留；
 * 4) 按 得分/剩余字架/奖励格 加权排序，按失误概率偶尔不选最优；
 * 5) 超出时间预算立即停止，用已找到的候选作答；一个都没有返回 null。
 *
 * 空白牌不参与枚举（保留在字架上）。
 */
@Slf4j
public class BotMoveGenerator implements AiAdvisor<ScrabbleState, MoveCommand> {

    private static final String VOWELS = "AEIOU";
    /** 失误时从前几名中挑 */
    private static final int MISTAKE_POOL = 5;

    private final MoveValidator validator;
    private final BotStrategy strategy;
    private final Random random;

    public BotMoveGenerator(MoveValidator validator, BotStrategy strategy, Random random) {
        this.validator = validator;
        this.strategy = strategy;
        this.random = random;
    }

    @Override
    public MoveCommand suggest(ScrabbleState state, long budgetMs) {
        long deadline = System.nanoTime() + Math.max(1, budgetMs) * 1_000_000L;
        Board board = state.board();
        Rack rack = state.rack();

        List<Character> letters = new ArrayList<>();
        for (char s : rack.symbols()) {
            if (s != Tile.BLANK) letters.add(s);
        }
        Collections.sort(letters);
        int maxTiles = Math.min(strategy.maxTiles(), letters.size());
        if (maxTiles == 0) return null;

        List<int[]> anchors = anchors(board);
        List<Candidate> found = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Search search = new Search(state, board, rack, letters, deadline, found, seen);

        try {
            outer:
            for (int len = 1; len <= maxTiles; len++) {
                for (int[] anchor : anchors) {
                    for (boolean horizontal : new boolean[]{true, false}) {
                        for (int offset = 0; offset < len; offset++) {
                            List<int[]> slots = slots(board, anchor, horizontal, offset, len);
                            if (slots == null) continue;
                            if (!search.permute(slots, new char[len], new boolean[letters.size()], 0)) {
                                break outer;
                            }
                        }
                    }
                }
            }
        } catch (DictionaryUnavailableException e) {
            log.warn("机器人搜索中词典不可用，使用已找到的 {} 个候选: room={}", found.size(), state.roomId());
        }

        log.debug("机器人候选: room={}, bot={}, candidates={}", state.roomId(), state.playerId(), found.size());
        if (found.isEmpty()) return null;
        found.sort(Comparator.comparingDouble(Candidate::value).reversed());
        Candidate pick = found.get(0);
        if (found.size() > 1 && random.nextDouble() < strategy.mistakeProbability()) {
            pick = found.get(1 + random.nextInt(Math.min(MISTAKE_POOL, found.size()) - 1));
        }
        return MoveCommand.play(state.playerId(), pick.placements());
    }

    /**
     * 空棋盘时只有中心格；否则为所有与已有字母四邻相接的空格。
     */
    static List<int[]> anchors(Board board) {
        List<int[]> out = new ArrayList<>();
        if (board.isBlank()) {
            out.add(new int[]{board.center(), board.center()});
            return out;
        }
        for (int r = 0; r < board.size(); r++) {
            for (int c = 0; c < board.size(); c++) {
                if (board.hasTile(r, c)) continue;
                if (board.hasTile(r - 1, c) || board.hasTile(r + 1, c)
                        || board.hasTile(r, c - 1) || board.hasTile(r, c + 1)) {
                    out.add(new int[]{r, c});
                }
            }
        }
        return out;
    }

    /**
     * 以锚点为第 offset 张新牌，沿方向取 len 个空格（跳过已有字母）；越界返回 null。
     */
    static List<int[]> slots(Board board, int[] anchor, boolean horizontal, int offset, int len) {
        int dr = horizontal ? 0 : 1;
        int dc = horizontal ? 1 : 0;
        List<int[]> before = new ArrayList<>();
        int r = anchor[0] - dr;
        int c = anchor[1] - dc;
        while (before.size() < offset) {
            if (!board.inBounds(r, c)) return null;
            if (!board.hasTile(r, c)) before.add(new int[]{r, c});
            r -= dr;
            c -= dc;
        }
        Collections.reverse(before);
        List<int[]> out = new ArrayList<>(before);
        out.add(anchor);
        r = anchor[0] + dr;
        c = anchor[1] + dc;
        while (out.size() < len) {
            if (!board.inBounds(r, c)) return null;
            if (!board.hasTile(r, c)) out.add(new int[]{r, c});
            r += dr;
            c += dc;
        }
        return out;
    }

    private double evaluate(Board board, Rack rack, List<PlacedTile> placements, int score) {
        Map<Character, Integer> left = new HashMap<>();
        for (char s : rack.symbols()) left.merge(s, 1, Integer::sum);
        for (PlacedTile p : placements) left.merge(p.letter(), -1, Integer::sum);

        double leave = 0;
        int vowels = 0;
        int consonants = 0;
        for (Map.Entry<Character, Integer> e : left.entrySet()) {
            int n = e.getValue();
            if (n <= 0) continue;
            char ch = e.getKey();
            if (ch == Tile.BLANK) leave += 4 * n;
            else if (ch == 'S') leave += 2 * n;
            else if (ch == 'Q') leave -= 4 * n;
            if (n > 1) leave -= 2 * (n - 1);
            if (VOWELS.indexOf(ch) >= 0) vowels += n;
            else if (ch != Tile.BLANK) consonants += n;
        }
        leave -= Math.abs(vowels - consonants);

        double position = 0;
        for (PlacedTile p : placements) {
            Premium premium = board.cell(p.row(), p.col()).getPremium();
            position += (premium.letterMultiplier() - 1) + (premium.wordMultiplier() - 1);
        }
        return strategy.scoreWeight() * score + strategy.rackLeaveWeight() * leave + strategy.positionWeight() * position;
    }

    private record Candidate(List<PlacedTile> placements, int score, double value) {
    }

    /**
     * 一次搜索的上下文（排列枚举 + 校验）。
     */
    private final class Search {
        private final ScrabbleState state;
        private final Board board;
        private final Rack rack;
        private final List<Character> letters;
        private final long deadline;
        private final List<Candidate> found;
        private final Set<String> seen;

        Search(ScrabbleState state, Board board, Rack rack, List<Character> letters, long deadline,
               List<Candidate> found, Set<String> seen) {
            this.state = state;
            this.board = board;
            this.rack = rack;
            this.letters = letters;
            this.deadline = deadline;
            this.found = found;
            this.seen = seen;
        }

        /**
         * @return false 表示预算耗尽，应停止整个搜索
         */
        boolean permute(List<int[]> slots, char[] chosen, boolean[] used, int depth) {
            if (depth == slots.size()) {
                return tryCandidate(slots, chosen);
            }
            for (int i = 0; i < letters.size(); i++) {
                if (used[i]) continue;
                // 同一层跳过相同字母，避免重复排列
                if (i > 0 && letters.get(i).equals(letters.get(i - 1)) && !used[i - 1]) continue;
                used[i] = true;
                chosen[depth] = letters.get(i);
                boolean go = permute(slots, chosen, used, depth + 1);
                used[i] = false;
                if (!go) return false;
            }
            return true;
        }

        private boolean tryCandidate(List<int[]> slots, char[] chosen) {
            if (System.nanoTime() > deadline) return false;
            List<PlacedTile> placements = new ArrayList<>(slots.size());
            StringBuilder key = new StringBuilder();
            for (int i = 0; i < slots.size(); i++) {
                int[] s = slots.get(i);
                placements.add(PlacedTile.of(s[0], s[1], chosen[i]));
                key.append(s[0]).append(',').append(s[1]).append(chosen[i]).append(';');
            }
            if (!seen.add(key.toString())) return true;
            try {
                ValidatedMove vm = validator.validatePlay(board, rack, placements, state.dictionaryId(), true);
                found.add(new Candidate(placements, vm.score(), evaluate(board, rack, placements, vm.score())));
            } catch (DictionaryUnavailableException e) {
                throw e;
            } catch (GameException e) {
                log.trace("候选被拒: {} {}", key, e.getCode());
            }
            return true;
        }
    }
}

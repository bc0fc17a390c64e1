package com.wordhub.gameservice.games.scrabble.domain.rule;

import com.wordhub.gameservice.games.scrabble.domain.constants.GameMessages;
import com.wordhub.gameservice.games.scrabble.domain.dictionary.WordOracle;
import com.wordhub.gameservice.games.scrabble.domain.enums.GameMode;
import com.wordhub.gameservice.games.scrabble.domain.exception.ErrorCode;
import com.wordhub.gameservice.games.scrabble.domain.exception.GameException;
import com.wordhub.gameservice.games.scrabble.domain.model.Board;
import com.wordhub.gameservice.games.scrabble.domain.model.Move;
import com.wordhub.gameservice.games.scrabble.domain.model.MoveCommand;
import com.wordhub.gameservice.games.scrabble.domain.model.PlacedTile;
import com.wordhub.gameservice.games.scrabble.domain.model.Premium;
import com.wordhub.gameservice.games.scrabble.domain.model.Rack;
import com.wordhub.gameservice.games.scrabble.domain.model.Tile;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * MoveValidator
 * ---------------------------------------
 * 走子校验与计分。按顺序检查，遇到第一个失败即抛 {@link GameException}：
 *  1. 是否轮到提交者；
 *  2. PLAY：落点（界内、空格、同一直线、连续、首步过中心/否则相连）、字架；
 *  3. 形成的所有单词（主词 + 交叉词）≥2 个字母且通过词典（仅 CLASSIC）；
 *  4. 计分：字母分 × 字母奖励（仅新摆的牌）→ 单词奖励，整架打出加奖励分；
 *  5. EXCHANGE：牌袋余量与字架；
 *  6. PASS：恒合法；CHALLENGE：必须存在对手最近一步未被质疑的出牌。
 *
 * 本类不修改任何状态。
 */
public class MoveValidator {

    private final WordOracle oracle;
    private final GameRules rules;

    public MoveValidator(WordOracle oracle, GameRules rules) {
        this.oracle = oracle;
        this.rules = rules;
    }

    public GameRules rules() {
        return rules;
    }

    /**
     * 完整校验入口。
     */
    public ValidatedMove validate(MoveContext ctx, MoveCommand cmd) {
        int seat = ctx.seatOf(cmd.playerId());
        if (seat < 0 || seat != ctx.currentSide()) {
            throw new GameException(ErrorCode.NOT_YOUR_TURN, GameMessages.NOT_YOUR_TURN);
        }
        Rack rack = ctx.rackOf(seat);
        switch (cmd.type()) {
            case PLAY:
                return validatePlay(ctx.board(), rack, cmd.placements(), ctx.dictionaryId(), ctx.mode() == GameMode.CLASSIC);
            case EXCHANGE:
                return validateExchange(ctx.bagSize(), rack, cmd.exchange());
            case PASS:
                return ValidatedMove.pass();
            case CHALLENGE:
                return validateChallenge(ctx, cmd.playerId());
            default:
                throw new IllegalArgumentException("unsupported move type: " + cmd.type());
        }
    }

    /**
     * 出牌校验（机器人枚举候选时也直接调用）。
     * @param checkWords 是否查词典
     */
    public ValidatedMove validatePlay(Board board, Rack rack, List<PlacedTile> placements, String dictionaryId, boolean checkWords) {
        checkPlacement(board, placements);

        List<Character> need = new ArrayList<>(placements.size());
        for (PlacedTile p : placements) need.add(p.rackSymbol());
        if (!rack.containsAll(need)) {
            throw new GameException(ErrorCode.RACK_MISMATCH, GameMessages.RACK_MISMATCH);
        }

        List<FormedWord> words = formWords(board, rack, placements);
        if (words.isEmpty()) {
            throw new GameException(ErrorCode.INVALID_PLACEMENT, GameMessages.NO_WORD_FORMED);
        }
        if (checkWords) {
            for (FormedWord w : words) {
                if (!oracle.isValid(w.word(), dictionaryId)) {
                    throw new GameException(ErrorCode.INVALID_WORD, GameMessages.formatInvalidWord(w.word()), w.word());
                }
            }
        }
        int score = 0;
        for (FormedWord w : words) score += w.score();
        boolean bingo = placements.size() >= rules.rackSize();
        if (bingo) score += rules.bingoBonus();
        return ValidatedMove.play(placements, words, score, bingo);
    }

    public ValidatedMove validateExchange(int bagSize, Rack rack, List<Character> letters) {
        if (bagSize < rules.exchangeMinBag()) {
            throw new GameException(ErrorCode.EXCHANGE_NOT_ALLOWED, GameMessages.formatExchangeBagLow(rules.exchangeMinBag()));
        }
        if (letters.isEmpty()) {
            throw new GameException(ErrorCode.EXCHANGE_NOT_ALLOWED, GameMessages.EXCHANGE_EMPTY);
        }
        if (!rack.containsAll(letters)) {
            throw new GameException(ErrorCode.EXCHANGE_NOT_ALLOWED, GameMessages.RACK_MISMATCH);
        }
        return ValidatedMove.exchange(letters);
    }

    private ValidatedMove validateChallenge(MoveContext ctx, String challengerId) {
        Optional<Move> target = ctx.challengeablePlay();
        if (target.isEmpty() || target.get().playerId().equals(challengerId)) {
            throw new GameException(ErrorCode.CHALLENGE_NOT_ALLOWED, GameMessages.CHALLENGE_NOT_ALLOWED);
        }
        for (String w : target.get().words()) {
            if (!oracle.isValid(w, ctx.dictionaryId())) {
                return ValidatedMove.challenge(true, w);
            }
        }
        return ValidatedMove.challenge(false, null);
    }

    // ========== 落点几何 ==========

    private void checkPlacement(Board board, List<PlacedTile> placements) {
        if (placements == null || placements.isEmpty()) {
            throw placementError(GameMessages.EMPTY_PLACEMENT);
        }
        Set<Long> seen = new HashSet<>();
        for (PlacedTile p : placements) {
            if (p.letter() < 'A' || p.letter() > 'Z') {
                throw placementError(GameMessages.formatInvalidLetter(String.valueOf(p.letter())));
            }
            if (!board.inBounds(p.row(), p.col())) {
                throw placementError(GameMessages.OUT_OF_BOUNDS);
            }
            if (!seen.add(key(p.row(), p.col()))) {
                throw placementError(GameMessages.DUPLICATE_CELL);
            }
            if (board.hasTile(p.row(), p.col())) {
                throw placementError(GameMessages.CELL_OCCUPIED);
            }
        }

        PlacedTile first = placements.get(0);
        boolean sameRow = placements.stream().allMatch(p -> p.row() == first.row());
        boolean sameCol = placements.stream().allMatch(p -> p.col() == first.col());
        if (!sameRow && !sameCol) {
            throw placementError(GameMessages.NOT_IN_LINE);
        }

        // 直线上首尾之间的每一格要么是新牌，要么已有牌
        if (placements.size() > 1) {
            int lo = Integer.MAX_VALUE;
            int hi = Integer.MIN_VALUE;
            for (PlacedTile p : placements) {
                int v = sameRow ? p.col() : p.row();
                lo = Math.min(lo, v);
                hi = Math.max(hi, v);
            }
            for (int v = lo; v <= hi; v++) {
                int r = sameRow ? first.row() : v;
                int c = sameRow ? v : first.col();
                if (!seen.contains(key(r, c)) && !board.hasTile(r, c)) {
                    throw placementError(GameMessages.HAS_GAP);
                }
            }
        }

        if (board.isBlank()) {
            int center = board.center();
            if (!seen.contains(key(center, center))) {
                throw placementError(GameMessages.FIRST_MOVE_CENTER);
            }
        } else {
            boolean touches = false;
            for (PlacedTile p : placements) {
                if (board.hasTile(p.row() - 1, p.col()) || board.hasTile(p.row() + 1, p.col())
                        || board.hasTile(p.row(), p.col() - 1) || board.hasTile(p.row(), p.col() + 1)) {
                    touches = true;
                    break;
                }
            }
            if (!touches) {
                throw placementError(GameMessages.NOT_CONNECTED);
            }
        }
    }

    // ========== 单词与计分 ==========

    private List<FormedWord> formWords(Board board, Rack rack, List<PlacedTile> placements) {
        Map<Long, PlacedTile> placed = new HashMap<>();
        for (PlacedTile p : placements) placed.put(key(p.row(), p.col()), p);
        Map<Character, Integer> letterPoints = new HashMap<>();
        for (Tile t : rack.tiles()) {
            if (!t.blank()) letterPoints.putIfAbsent(t.letter(), t.points());
        }

        List<FormedWord> words = new ArrayList<>();
        PlacedTile first = placements.get(0);
        boolean horizontal;
        if (placements.size() > 1) {
            horizontal = placements.get(1).row() == first.row();
        } else {
            horizontal = board.hasTile(first.row(), first.col() - 1) || board.hasTile(first.row(), first.col() + 1);
        }

        FormedWord main = readWord(board, placed, letterPoints, first.row(), first.col(), horizontal);
        if (main != null) words.add(main);
        for (PlacedTile p : placements) {
            FormedWord cross = readWord(board, placed, letterPoints, p.row(), p.col(), !horizontal);
            if (cross != null) words.add(cross);
        }
        return words;
    }

    /**
     * 从 (row,col) 沿方向向两端扩展读出整词；不足 2 个字母返回 null。
     */
    private FormedWord readWord(Board board, Map<Long, PlacedTile> placed, Map<Character, Integer> letterPoints,
                                int row, int col, boolean horizontal) {
        int dr = horizontal ? 0 : 1;
        int dc = horizontal ? 1 : 0;
        int r = row;
        int c = col;
        while (occupied(board, placed, r - dr, c - dc)) {
            r -= dr;
            c -= dc;
        }
        int startRow = r;
        int startCol = c;

        StringBuilder sb = new StringBuilder();
        int sum = 0;
        int wordMultiplier = 1;
        while (occupied(board, placed, r, c)) {
            PlacedTile p = placed.get(key(r, c));
            if (p != null) {
                Premium premium = board.cell(r, c).getPremium();
                int pts = p.blank() ? 0 : letterPoints.getOrDefault(p.letter(), 0);
                sum += pts * premium.letterMultiplier();
                wordMultiplier *= premium.wordMultiplier();
                sb.append(p.letter());
            } else {
                Tile t = board.tileAt(r, c);
                sum += t.points();
                sb.append(t.letter());
            }
            r += dr;
            c += dc;
        }
        if (sb.length() < 2) return null;
        return new FormedWord(sb.toString(), startRow, startCol, horizontal, sum * wordMultiplier);
    }

    private static boolean occupied(Board board, Map<Long, PlacedTile> placed, int r, int c) {
        return board.inBounds(r, c) && (placed.containsKey(key(r, c)) || board.hasTile(r, c));
    }

    private static long key(int r, int c) {
        return ((long) r << 32) | (c & 0xffffffffL);
    }

    private static GameException placementError(String message) {
        return new GameException(ErrorCode.INVALID_PLACEMENT, message);
    }
}

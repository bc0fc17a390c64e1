package com.wordhub.gameservice.games.scrabble.domain.rule;

import com.wordhub.gameservice.games.scrabble.domain.enums.MoveType;
import com.wordhub.gameservice.games.scrabble.domain.model.PlacedTile;

import java.util.List;

/**
 * 校验通过、可以直接落地的走子。
 *
 * @param challengeUpheld 仅 CHALLENGE：上一步是否含非法单词
 * @param invalidWord     质疑成功时查出的第一个非法单词
 */
public record ValidatedMove(MoveType type,
                            List<PlacedTile> placements,
                            List<FormedWord> words,
                            int score,
                            boolean bingo,
                            List<Character> exchange,
                            boolean challengeUpheld,
                            String invalidWord) {

    static ValidatedMove play(List<PlacedTile> placements, List<FormedWord> words, int score, boolean bingo) {
        return new ValidatedMove(MoveType.PLAY, List.copyOf(placements), List.copyOf(words), score, bingo, List.of(), false, null);
    }

    static ValidatedMove exchange(List<Character> letters) {
        return new ValidatedMove(MoveType.EXCHANGE, List.of(), List.of(), 0, false, List.copyOf(letters), false, null);
    }

    static ValidatedMove pass() {
        return new ValidatedMove(MoveType.PASS, List.of(), List.of(), 0, false, List.of(), false, null);
    }

    static ValidatedMove challenge(boolean upheld, String invalidWord) {
        return new ValidatedMove(MoveType.CHALLENGE, List.of(), List.of(), 0, false, List.of(), upheld, invalidWord);
    }

    public List<String> wordTexts() {
        return words.stream().map(FormedWord::word).toList();
    }
}

package com.wordhub.gameservice.games.scrabble.domain.exception;

import com.wordhub.gameservice.games.scrabble.domain.constants.GameMessages;

/**
 * 词典查询失败（超时/不可达）。不等于“单词非法”，调用方可重试。
 */
public class DictionaryUnavailableException extends GameException {

    public DictionaryUnavailableException(String dictionaryId, Throwable cause) {
        super(ErrorCode.DICTIONARY_UNAVAILABLE, GameMessages.formatDictionaryUnavailable(dictionaryId), dictionaryId, cause);
    }
}

package com.wordhub.gameservice.games.scrabble.domain.repository;

/**
 * 词典查询协作方（外部持久化）。
 */
public interface DictionaryRepository {

    /**
     * @param dictionaryId 词典标识（如 TWL）
     * @param word         已大写的单词
     * @return 单词是否在词典中
     * @throws RuntimeException 词典不可达或未知词典
     */
    boolean loadDictionaryEntry(String dictionaryId, String word);
}

package com.wordhub.gameservice.games.scrabble.infrastructure.redis;

/**
 * 统一集中管理 Redis Key 的前缀与拼接，避免字符串散落。
 */
public final class RedisKeys {

    private static final String PFX = "wordhub:";

    private RedisKeys() {}

    // ---- 词典：每个词典一个 Set，成员为大写单词 ----
    public static String dictionary(String dictionaryId) {
        return PFX + "dict:" + dictionaryId;
    }
}

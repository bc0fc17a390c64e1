package com.wordhub.gameservice.games.scrabble.infrastructure.redis;

import com.wordhub.gameservice.games.scrabble.domain.repository.DictionaryRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

/**
 * Redis 词典：SISMEMBER wordhub:dict:{id} WORD。
 * 连接失败的异常原样抛出，由 WordOracle 转成“词典不可用”。
 */
@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "wordhub.dictionary", name = "source", havingValue = "redis")
public class RedisDictionaryRepository implements DictionaryRepository {

    private final StringRedisTemplate redis;

    @Override
    public boolean loadDictionaryEntry(String dictionaryId, String word) {
        Boolean member = redis.opsForSet().isMember(RedisKeys.dictionary(dictionaryId), word);
        if (member == null) {
            // 管道/事务模式下才会返回 null，这里不应出现
            throw new IllegalStateException("redis returned no answer for " + dictionaryId);
        }
        return member;
    }
}

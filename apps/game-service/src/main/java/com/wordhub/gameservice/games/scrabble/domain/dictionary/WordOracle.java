package com.wordhub.gameservice.games.scrabble.domain.dictionary;

import com.wordhub.gameservice.games.scrabble.domain.exception.DictionaryUnavailableException;
import com.wordhub.gameservice.games.scrabble.domain.repository.DictionaryRepository;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * WordOracle
 * ---------------------------------------
 * 单词合法性判断：大写规范化 → 查最近结果缓存 → 未命中时限时查询词典协作方。
 *
 * 说明：
 *  - 缓存按 (词典, 单词) 做 LRU 淘汰，随时清空都不影响结果；
 *  - 协作方超时或出错一律抛 {@link DictionaryUnavailableException}，绝不当作“合法”；
 *  - 查询在独立线程池执行，房间写线程最多等待 lookupTimeout。
 */
@Slf4j
public class WordOracle {

    private final DictionaryRepository repository;
    private final Executor lookupExecutor;
    private final Duration lookupTimeout;
    private final Map<String, Boolean> cache;

    public WordOracle(DictionaryRepository repository, Executor lookupExecutor, Duration lookupTimeout, int cacheSize) {
        this.repository = repository;
        this.lookupExecutor = lookupExecutor;
        this.lookupTimeout = lookupTimeout;
        this.cache = new LinkedHashMap<>(Math.max(16, cacheSize / 4), 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                return size() > cacheSize;
            }
        };
    }

    /**
     * @return 单词是否合法；空串或含非字母字符直接为 false
     * @throws DictionaryUnavailableException 词典协作方不可用
     */
    public boolean isValid(String word, String dictionaryId) {
        if (word == null || word.isEmpty()) return false;
        String normalized = word.toUpperCase(Locale.ROOT);
        for (int i = 0; i < normalized.length(); i++) {
            char c = normalized.charAt(i);
            if (c < 'A' || c > 'Z') return false;
        }
        String key = dictionaryId + ':' + normalized;
        Boolean hit;
        synchronized (cache) {
            hit = cache.get(key);
        }
        if (hit != null) return hit;

        boolean valid = lookup(dictionaryId, normalized);
        synchronized (cache) {
            cache.put(key, valid);
        }
        return valid;
    }

    /** 清空缓存 */
    public void clearCache() {
        synchronized (cache) {
            cache.clear();
        }
    }

    public int cachedEntries() {
        synchronized (cache) {
            return cache.size();
        }
    }

    private boolean lookup(String dictionaryId, String word) {
        CompletableFuture<Boolean> f;
        try {
            f = CompletableFuture.supplyAsync(
                    () -> repository.loadDictionaryEntry(dictionaryId, word), lookupExecutor);
        } catch (RejectedExecutionException e) {
            // 查询线程池已满或已关闭
            log.warn("词典查询被拒绝: dict={}, word={}", dictionaryId, word);
            throw new DictionaryUnavailableException(dictionaryId, e);
        }
        try {
            return f.get(lookupTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            f.cancel(true);
            log.warn("词典查询超时: dict={}, word={}, timeout={}ms", dictionaryId, word, lookupTimeout.toMillis());
            throw new DictionaryUnavailableException(dictionaryId, e);
        } catch (ExecutionException e) {
            log.warn("词典查询失败: dict={}, word={}, cause={}", dictionaryId, word, e.getCause().toString());
            throw new DictionaryUnavailableException(dictionaryId, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DictionaryUnavailableException(dictionaryId, e);
        }
    }
}

package com.wordhub.gameservice.games.scrabble.application.config;

import com.wordhub.gameservice.games.scrabble.domain.dictionary.WordOracle;
import com.wordhub.gameservice.games.scrabble.domain.repository.DictionaryRepository;
import com.wordhub.gameservice.games.scrabble.domain.rule.GameRules;
import com.wordhub.gameservice.games.scrabble.domain.rule.MoveValidator;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 规则引擎装配：规则常量、词典预言机（带独立查询线程池）、走子校验器。
 */
@Configuration
public class ScrabbleEngineConfig {

    @Bean
    public GameRules gameRules(GameProperties props) {
        return new GameRules(props.getPassLimit(), props.getRackSize(), props.getBingoBonus(), props.getExchangeMinBag());
    }

    /**
     * 词典查询专用线程池：房间写线程只在这里等结果，且有超时上限。
     */
    @Bean(name = "dictionaryLookupExecutor", destroyMethod = "shutdownNow")
    public ExecutorService dictionaryLookupExecutor(DictionaryProperties props) {
        ThreadFactory tf = new ThreadFactory() {
            private final AtomicInteger seq = new AtomicInteger(1);
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "dict-lookup-" + seq.getAndIncrement());
                t.setDaemon(true);
                return t;
            }
        };
        int n = Math.max(1, props.getLookupThreads());
        return new ThreadPoolExecutor(n, n, 60, TimeUnit.SECONDS, new LinkedBlockingQueue<>(1024), tf,
                new ThreadPoolExecutor.AbortPolicy());
    }

    @Bean
    public WordOracle wordOracle(DictionaryRepository repository,
                                 @Qualifier("dictionaryLookupExecutor") ExecutorService executor,
                                 DictionaryProperties props) {
        return new WordOracle(repository, executor, props.getLookupTimeout(), props.getCacheSize());
    }

    @Bean
    public MoveValidator moveValidator(WordOracle oracle, GameRules rules) {
        return new MoveValidator(oracle, rules);
    }
}

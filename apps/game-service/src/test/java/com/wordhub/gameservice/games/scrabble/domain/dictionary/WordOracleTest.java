package com.wordhub.gameservice.games.scrabble.domain.dictionary;

import com.wordhub.gameservice.games.scrabble.domain.exception.DictionaryUnavailableException;
import com.wordhub.gameservice.games.scrabble.domain.exception.ErrorCode;
import com.wordhub.gameservice.games.scrabble.domain.repository.DictionaryRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WordOracleTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(2);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void answersAreCachedPerDictionary() {
        AtomicInteger calls = new AtomicInteger();
        DictionaryRepository repo = (dict, word) -> {
            calls.incrementAndGet();
            return "TWL".equals(dict) && Set.of("CAT", "DOG").contains(word);
        };
        WordOracle oracle = new WordOracle(repo, executor, Duration.ofSeconds(1), 100);

        assertThat(oracle.isValid("cat", "TWL")).isTrue();
        assertThat(oracle.isValid("CAT", "TWL")).isTrue();
        assertThat(oracle.isValid("CAT", "SOWPODS")).isFalse();
        assertThat(oracle.isValid("XYZ", "TWL")).isFalse();
        assertThat(oracle.isValid("XYZ", "TWL")).isFalse();

        assertThat(calls.get()).isEqualTo(3);
        assertThat(oracle.cachedEntries()).isEqualTo(3);
    }

    @Test
    void nonLettersAreRejectedWithoutLookup() {
        AtomicInteger calls = new AtomicInteger();
        WordOracle oracle = new WordOracle((d, w) -> calls.incrementAndGet() > 0, executor, Duration.ofSeconds(1), 10);

        assertThat(oracle.isValid("CA7", "TWL")).isFalse();
        assertThat(oracle.isValid("", "TWL")).isFalse();
        assertThat(oracle.isValid(null, "TWL")).isFalse();
        assertThat(calls.get()).isZero();
    }

    @Test
    void slowCollaboratorIsSurfacedAsUnavailable() {
        DictionaryRepository slow = (d, w) -> {
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return true;
        };
        WordOracle oracle = new WordOracle(slow, executor, Duration.ofMillis(50), 10);

        long start = System.nanoTime();
        assertThatThrownBy(() -> oracle.isValid("CAT", "TWL"))
                .isInstanceOf(DictionaryUnavailableException.class)
                .satisfies(e -> assertThat(((DictionaryUnavailableException) e).getCode())
                        .isEqualTo(ErrorCode.DICTIONARY_UNAVAILABLE));
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(1));
        assertThat(oracle.cachedEntries()).isZero();
    }

    @Test
    void failingCollaboratorIsNotTreatedAsInvalidWord() {
        WordOracle oracle = new WordOracle((d, w) -> {
            throw new IllegalStateException("redis down");
        }, executor, Duration.ofSeconds(1), 10);

        assertThatThrownBy(() -> oracle.isValid("CAT", "TWL"))
                .isInstanceOf(DictionaryUnavailableException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void rejectedLookupIsSurfacedAsUnavailable() {
        ExecutorService closed = Executors.newSingleThreadExecutor();
        closed.shutdown();
        WordOracle oracle = new WordOracle((d, w) -> true, closed, Duration.ofSeconds(1), 10);

        assertThatThrownBy(() -> oracle.isValid("CAT", "TWL"))
                .isInstanceOf(DictionaryUnavailableException.class)
                .hasCauseInstanceOf(RejectedExecutionException.class);
        assertThat(oracle.cachedEntries()).isZero();
    }

    @Test
    void cacheIsBoundedAndClearable() {
        WordOracle oracle = new WordOracle((d, w) -> true, executor, Duration.ofSeconds(1), 2);
        oracle.isValid("AA", "TWL");
        oracle.isValid("BB", "TWL");
        oracle.isValid("CC", "TWL");
        assertThat(oracle.cachedEntries()).isEqualTo(2);

        oracle.clearCache();
        assertThat(oracle.cachedEntries()).isZero();
    }
}

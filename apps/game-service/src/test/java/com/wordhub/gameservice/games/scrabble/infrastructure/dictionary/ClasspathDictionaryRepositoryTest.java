package com.wordhub.gameservice.games.scrabble.infrastructure.dictionary;

import com.wordhub.gameservice.games.scrabble.application.config.DictionaryProperties;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClasspathDictionaryRepositoryTest {

    private final ClasspathDictionaryRepository repo =
            new ClasspathDictionaryRepository(new DefaultResourceLoader(), new DictionaryProperties());

    @Test
    void looksUpBundledWordLists() {
        assertThat(repo.loadDictionaryEntry("TWL", "CAT")).isTrue();
        assertThat(repo.loadDictionaryEntry("TWL", "QI")).isTrue();
        assertThat(repo.loadDictionaryEntry("TWL", "XYZZY")).isFalse();
    }

    @Test
    void dictionariesAreIndependent() {
        assertThat(repo.loadDictionaryEntry("SOWPODS", "CH")).isTrue();
        assertThat(repo.loadDictionaryEntry("TWL", "CH")).isFalse();
    }

    @Test
    void commentLinesAreNotWords() {
        assertThat(repo.loadDictionaryEntry("TWL", "#")).isFalse();
    }

    @Test
    void unknownDictionaryFails() {
        assertThatThrownBy(() -> repo.loadDictionaryEntry("KLINGON", "QAPLA"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

package com.wordhub.gameservice.games.scrabble.infrastructure.dictionary;

import com.wordhub.gameservice.games.scrabble.application.config.DictionaryProperties;
import com.wordhub.gameservice.games.scrabble.domain.repository.DictionaryRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Repository;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内置词表：每个词典一个文本文件，每行一个单词，# 开头为注释。
 * 首次查询某个词典时整表加载到内存。
 */
@Slf4j
@Repository
@ConditionalOnProperty(prefix = "wordhub.dictionary", name = "source", havingValue = "classpath", matchIfMissing = true)
public class ClasspathDictionaryRepository implements DictionaryRepository {

    private final ResourceLoader resourceLoader;
    private final DictionaryProperties properties;
    private final Map<String, Set<String>> loaded = new ConcurrentHashMap<>();

    public ClasspathDictionaryRepository(ResourceLoader resourceLoader, DictionaryProperties properties) {
        this.resourceLoader = resourceLoader;
        this.properties = properties;
    }

    @Override
    public boolean loadDictionaryEntry(String dictionaryId, String word) {
        return loaded.computeIfAbsent(dictionaryId, this::load).contains(word);
    }

    private Set<String> load(String dictionaryId) {
        String location = properties.getWordLists().get(dictionaryId);
        if (location == null) {
            throw new IllegalArgumentException("unknown dictionary: " + dictionaryId);
        }
        Resource res = resourceLoader.getResource(location);
        Set<String> words = new HashSet<>();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(res.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) continue;
                words.add(line.toUpperCase(Locale.ROOT));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read word list " + location, e);
        }
        log.info("词表已加载: dict={}, words={}", dictionaryId, words.size());
        return words;
    }
}

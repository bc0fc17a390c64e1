package com.wordhub.gameservice.games.scrabble.infrastructure.asset;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wordhub.gameservice.games.scrabble.domain.model.Cell;
import com.wordhub.gameservice.games.scrabble.domain.model.Premium;
import com.wordhub.gameservice.games.scrabble.domain.model.TileDistribution;
import com.wordhub.gameservice.games.scrabble.domain.repository.GameAssetRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 从 classpath 读取棋盘配置（board-configs/{id}.json）与牌面分布（tile-distributions/{lang}.json）。
 *
 * 棋盘配置的格子键为 1 基 "行,列"，值为 star / 2L / 3L / 2W / 3W；
 * 解析结果按 id 缓存，每次 loadBoardConfig 返回新的空棋盘。
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class ClasspathGameAssetRepository implements GameAssetRepository {

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    private final Map<String, Premium[][]> layouts = new ConcurrentHashMap<>();
    private final Map<String, TileDistribution> distributions = new ConcurrentHashMap<>();

    @Override
    public Cell[][] loadBoardConfig(String configId) {
        Premium[][] layout = layouts.computeIfAbsent(configId, this::readLayout);
        int size = layout.length;
        Cell[][] cells = new Cell[size][size];
        for (int r = 0; r < size; r++) {
            for (int c = 0; c < size; c++) {
                cells[r][c] = new Cell(r, c, layout[r][c]);
            }
        }
        return cells;
    }

    @Override
    public TileDistribution loadTileDistribution(String langId) {
        return distributions.computeIfAbsent(langId, this::readDistribution);
    }

    private Premium[][] readLayout(String configId) {
        JsonNode root = readJson("classpath:board-configs/" + configId + ".json", "board config " + configId);
        int size = root.path("boardSize").asInt(0);
        if (size <= 0) {
            throw new IllegalArgumentException("board config " + configId + " has no boardSize");
        }
        Premium[][] layout = new Premium[size][size];
        for (Premium[] row : layout) Arrays.fill(row, Premium.NONE);
        Iterator<Map.Entry<String, JsonNode>> it = root.path("premiumSquares").fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            String[] rc = e.getKey().split(",");
            int r = Integer.parseInt(rc[0].trim()) - 1;
            int c = Integer.parseInt(rc[1].trim()) - 1;
            if (r < 0 || r >= size || c < 0 || c >= size) {
                throw new IllegalArgumentException("premium square out of board: " + e.getKey());
            }
            layout[r][c] = Premium.fromCode(e.getValue().asText());
        }
        log.info("棋盘配置已加载: id={}, size={}", configId, size);
        return layout;
    }

    private TileDistribution readDistribution(String langId) {
        JsonNode root = readJson("classpath:tile-distributions/" + langId + ".json", "tile distribution " + langId);
        Map<Character, TileDistribution.LetterSpec> letters = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = root.path("letters").fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            if (e.getKey().length() != 1) {
                throw new IllegalArgumentException("bad letter key in " + langId + ": " + e.getKey());
            }
            letters.put(e.getKey().charAt(0), new TileDistribution.LetterSpec(
                    e.getValue().path("count").asInt(), e.getValue().path("points").asInt()));
        }
        TileDistribution dist = new TileDistribution(langId, letters);
        log.info("牌面分布已加载: lang={}, tiles={}", langId, dist.totalTiles());
        return dist;
    }

    private JsonNode readJson(String location, String what) {
        Resource res = resourceLoader.getResource(location);
        if (!res.exists()) {
            throw new IllegalArgumentException("unknown " + what);
        }
        try (InputStream in = res.getInputStream()) {
            return objectMapper.readTree(in);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read " + what, e);
        }
    }
}

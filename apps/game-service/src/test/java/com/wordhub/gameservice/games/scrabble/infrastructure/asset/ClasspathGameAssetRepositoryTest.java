package com.wordhub.gameservice.games.scrabble.infrastructure.asset;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wordhub.gameservice.games.scrabble.domain.model.Cell;
import com.wordhub.gameservice.games.scrabble.domain.model.Premium;
import com.wordhub.gameservice.games.scrabble.domain.model.TileDistribution;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClasspathGameAssetRepositoryTest {

    private final ClasspathGameAssetRepository repo =
            new ClasspathGameAssetRepository(new DefaultResourceLoader(), new ObjectMapper());

    @Test
    void standardBoardLayout() {
        Cell[][] cells = repo.loadBoardConfig("standard-15");

        assertThat(cells).hasNumberOfRows(15);
        // 配置里是 1 基坐标
        assertThat(cells[7][7].getPremium()).isEqualTo(Premium.CENTER);
        assertThat(cells[0][0].getPremium()).isEqualTo(Premium.TW);
        assertThat(cells[0][3].getPremium()).isEqualTo(Premium.DL);
        assertThat(cells[1][1].getPremium()).isEqualTo(Premium.DW);
        assertThat(cells[0][1].getPremium()).isEqualTo(Premium.NONE);
    }

    @Test
    void everyLoadReturnsFreshCells() {
        Cell[][] a = repo.loadBoardConfig("standard-15");
        Cell[][] b = repo.loadBoardConfig("standard-15");

        assertThat(a[7][7]).isNotSameAs(b[7][7]);
    }

    @Test
    void englishDistributionHasHundredTiles() {
        TileDistribution dist = repo.loadTileDistribution("en");

        assertThat(dist.totalTiles()).isEqualTo(100);
        assertThat(dist.pointsOf('Q')).isEqualTo(10);
        assertThat(dist.letters().get('_').count()).isEqualTo(2);
    }

    @Test
    void unknownAssetsAreRejected() {
        assertThatThrownBy(() -> repo.loadBoardConfig("hex-99")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> repo.loadTileDistribution("tlh")).isInstanceOf(IllegalArgumentException.class);
    }
}

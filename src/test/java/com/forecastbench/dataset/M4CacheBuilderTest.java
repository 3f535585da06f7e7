package com.forecastbench.dataset;

import com.forecastbench.config.DatasetPaths;
import com.forecastbench.exception.CorpusUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class M4CacheBuilderTest {

    @TempDir Path dir;

    private M4CacheBuilder builder;
    private M4DatasetLoader loader;

    @BeforeEach
    void setUp() throws IOException {
        DatasetPaths paths = DatasetPaths.defaults(dir);
        JsonValueStore store = new JsonValueStore(paths);
        loader = new M4DatasetLoader(paths, store);
        builder = new M4CacheBuilder(paths, loader, store);

        Files.writeString(dir.resolve("M4-info.csv"),
            "M4id,SP,Frequency,Horizon\nY1,Yearly,1,2\nY2,Yearly,1,2\nH1,Hourly,24,1\n");
        Files.writeString(dir.resolve("Yearly-train.csv"),
            "\"V1\",\"V2\",\"V3\",\"V4\"\n\"Y2\",1,2,\n\"Y1\",5,6,7\n");
        Files.writeString(dir.resolve("Hourly-train.csv"), "\"V1\",\"V2\"\n\"H1\",9\n");
        Files.writeString(dir.resolve("Yearly-test.csv"), "\"V1\",\"V2\",\"V3\"\n\"Y1\",8,9\n\"Y2\",3,4\n");
        Files.writeString(dir.resolve("Hourly-test.csv"), "\"V1\",\"V2\"\n\"H1\",10\n");
    }

    @Test
    void buildAll_writesStoresInReferenceOrder() throws IOException {
        assertThat(builder.isCached()).isFalse();

        builder.buildAll();

        assertThat(builder.isCached()).isTrue();
        M4Dataset training = loader.load(M4Partition.TRAINING);
        assertThat(training.values().get(0)).containsExactly(5.0, 6.0, 7.0);
        assertThat(training.values().get(1)).containsExactly(1.0, 2.0);
        assertThat(training.values().get(2)).containsExactly(9.0);
        M4Dataset test = loader.load(M4Partition.TEST);
        assertThat(test.values().get(1)).containsExactly(3.0, 4.0);
    }

    @Test
    void build_seriesMissingFromFiles_becomesEmpty() throws IOException {
        Files.delete(dir.resolve("Hourly-train.csv"));

        var values = builder.build(M4Partition.TRAINING, loader.loadInfo());

        assertThat(values).hasSize(3);
        assertThat(values.get(2)).isEmpty();
    }

    @Test
    void build_noPartitionFiles_throwsCorpusUnavailable() throws IOException {
        Files.delete(dir.resolve("Yearly-test.csv"));
        Files.delete(dir.resolve("Hourly-test.csv"));
        assertThatThrownBy(() -> builder.build(M4Partition.TEST, loader.loadInfo()))
            .isInstanceOf(CorpusUnavailableException.class);
    }
}

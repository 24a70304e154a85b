package com.promptvector.search.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the vector search engine.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "vector")
public class VectorSearchProperties {

    /**
     * Dimensionality D of every stored vector.
     */
    @Min(1)
    private int dimension = 384;

    @Valid
    @NotNull
    private Index index = new Index();

    @Valid
    @NotNull
    private Search search = new Search();

    @Valid
    @NotNull
    private Cluster cluster = new Cluster();

    @Valid
    @NotNull
    private Batch batch = new Batch();

    @Valid
    @NotNull
    private Analytics analytics = new Analytics();

    @Valid
    @NotNull
    private Maintenance maintenance = new Maintenance();

    @Valid
    @NotNull
    private Metrics metrics = new Metrics();

    @Data
    public static class Index {
        /** Количество соседей на уровень */
        @Min(1)
        private int m = 10;

        @Min(0)
        @Max(16)
        private int maxLevel = 16;

        /** Ширина луча на нулевом уровне */
        @Min(1)
        private int efSearch = 64;

        /**
         * Seed of the level-assignment and k-means random source. Unset means non-deterministic.
         */
        private Long randomSeed;
    }

    @Data
    public static class Search {
        @Min(1)
        private int defaultLimit = 20;

        @DecimalMin("-1.0")
        @DecimalMax("1.0")
        private double defaultThreshold = 0.5;

        /**
         * Candidate over-fetch factor used when metadata filters are present.
         */
        @Min(1)
        private int filterOverfetch = 5;

        @NotNull
        private Duration cacheTtl = Duration.ofMinutes(15);

        @Min(1)
        private long cacheSize = 1000;
    }

    @Data
    public static class Cluster {
        @NotNull
        private Duration cacheTtl = Duration.ofHours(1);

        @Min(1)
        private long cacheSize = 100;

        @Min(1)
        private int maxIterations = 100;
    }

    @Data
    public static class Batch {
        @Min(1)
        private int chunkSize = 100;

        @Min(1)
        private int parallelism = 4;

        @NotNull
        private Duration pause = Duration.ofMillis(10);

        /**
         * Batches larger than this trigger quantizer recalibration.
         */
        @Min(0)
        private int recalibrationThreshold = 100;
    }

    @Data
    public static class Analytics {
        @Min(1)
        private int queueCapacity = 1000;
    }

    @Data
    public static class Maintenance {
        @Min(0)
        private int rebalanceThreshold = 1000;
    }

    @Data
    public static class Metrics {
        /** Размер скользящего окна замеров */
        @Min(1)
        private int window = 100;
    }
}

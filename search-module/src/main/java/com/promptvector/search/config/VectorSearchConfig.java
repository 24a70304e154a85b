package com.promptvector.search.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.promptvector.search.analytics.AnalyticsSink;
import com.promptvector.search.analytics.LoggingAnalyticsSink;
import com.promptvector.search.embedding.EmbeddingProvider;
import com.promptvector.search.embedding.HashingEmbeddingProvider;
import com.promptvector.search.similarity.VectorSimilarity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Конфигурация поискового движка: общие источники случайности и времени,
 * пул подготовки батчей и внешние коллабораторы по умолчанию.
 */
@Slf4j
@Configuration
@ComponentScan("com.promptvector.search")
@EnableConfigurationProperties(VectorSearchProperties.class)
@RequiredArgsConstructor
public class VectorSearchConfig {

    private final VectorSearchProperties properties;

    /**
     * Random source for level assignment and k-means seeding
     */
    @Bean
    @ConditionalOnMissingBean
    public Random vectorRandom() {
        Long seed = properties.getIndex().getRandomSeed();
        if (seed == null) {
            return new Random();
        }
        log.info("Using seeded random source: {}", seed);
        return new Random(seed);
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Executor для параллельной подготовки батчей документов
     */
    @Bean(name = "ingestExecutor", destroyMethod = "shutdown")
    public ExecutorService ingestExecutor() {
        int parallelism = properties.getBatch().getParallelism();
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
            parallelism, // corePoolSize
            parallelism, // maximumPoolSize
            60L, TimeUnit.SECONDS, // keepAliveTime
            new LinkedBlockingQueue<>(properties.getBatch().getChunkSize() * 4), // workQueue
            new ThreadFactoryBuilder().setNameFormat("ingest-%d").setDaemon(true).build(),
            new ThreadPoolExecutor.CallerRunsPolicy() // rejection handler
        );

        // Разрешаем уменьшение пула потоков ниже corePoolSize
        executor.allowCoreThreadTimeOut(true);

        return executor;
    }

    @Bean
    @ConditionalOnMissingBean
    public EmbeddingProvider embeddingProvider(VectorSimilarity similarity) {
        log.info("No embedding provider configured, using hashing embeddings of dimension {}", properties.getDimension());
        return new HashingEmbeddingProvider(properties.getDimension(), similarity);
    }

    @Bean
    @ConditionalOnMissingBean
    public AnalyticsSink analyticsSink() {
        return new LoggingAnalyticsSink();
    }
}

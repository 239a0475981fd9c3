package com.specsim.infrastructure.sim.config;

import com.specsim.infrastructure.sim.model.EnumCatalog;
import com.specsim.infrastructure.sim.normalize.HeaderVocabulary;
import com.specsim.infrastructure.sim.normalize.UnitTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Immutable lookup tables and the two bounded pools, created once per application.
 * Extraction calls out to collaborators that may hang, so it never shares threads with normalization.
 */
@Slf4j
@Configuration
public class SimLookupConfig {

    @Value("${sim.pipeline.worker-threads:0}")
    private int workerThreads;

    @Value("${sim.pipeline.extraction-threads:0}")
    private int extractionThreads;

    @Bean
    public HeaderVocabulary headerVocabulary() {
        return HeaderVocabulary.standard();
    }

    @Bean
    public UnitTable unitTable() {
        return UnitTable.standard();
    }

    @Bean
    public EnumCatalog enumCatalog() {
        return EnumCatalog.standard();
    }

    @Bean(name = "simWorkerPool", destroyMethod = "shutdownNow")
    public ExecutorService simWorkerPool() {
        int size = workerThreads > 0 ? workerThreads : Runtime.getRuntime().availableProcessors();
        log.info("[Config] sim worker pool: {} threads", size);
        return Executors.newFixedThreadPool(size, namedDaemonThreads("sim-worker-"));
    }

    @Bean(name = "simExtractionPool", destroyMethod = "shutdownNow")
    public ExecutorService simExtractionPool() {
        int size = extractionThreads > 0 ? extractionThreads : Runtime.getRuntime().availableProcessors();
        log.info("[Config] sim extraction pool: {} threads", size);
        return Executors.newFixedThreadPool(size, namedDaemonThreads("sim-extract-"));
    }

    private static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}

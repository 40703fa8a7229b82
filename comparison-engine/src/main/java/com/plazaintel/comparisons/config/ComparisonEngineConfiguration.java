package com.plazaintel.comparisons.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.plazaintel.comparisons.backend.AccelerationBackend;
import com.plazaintel.comparisons.backend.AccelerationGateway;
import com.plazaintel.comparisons.backend.AcceleratedAggregationBackend;
import com.plazaintel.comparisons.backend.AggregationBackend;
import com.plazaintel.comparisons.backend.ColumnarAccelerationBackend;
import com.plazaintel.comparisons.backend.InMemoryAggregationBackend;
import com.plazaintel.comparisons.scheduler.CacheWatchdog;
import com.plazaintel.comparisons.scheduler.JvmMemorySampler;
import com.plazaintel.comparisons.scheduler.MemorySampler;
import com.plazaintel.comparisons.scheduler.ProcessExitShutdownStrategy;
import com.plazaintel.comparisons.scheduler.ShutdownStrategy;
import com.plazaintel.comparisons.service.ByteFetchClient;
import com.plazaintel.comparisons.service.ComparisonEngine;
import com.plazaintel.comparisons.service.ComparisonResultCache;
import com.plazaintel.comparisons.service.ComparisonService;
import com.plazaintel.comparisons.service.DatasetParser;
import com.plazaintel.comparisons.service.HttpByteFetchClient;
import com.plazaintel.comparisons.service.LocalDatasetLoader;
import com.plazaintel.comparisons.service.PeriodFetcher;
import com.plazaintel.comparisons.service.PeriodStore;
import com.plazaintel.comparisons.service.PlazaRecordMapper;
import com.plazaintel.comparisons.service.RemoteIndex;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the period cache. Everything is built here from
 * {@link ComparisonProperties}; the accelerated backend exists only when
 * {@code comparisons.backend.accelerated=true}.
 */
@Configuration
@Slf4j
public class ComparisonEngineConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(prefix = "comparisons.backend", name = "accelerated", havingValue = "true")
    public AccelerationBackend accelerationBackend(ComparisonProperties properties, Clock clock) {
        int maxPeriods = properties.getBackend().getMaxPeriods();
        log.info("Accelerated backend enabled (max {} periods, {} results)",
                maxPeriods, ColumnarAccelerationBackend.MAX_RESULTS);
        return new ColumnarAccelerationBackend(maxPeriods, clock);
    }

    @Bean
    public AccelerationGateway accelerationGateway(ObjectProvider<AccelerationBackend> backend) {
        return new AccelerationGateway(backend.getIfAvailable());
    }

    @Bean
    public PeriodStore periodStore(PlazaRecordMapper mapper, AccelerationGateway gateway) {
        return new PeriodStore(mapper, gateway);
    }

    @Bean
    public AggregationBackend aggregationBackend(AccelerationGateway gateway) {
        InMemoryAggregationBackend inMemory = new InMemoryAggregationBackend();
        AggregationBackend chosen = gateway.isPresent()
                ? new AcceleratedAggregationBackend(gateway, inMemory)
                : inMemory;
        log.info("Aggregation backend: {}", chosen.name());
        return chosen;
    }

    @Bean
    public RemoteIndex remoteIndex(ObjectMapper objectMapper, ComparisonProperties properties) {
        return new RemoteIndex(objectMapper, Path.of(properties.getSources().getManifest()));
    }

    @Bean
    public LocalDatasetLoader localDatasetLoader(DatasetParser parser, ComparisonProperties properties) {
        return new LocalDatasetLoader(parser, Path.of(properties.getSources().getLocalDataset()));
    }

    @Bean
    public ByteFetchClient byteFetchClient(ComparisonProperties properties) {
        return new HttpByteFetchClient(properties.getFetch().getConnectTimeout());
    }

    @Bean
    public PeriodFetcher periodFetcher(RemoteIndex remoteIndex,
                                       ByteFetchClient fetchClient,
                                       DatasetParser parser,
                                       PlazaRecordMapper mapper,
                                       PeriodStore store,
                                       AccelerationGateway gateway,
                                       ComparisonProperties properties) {
        return new PeriodFetcher(remoteIndex, fetchClient, parser, mapper, store, gateway, properties.getFetch());
    }

    @Bean
    public ComparisonResultCache comparisonResultCache(ComparisonProperties properties, Clock clock) {
        return new ComparisonResultCache(clock,
                properties.getCache().getResultTtl(),
                properties.getCache().getMaxResults());
    }

    @Bean
    public ComparisonEngine comparisonEngine(PeriodStore store,
                                             PeriodFetcher fetcher,
                                             AggregationBackend aggregation,
                                             ComparisonResultCache resultCache,
                                             RemoteIndex remoteIndex,
                                             Clock clock) {
        return new ComparisonEngine(store, fetcher, aggregation, resultCache, remoteIndex, clock);
    }

    @Bean
    public ComparisonService comparisonService(ComparisonEngine engine,
                                               PeriodFetcher fetcher,
                                               PeriodStore store,
                                               ComparisonResultCache resultCache,
                                               RemoteIndex remoteIndex,
                                               AccelerationGateway gateway,
                                               AggregationBackend aggregation) {
        return new ComparisonService(engine, fetcher, store, resultCache, remoteIndex, gateway, aggregation);
    }

    @Bean
    public MemorySampler memorySampler() {
        return new JvmMemorySampler();
    }

    @Bean
    public ShutdownStrategy shutdownStrategy() {
        return new ProcessExitShutdownStrategy();
    }

    @Bean
    public CacheWatchdog cacheWatchdog(PeriodStore store,
                                       ComparisonResultCache resultCache,
                                       AccelerationGateway gateway,
                                       MemorySampler memorySampler,
                                       ShutdownStrategy shutdownStrategy,
                                       ComparisonProperties properties,
                                       Clock clock) {
        return new CacheWatchdog(store, resultCache, gateway, memorySampler, shutdownStrategy, properties, clock);
    }
}

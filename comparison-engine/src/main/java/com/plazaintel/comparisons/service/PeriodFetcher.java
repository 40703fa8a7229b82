package com.plazaintel.comparisons.service;

import com.plazaintel.comparisons.backend.AccelerationGateway;
import com.plazaintel.comparisons.config.ComparisonProperties;
import com.plazaintel.comparisons.model.EnsureResult;
import com.plazaintel.comparisons.model.FetchFailure;
import com.plazaintel.comparisons.model.FetchFailureType;
import com.plazaintel.comparisons.model.FetchedPayload;
import com.plazaintel.comparisons.model.Period;
import com.plazaintel.comparisons.model.PeriodKey;
import com.plazaintel.comparisons.model.PlazaRecord;
import com.plazaintel.comparisons.model.RemoteIndexEntry;
import com.plazaintel.comparisons.model.TabularDataset;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Makes a period resident, downloading it from the remote index when needed.
 *
 * Order of checks:
 *  1. already in the acceleration backend (and in the store)  → cache_hit
 *  2. already in the store                                     → ok_local / ok_local_backend
 *  3. no index entry / blank locator                           → terminal failure
 *  4. download, parse, install                                 → ok_download
 *
 * Timeouts, HTTP errors, network errors and unparseable payloads are retried
 * {@code maxRetries} times with a linear backoff of 2 * attempt * backoffUnit.
 * Nothing here throws for a fetch problem; the outcome is always an {@link EnsureResult}.
 */
@Slf4j
public class PeriodFetcher {

    public static final String CACHE_HIT = "cache_hit";
    public static final String OK_LOCAL = "ok_local";
    public static final String OK_LOCAL_BACKEND = "ok_local_backend";
    public static final String OK_DOWNLOAD = "ok_download";

    private final RemoteIndex remoteIndex;
    private final ByteFetchClient fetchClient;
    private final DatasetParser parser;
    private final PlazaRecordMapper mapper;
    private final PeriodStore store;
    private final AccelerationGateway backend;
    private final Duration timeout;
    private final int maxRetries;
    private final Retry retry;

    public PeriodFetcher(RemoteIndex remoteIndex,
                         ByteFetchClient fetchClient,
                         DatasetParser parser,
                         PlazaRecordMapper mapper,
                         PeriodStore store,
                         AccelerationGateway backend,
                         ComparisonProperties.Fetch config) {
        this.remoteIndex = remoteIndex;
        this.fetchClient = fetchClient;
        this.parser = parser;
        this.mapper = mapper;
        this.store = store;
        this.backend = backend;
        this.timeout = config.getTimeout();
        this.maxRetries = Math.max(0, config.getMaxRetries());

        long unitMs = config.getBackoffUnit().toMillis();
        RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(1 + maxRetries)
                .intervalFunction(attempt -> 2L * attempt * unitMs)
                .retryOnException(PeriodFetcher::isRetryable)
                .build();
        this.retry = Retry.of("periodDownload", retryConfig);
        this.retry.getEventPublisher().onRetry(event -> log.warn(
                "Download attempt {}/{} failed: {}, retrying in {} ms",
                event.getNumberOfRetryAttempts(), 1 + maxRetries,
                event.getLastThrowable() == null ? "unknown" : event.getLastThrowable().getMessage(),
                event.getWaitInterval().toMillis()));
    }

    public EnsureResult ensure(int year, int month) {
        return ensure(PeriodKey.encode(year, month));
    }

    public EnsureResult ensure(int key) {
        String label = PeriodKey.indexLabel(key);

        if (backend.isCached(key) && store.contains(key)) {
            return EnsureResult.success(CACHE_HIT);
        }

        Optional<List<PlazaRecord>> resident = store.get(key).map(Period::getRecords);
        if (resident.isPresent()) {
            boolean mirrored = backend.mirror(key, resident.get());
            return EnsureResult.success(mirrored ? OK_LOCAL_BACKEND : OK_LOCAL);
        }

        Optional<RemoteIndexEntry> entry = remoteIndex.lookup(label);
        if (entry.isEmpty()) {
            log.info("ensure({}): not in remote index", label);
            return EnsureResult.failed(FetchFailure.of(FetchFailureType.NO_INDEX_ENTRY, label, null));
        }
        if (!entry.get().hasLocator()) {
            log.warn("ensure({}): index entry has no locator", label);
            return EnsureResult.failed(FetchFailure.of(FetchFailureType.NO_LOCATOR, label, null));
        }

        return download(key, entry.get());
    }

    // ── Download ─────────────────────────────────────────────────────────────

    private EnsureResult download(int key, RemoteIndexEntry entry) {
        String label = entry.label();
        AtomicInteger attempts = new AtomicInteger();

        Supplier<List<PlazaRecord>> attempt = Retry.decorateSupplier(retry, () -> {
            attempts.incrementAndGet();
            return downloadOnce(entry);
        });

        List<PlazaRecord> records;
        try {
            records = attempt.get();
        } catch (FetchFailedException e) {
            if (e.isRetryable()) {
                log.warn("ensure({}): giving up after {} attempts: {}", label, attempts.get(), e.getMessage());
                return EnsureResult.failed(FetchFailure.exhausted(label, attempts.get(), e.getFailure()));
            }
            return EnsureResult.failed(e.getFailure());
        } catch (RuntimeException e) {
            log.error("ensure({}): unexpected download failure: {}", label, e.getMessage(), e);
            return EnsureResult.failed(FetchFailure.of(FetchFailureType.NETWORK_ERROR, label,
                    e.getClass().getSimpleName() + ": " + e.getMessage()));
        }

        store.putHistorical(key, records);
        backend.mirror(key, records);
        log.info("Downloaded {} ({} rows, attempt {})", label, records.size(), attempts.get());
        return EnsureResult.success(OK_DOWNLOAD);
    }

    private List<PlazaRecord> downloadOnce(RemoteIndexEntry entry) {
        String label = entry.label();
        FetchedPayload payload = fetchClient.fetch(label, entry.locator(), timeout);
        log.debug("Fetched {}: {} bytes ({})", label, payload.size(), payload.contentType());

        String name = entry.name() != null ? entry.name() : payload.name();
        TabularDataset dataset;
        try {
            dataset = parser.parse(payload.bytes(), name);
        } catch (DatasetParseException e) {
            throw new FetchFailedException(FetchFailure.of(FetchFailureType.PARSE_FAILED, label, e.getMessage()), e);
        }
        if (dataset.isEmpty()) {
            throw new FetchFailedException(FetchFailure.of(FetchFailureType.PARSE_FAILED, label, "no rows"));
        }
        return mapper.map(dataset);
    }

    private static boolean isRetryable(Throwable t) {
        return t instanceof FetchFailedException && ((FetchFailedException) t).isRetryable();
    }
}

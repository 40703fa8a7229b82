package com.plazaintel.comparisons.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.plazaintel.comparisons.backend.AccelerationGateway;
import com.plazaintel.comparisons.backend.ColumnarAccelerationBackend;
import com.plazaintel.comparisons.config.ComparisonProperties;
import com.plazaintel.comparisons.model.EnsureResult;
import com.plazaintel.comparisons.model.FetchFailureType;
import com.plazaintel.comparisons.support.FakeByteFetchClient;
import com.plazaintel.comparisons.support.Fixtures;
import com.plazaintel.comparisons.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PeriodFetcherTest {

    private static final String MANIFEST = """
            {
              "index": {
                "2023-05": {"download_url": "https://files.example/2023-05.csv", "name": "plazas_2023_05.csv"},
                "2023-06": {"download_url": "", "name": "plazas_2023_06.csv"},
                "2023-07": {"url": "files/2023-07.csv"}
              }
            }
            """;

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private RemoteIndex remoteIndex;
    private PeriodStore store;
    private FakeByteFetchClient client;

    @BeforeEach
    void setUp() throws IOException {
        Path manifest = tempDir.resolve("index.json");
        Files.writeString(manifest, MANIFEST, StandardCharsets.UTF_8);
        remoteIndex = new RemoteIndex(objectMapper, manifest);
        remoteIndex.reload();

        store = new PeriodStore(new PlazaRecordMapper(), AccelerationGateway.disabled());
        client = new FakeByteFetchClient();
    }

    @Test
    @DisplayName("a resident period is served locally without touching the network")
    void residentPeriod() {
        store.indexProtected(Fixtures.monthlyDataset(2024, 1, 1));

        EnsureResult result = fetcher(2).ensure(2024, 1);

        assertThat(result.ok()).isTrue();
        assertThat(result.reason()).isEqualTo(PeriodFetcher.OK_LOCAL);
        assertThat(client.calls()).isEmpty();
    }

    @Test
    @DisplayName("a period in both backend and store is a cache hit")
    void backendCacheHit() {
        AccelerationGateway gateway = new AccelerationGateway(
                new ColumnarAccelerationBackend(24, new MutableClock(Instant.parse("2025-01-01T00:00:00Z"))));
        store = new PeriodStore(new PlazaRecordMapper(), gateway);
        store.indexProtected(Fixtures.monthlyDataset(2024, 1, 1));

        EnsureResult result = fetcher(2, gateway).ensure(2024, 1);

        assertThat(result.reason()).isEqualTo(PeriodFetcher.CACHE_HIT);
    }

    @Test
    @DisplayName("a period missing from the index fails with NO_INDEX_ENTRY")
    void noIndexEntry() {
        EnsureResult result = fetcher(2).ensure(2022, 1);

        assertThat(result.ok()).isFalse();
        assertThat(result.failure().type()).isEqualTo(FetchFailureType.NO_INDEX_ENTRY);
        assertThat(client.calls()).isEmpty();
    }

    @Test
    @DisplayName("a blank locator fails with NO_LOCATOR and is not retried")
    void blankLocator() {
        EnsureResult result = fetcher(2).ensure(2023, 6);

        assertThat(result.failure().type()).isEqualTo(FetchFailureType.NO_LOCATOR);
        assertThat(client.calls()).isEmpty();
    }

    @Test
    @DisplayName("a successful download installs the period as historical")
    void download() {
        client.thenReturn(Fixtures.csv(List.of(Fixtures.row(2023, 5, 9, "Jalisco", "P-1", 300))));

        EnsureResult result = fetcher(2).ensure(2023, 5);

        assertThat(result.reason()).isEqualTo(PeriodFetcher.OK_DOWNLOAD);
        assertThat(store.contains(202305)).isTrue();
        assertThat(store.isProtected(202305)).isFalse();
        assertThat(client.calls()).containsExactly("https://files.example/2023-05.csv");
    }

    @Test
    @DisplayName("a persistent failure is attempted 1 + maxRetries times")
    void attemptsMatchRetryBudget() {
        client.thenFail(FetchFailureType.TIMEOUT)
                .thenFail(FetchFailureType.TIMEOUT)
                .thenFail(FetchFailureType.TIMEOUT)
                .thenFail(FetchFailureType.TIMEOUT);

        EnsureResult result = fetcher(2).ensure(2023, 5);

        assertThat(client.calls()).hasSize(3);
        assertThat(result.ok()).isFalse();
        assertThat(result.failure().type()).isEqualTo(FetchFailureType.EXHAUSTED_RETRIES);
        assertThat(result.failure().lastCause().type()).isEqualTo(FetchFailureType.TIMEOUT);
        assertThat(result.reason()).startsWith("exhausted_retries(3 attempts)");
    }

    @Test
    @DisplayName("fail twice then succeed: succeeds with two retries")
    void recoversWithinBudget() {
        byte[] payload = Fixtures.csv(List.of(Fixtures.row(2023, 5, 9, "Jalisco", "P-1", 300)));
        client.thenHttpError(503).thenFail(FetchFailureType.NETWORK_ERROR).thenReturn(payload);

        EnsureResult result = fetcher(2).ensure(2023, 5);

        assertThat(result.ok()).isTrue();
        assertThat(client.calls()).hasSize(3);
    }

    @Test
    @DisplayName("fail twice then succeed: exhausts with one retry")
    void exhaustsWithSmallerBudget() {
        byte[] payload = Fixtures.csv(List.of(Fixtures.row(2023, 5, 9, "Jalisco", "P-1", 300)));
        client.thenHttpError(503).thenHttpError(502).thenReturn(payload);

        EnsureResult result = fetcher(1).ensure(2023, 5);

        assertThat(result.ok()).isFalse();
        assertThat(client.calls()).hasSize(2);
        assertThat(result.failure().lastCause().httpStatus()).isEqualTo(502);
        assertThat(store.contains(202305)).isFalse();
    }

    @Test
    @DisplayName("an unreadable payload counts as a retryable parse failure")
    void parseFailureIsRetried() {
        client.thenReturn(new byte[]{'P', 'A', 'R', '1', 0, 0});

        EnsureResult result = fetcher(1).ensure(2023, 5);

        assertThat(client.calls()).hasSize(2);
        assertThat(result.failure().lastCause().type()).isEqualTo(FetchFailureType.PARSE_FAILED);
    }

    @Test
    @DisplayName("a relative locator fails with NO_LOCATOR through the HTTP client instead of throwing")
    void relativeLocatorIsTyped() {
        ComparisonProperties.Fetch config = new ComparisonProperties.Fetch();
        config.setMaxRetries(2);
        config.setBackoffUnit(Duration.ofMillis(1));
        PeriodFetcher http = new PeriodFetcher(remoteIndex, new HttpByteFetchClient(Duration.ofSeconds(1)),
                new DatasetParser(objectMapper), new PlazaRecordMapper(), store, AccelerationGateway.disabled(), config);

        EnsureResult result = http.ensure(2023, 7);

        assertThat(result.ok()).isFalse();
        assertThat(result.failure().type()).isEqualTo(FetchFailureType.NO_LOCATOR);
        assertThat(store.contains(202307)).isFalse();
    }

    @Test
    @DisplayName("an unexpected client exception becomes a typed failure and is not retried")
    void unexpectedExceptionIsTyped() {
        client.thenThrow(new IllegalStateException("connection pool closed"));

        EnsureResult result = fetcher(2).ensure(2023, 5);

        assertThat(result.ok()).isFalse();
        assertThat(result.failure().type()).isEqualTo(FetchFailureType.NETWORK_ERROR);
        assertThat(result.reason()).contains("connection pool closed");
        assertThat(client.calls()).hasSize(1);
    }

    private PeriodFetcher fetcher(int maxRetries) {
        return fetcher(maxRetries, AccelerationGateway.disabled());
    }

    private PeriodFetcher fetcher(int maxRetries, AccelerationGateway gateway) {
        ComparisonProperties.Fetch config = new ComparisonProperties.Fetch();
        config.setMaxRetries(maxRetries);
        config.setBackoffUnit(Duration.ofMillis(1));
        config.setTimeout(Duration.ofSeconds(5));
        return new PeriodFetcher(remoteIndex, client, new DatasetParser(objectMapper), new PlazaRecordMapper(),
                store, gateway, config);
    }
}

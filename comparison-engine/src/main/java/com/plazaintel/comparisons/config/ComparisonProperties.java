package com.plazaintel.comparisons.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.unit.DataSize;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "comparisons")
@Data
public class ComparisonProperties {

    private Sources sources = new Sources();
    private Cache cache = new Cache();
    private Fetch fetch = new Fetch();
    private Watchdog watchdog = new Watchdog();
    private Backend backend = new Backend();

    @Data
    public static class Sources {
        /** Local dataset holding the protected periods (CSV or JSON) */
        private String localDataset = "/data/plazas_actual.csv";
        /** Remote index manifest: {"index": {"2024-03": {"download_url": ..., "name": ...}}} */
        private String manifest = "/data/excel_tree_real.json";
    }

    @Data
    public static class Cache {
        private Duration resultTtl = Duration.ofHours(4);
        private int maxHistoricalPeriods = 12;
        private int maxResults = 200;
    }

    @Data
    public static class Fetch {
        private Duration timeout = Duration.ofSeconds(90);
        private Duration connectTimeout = Duration.ofSeconds(30);
        private int maxRetries = 2;
        /** Backoff before retry n is 2 * n * backoffUnit */
        private Duration backoffUnit = Duration.ofSeconds(1);
    }

    @Data
    public static class Watchdog {
        private long intervalMs = 30_000;
        private DataSize ramWarn = DataSize.ofMegabytes(600);
        private DataSize ramKill = DataSize.ofMegabytes(900);
        private boolean hardKillEnabled = true;
    }

    @Data
    public static class Backend {
        private boolean accelerated = false;
        private int maxPeriods = 24;
    }
}

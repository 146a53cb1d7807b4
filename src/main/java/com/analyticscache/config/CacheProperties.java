package com.analyticscache.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings for the indexed analytics cache.
 *
 * Defaults match production: 48h TTL, 4h staleness threshold,
 * 4h cooldown between automatic warms.
 */
@Data
@ConfigurationProperties(prefix = "app.cache")
public class CacheProperties {

    /** Deployment-environment namespace prepended to every key (e.g. "staging:") */
    private String keyPrefix = "";

    /** TTL shared by entries, indexes and metadata */
    private long ttlSeconds = 172_800;

    /** Serialized entries above this size are rejected */
    private long maxEntrySizeBytes = 100L * 1024 * 1024;

    /** Entries per pipelined write batch */
    private int pipelineBatchSize = 500;

    /** Max keys per MGET round trip */
    private int queryBatchSize = 10_000;

    /** Keys per DEL round trip during invalidation */
    private int deleteBatchSize = 1_000;

    /** SCAN COUNT hint */
    private int scanCount = 100;

    /** Expiry of transient union/intersection keys */
    private long tempKeyTtlSeconds = 10;

    /** Age after which a warm cache is served as stale */
    private long stalenessThresholdHours = 4;

    private Warming warming = new Warming();

    private Scheduler scheduler = new Scheduler();

    private Filter filter = new Filter();

    private TypeCache typeCache = new TypeCache();

    @Data
    public static class Warming {
        /** Per-data-source warming lock TTL */
        private long lockTtlSeconds = 300;
        /** Cooldown between automatic warms of one data source */
        private long autoWarmCooldownSeconds = 14_400;
        /** Row ceiling for table-based data sources */
        private int tableMaxRows = 100_000;
        /** How long callers wait on a warm before treating the cache as still cold */
        private long timeoutSeconds = 600;
        /** Schemas warming queries may read from */
        private List<String> allowedSchemas = new ArrayList<>(List.of("ih", "public"));
        /** warmingExecutor pool sizing */
        private int executorCorePoolSize = 2;
        private int executorMaxPoolSize = 4;
        private int executorQueueCapacity = 100;
    }

    @Data
    public static class Scheduler {
        private boolean enabled = true;
        private long checkIntervalMs = 1_800_000;
        private long initialDelayMs = 60_000;
        /** Proactive threshold, kept below the staleness threshold */
        private long warmIfOlderThanHours = 3;
        private long schedulerLockTtlSeconds = 60;
        private long warmingLockTtlSeconds = 1_800;
    }

    @Data
    public static class Filter {
        private boolean endDateInclusive = true;
    }

    @Data
    public static class TypeCache {
        private long maximumSize = 1_000;
        private long expireAfterWriteSeconds = 3_600;
    }
}

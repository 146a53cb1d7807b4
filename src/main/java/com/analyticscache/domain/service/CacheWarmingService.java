package com.analyticscache.domain.service;

import com.analyticscache.config.CacheProperties;
import com.analyticscache.domain.model.CacheDimension;
import com.analyticscache.domain.model.DataSourceConfig;
import com.analyticscache.domain.model.DataSourceType;
import com.analyticscache.domain.model.WarmAllResult;
import com.analyticscache.domain.model.WarmResult;
import com.analyticscache.exception.CacheUnavailableException;
import com.analyticscache.exception.DataSourceNotFoundException;
import com.analyticscache.exception.InvalidCacheKeyException;
import com.analyticscache.infrastructure.cache.AnalyticsIndexStore;
import com.analyticscache.infrastructure.cache.CacheKeyCodec;
import com.analyticscache.infrastructure.cache.CacheStore;
import com.analyticscache.infrastructure.cache.DistributedLockService;
import com.analyticscache.infrastructure.cache.LockHandle;
import com.analyticscache.infrastructure.cache.WriteBatch;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Populates the index store from the analytics database.
 *
 * Warming Flow:
 * 1. Take the per-data-source lock (skip when another instance holds it)
 * 2. Fetch every row of the data source
 * 3. Group rows by (measure, practice, provider, frequency)
 * 4. Stage entries + index memberships, flush every pipeline batch
 * 5. Write the last-warm metadata only after every batch succeeded
 * 6. Release the lock
 *
 * Why warm everything up front?
 * - Cache entries hold all dates and all dimension values
 * - Any chart, date range or dashboard filter is then served from memory
 * - Cache misses never write partial data into the indexes
 *
 * Failure Handling:
 * - Flush failure aborts the warm; metadata stays unset so the source reads as cold
 * - Auto-warm failures are logged on the future, never thrown at the caller
 * - Warm-all isolates each data source
 */
@Slf4j
@Service
public class CacheWarmingService {

    static final String MEASURE_COLUMN = "measure";
    static final String PRACTICE_COLUMN = "practice_uid";
    static final String PROVIDER_COLUMN = "provider_uid";

    private final DataSourceConfigProvider configProvider;
    private final AnalyticsRowSource rowSource;
    private final AnalyticsIndexStore indexStore;
    private final DistributedLockService lockService;
    private final CacheStore cacheStore;
    private final CacheKeyCodec keyCodec;
    private final CacheProperties properties;
    private final MeterRegistry meterRegistry;
    private final Executor warmingExecutor;

    public CacheWarmingService(DataSourceConfigProvider configProvider,
                               AnalyticsRowSource rowSource,
                               AnalyticsIndexStore indexStore,
                               DistributedLockService lockService,
                               CacheStore cacheStore,
                               CacheKeyCodec keyCodec,
                               CacheProperties properties,
                               MeterRegistry meterRegistry,
                               @Qualifier("warmingExecutor") Executor warmingExecutor) {
        this.configProvider = configProvider;
        this.rowSource = rowSource;
        this.indexStore = indexStore;
        this.lockService = lockService;
        this.cacheStore = cacheStore;
        this.keyCodec = keyCodec;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.warmingExecutor = warmingExecutor;
    }

    /**
     * Manual warm of one data source.
     *
     * A completed manual warm also starts the auto-warm cooldown, so a cold-cache
     * request right after an admin warm does not trigger a second one.
     */
    public WarmResult warmDataSource(int dataSourceId) {
        DataSourceConfig config = loadConfig(dataSourceId);
        return warmWithLock(config, "manual", true);
    }

    /**
     * Fire-and-forget warm after a cold or stale read.
     *
     * Runs on the warming executor. Skipped inside the cooldown window or while
     * another instance holds the data source's lock.
     */
    public CompletableFuture<WarmResult> triggerAutoWarmingIfNeeded(int dataSourceId) {
        CompletableFuture<WarmResult> future;
        try {
            future = CompletableFuture.supplyAsync(() -> autoWarm(dataSourceId), warmingExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("Auto-warming not scheduled, warming executor saturated: dataSourceId={}", dataSourceId);
            return CompletableFuture.completedFuture(WarmResult.skipped(dataSourceId, 0));
        }

        return future.exceptionally(e -> {
            Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
            log.error("Auto-warming failed: dataSourceId={}, error={}", dataSourceId, cause.getMessage(), cause);
            return WarmResult.failed(dataSourceId, 0);
        });
    }

    /**
     * Warm every active data source in parallel and wait for the summary.
     * Must not be called from a warming executor thread.
     */
    public WarmAllResult warmAllDataSources() {
        return warmAllDataSourcesAsync().join();
    }

    /**
     * Warm every active data source in parallel. One failure never stops the others.
     *
     * The listing and every per-source warm run as separate tasks on the warming
     * executor; the summary is composed from their futures, so no pool thread
     * waits on another task of the same pool.
     */
    public CompletableFuture<WarmAllResult> warmAllDataSourcesAsync() {
        long startTime = System.currentTimeMillis();
        CompletableFuture<List<DataSourceConfig>> listing;
        try {
            listing = CompletableFuture.supplyAsync(configProvider::findActive, warmingExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("Warming executor saturated, listing data sources inline");
            listing = CompletableFuture.completedFuture(configProvider.findActive());
        }

        return listing.thenCompose(dataSources -> {
            log.info("Starting cache warming for all data sources: count={}", dataSources.size());

            List<CompletableFuture<WarmResult>> futures = new ArrayList<>(dataSources.size());
            for (DataSourceConfig config : dataSources) {
                futures.add(submitIsolated(config));
            }
            return CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
                    .thenApply(ignored -> summarize(futures, startTime));
        });
    }

    /**
     * Wait for a warm up to the configured timeout.
     *
     * @return empty when the warm did not finish in time or failed; the cache is then still cold
     */
    public <T> Optional<T> awaitWarm(CompletableFuture<T> future) {
        long timeoutSeconds = properties.getWarming().getTimeoutSeconds();
        try {
            return Optional.ofNullable(future.get(timeoutSeconds, TimeUnit.SECONDS));
        } catch (TimeoutException e) {
            log.warn("Cache warming still running after {} s, cache remains cold", timeoutSeconds);
            return Optional.empty();
        } catch (ExecutionException e) {
            log.warn("Cache warming failed while waiting: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for cache warming");
            return Optional.empty();
        }
    }

    private WarmResult autoWarm(int dataSourceId) {
        long startTime = System.currentTimeMillis();
        String rateLimitKey = keyCodec.rateLimitKey(dataSourceId);

        String lastWarmed = cacheStore.get(rateLimitKey);
        if (lastWarmed != null) {
            log.debug("Auto-warming skipped, recently warmed: dataSourceId={}, lastWarmed={}, cooldownRemaining={}s",
                    dataSourceId, lastWarmed, cacheStore.ttlSeconds(rateLimitKey));
            recordOutcome("skipped");
            return WarmResult.skipped(dataSourceId, System.currentTimeMillis() - startTime);
        }

        DataSourceConfig config = loadConfig(dataSourceId);
        log.info("Auto-triggered cache warming: dataSourceId={}, type={}", dataSourceId, config.getType().getCode());

        return warmWithLock(config, "automatic", true);
    }

    private CompletableFuture<WarmResult> submitIsolated(DataSourceConfig config) {
        try {
            return CompletableFuture.supplyAsync(() -> warmIsolated(config), warmingExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("Warming executor saturated, warming inline: dataSourceId={}", config.getDataSourceId());
            return CompletableFuture.completedFuture(warmIsolated(config));
        }
    }

    private WarmResult warmIsolated(DataSourceConfig config) {
        long startTime = System.currentTimeMillis();
        try {
            return warmWithLock(config, "warm-all", false);
        } catch (RuntimeException e) {
            log.error("Cache warming failed during warm-all: dataSourceId={}, error={}",
                    config.getDataSourceId(), e.getMessage(), e);
            return WarmResult.failed(config.getDataSourceId(), System.currentTimeMillis() - startTime);
        }
    }

    /**
     * Warm one data source while holding its lock.
     *
     * @param startCooldown set the auto-warm marker before the lock is released,
     *                      so a trigger arriving right after the release is skipped
     */
    WarmResult warmWithLock(DataSourceConfig config, String trigger, boolean startCooldown) {
        int dataSourceId = config.getDataSourceId();
        long startTime = System.currentTimeMillis();

        Optional<LockHandle> lock = lockService.tryAcquire(keyCodec.lockKey(dataSourceId),
                Duration.ofSeconds(properties.getWarming().getLockTtlSeconds()));
        if (lock.isEmpty()) {
            log.info("Cache warming already in progress, skipping: dataSourceId={}, trigger={}", dataSourceId, trigger);
            recordOutcome("skipped");
            return WarmResult.skipped(dataSourceId, System.currentTimeMillis() - startTime);
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            WarmResult result = config.getType() == DataSourceType.TABLE_BASED
                    ? warmTable(config)
                    : warmMeasures(config);

            indexStore.writeMetadata(dataSourceId, Instant.now(), config.getType());
            if (startCooldown) {
                markAutoWarmed(dataSourceId);
            }
            result.setDurationMs(System.currentTimeMillis() - startTime);
            recordOutcome("success");

            log.info("Cache warming completed: dataSourceId={}, type={}, trigger={}, entries={}, rows={}, skippedRows={}, oversized={}, {} ms",
                    dataSourceId, config.getType().getCode(), trigger, result.getEntriesCached(), result.getTotalRows(),
                    result.getSkippedRows(), result.getOversizedEntries(), result.getDurationMs());
            return result;
        } catch (RuntimeException e) {
            recordOutcome("failure");
            log.error("Cache warming failed: dataSourceId={}, trigger={}, error={}", dataSourceId, trigger, e.getMessage(), e);
            throw e;
        } finally {
            sample.stop(Timer.builder("cache.warm.duration")
                    .tag("type", config.getType().getCode())
                    .register(meterRegistry));
            release(lock.get());
        }
    }

    private WarmResult warmMeasures(DataSourceConfig config) {
        int dataSourceId = config.getDataSourceId();
        String frequencyColumn = config.getTimePeriodColumn() != null ? config.getTimePeriodColumn() : "frequency";

        List<Map<String, Object>> rows = rowSource.fetchAll(config.getSchemaName(), config.getTableName(), null);
        log.info("Fetched rows for warming: dataSourceId={}, rows={}", dataSourceId, rows.size());

        Map<CacheDimension, List<Map<String, Object>>> buckets = new LinkedHashMap<>();
        int skippedRows = 0;
        for (Map<String, Object> row : rows) {
            Object measure = row.get(MEASURE_COLUMN);
            Integer practiceUid = toUid(row.get(PRACTICE_COLUMN));
            Integer providerUid = toUid(row.get(PROVIDER_COLUMN));
            Object frequency = row.get(frequencyColumn);

            if (measure == null || practiceUid == null || frequency == null) {
                skippedRows++;
                continue;
            }

            CacheDimension dimension = CacheDimension.builder()
                    .dataSourceId(dataSourceId)
                    .measure(measure.toString())
                    .practiceUid(practiceUid)
                    .providerUid(providerUid)
                    .frequency(frequency.toString())
                    .build();
            buckets.computeIfAbsent(dimension, key -> new ArrayList<>()).add(row);
        }

        if (skippedRows > 0) {
            log.warn("Rows skipped during warming, missing measure, practice_uid or {}: dataSourceId={}, skipped={}",
                    frequencyColumn, dataSourceId, skippedRows);
        }

        Duration ttl = indexStore.defaultTtl();
        int batchSize = properties.getPipelineBatchSize();
        WriteBatch batch = new WriteBatch();
        int entriesCached = 0;
        int oversized = 0;

        for (Map.Entry<CacheDimension, List<Map<String, Object>>> bucket : buckets.entrySet()) {
            try {
                if (indexStore.stage(batch, bucket.getKey(), bucket.getValue(), ttl)) {
                    entriesCached++;
                } else {
                    oversized++;
                }
            } catch (InvalidCacheKeyException e) {
                skippedRows += bucket.getValue().size();
                log.warn("Rows skipped during warming, unusable key component: dataSourceId={}, error={}",
                        dataSourceId, e.getMessage());
            }

            if (batch.entryCount() >= batchSize) {
                indexStore.flush(batch);
            }
        }
        indexStore.flush(batch);

        return WarmResult.builder()
                .dataSourceId(dataSourceId)
                .entriesCached(entriesCached)
                .totalRows(rows.size())
                .skippedRows(skippedRows)
                .oversizedEntries(oversized)
                .build();
    }

    private WarmResult warmTable(DataSourceConfig config) {
        int dataSourceId = config.getDataSourceId();
        int maxRows = properties.getWarming().getTableMaxRows();

        // One extra row tells a truncated table apart from one of exactly maxRows
        List<Map<String, Object>> rows = rowSource.fetchAll(config.getSchemaName(), config.getTableName(), maxRows + 1);
        boolean rowLimitReached = rows.size() > maxRows;
        if (rowLimitReached) {
            log.warn("Table-based data source exceeds the row ceiling, cache is incomplete: dataSourceId={}, maxRows={}",
                    dataSourceId, maxRows);
            rows = new ArrayList<>(rows.subList(0, maxRows));
        }

        boolean stored = indexStore.writeTable(dataSourceId, rows, indexStore.defaultTtl());

        return WarmResult.builder()
                .dataSourceId(dataSourceId)
                .entriesCached(stored ? 1 : 0)
                .oversizedEntries(stored ? 0 : 1)
                .totalRows(rows.size())
                .rowLimitReached(rowLimitReached)
                .build();
    }

    private WarmAllResult summarize(List<CompletableFuture<WarmResult>> futures, long startTime) {
        int warmed = 0;
        int failed = 0;
        int skipped = 0;
        long entries = 0;
        long rows = 0;
        for (CompletableFuture<WarmResult> future : futures) {
            // Already complete, see allOf
            WarmResult result = future.join();
            if (result.isFailed()) {
                failed++;
            } else if (result.isSkipped()) {
                skipped++;
            } else {
                warmed++;
                entries += result.getEntriesCached();
                rows += result.getTotalRows();
            }
        }

        WarmAllResult result = WarmAllResult.builder()
                .dataSourcesWarmed(warmed)
                .dataSourcesFailed(failed)
                .dataSourcesSkipped(skipped)
                .totalEntriesCached(entries)
                .totalRows(rows)
                .durationMs(System.currentTimeMillis() - startTime)
                .build();

        log.info("Cache warming completed for all data sources: warmed={}, failed={}, skipped={}, entries={}, rows={}, {} ms",
                warmed, failed, skipped, entries, rows, result.getDurationMs());
        return result;
    }

    private DataSourceConfig loadConfig(int dataSourceId) {
        return configProvider.findById(dataSourceId)
                .orElseThrow(() -> new DataSourceNotFoundException(dataSourceId));
    }

    private void markAutoWarmed(int dataSourceId) {
        log.debug("Auto-warm cooldown started: dataSourceId={}, cooldownSeconds={}",
                dataSourceId, properties.getWarming().getAutoWarmCooldownSeconds());
        cacheStore.set(keyCodec.rateLimitKey(dataSourceId), Instant.now().toString(),
                Duration.ofSeconds(properties.getWarming().getAutoWarmCooldownSeconds()));
    }

    private void release(LockHandle lock) {
        try {
            lockService.release(lock);
        } catch (CacheUnavailableException e) {
            log.warn("Could not release warming lock, it expires on its own: key={}, error={}",
                    lock.getKey(), e.getMessage());
        }
    }

    private void recordOutcome(String result) {
        Counter.builder("cache.warm")
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }

    private static Integer toUid(Object value) {
        if (value == null) {
            return null;
        }
        try {
            if (value instanceof Number) {
                return new BigDecimal(value.toString()).intValueExact();
            }
            return Integer.valueOf(value.toString().trim());
        } catch (NumberFormatException | ArithmeticException e) {
            // Out of int range or not a whole number: not a UID
            return null;
        }
    }
}

package com.analyticscache.domain.service;

import com.analyticscache.config.CacheProperties;
import com.analyticscache.domain.model.DataSourceConfig;
import com.analyticscache.exception.CacheUnavailableException;
import com.analyticscache.infrastructure.cache.AnalyticsIndexStore;
import com.analyticscache.infrastructure.cache.CacheKeyCodec;
import com.analyticscache.infrastructure.cache.DistributedLockService;
import com.analyticscache.infrastructure.cache.LockHandle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Keeps every data source warm before requests find it stale.
 *
 * Each tick only reads last-warm metadata. The warm itself is handed to the
 * warming executor and the tick returns immediately.
 *
 * Multi-instance safety:
 * - Scheduler lock: one instance checks per interval (lock left to expire)
 * - Global warming lock with an owner token: one warm-all at a time across instances,
 *   released only while this instance still owns it
 *
 * Timing: checks every 30 minutes and warms anything older than 3 hours,
 * so no cache crosses the 4 hour staleness threshold.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.cache.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class BackgroundWarmingScheduler {

    public enum TickOutcome {
        SKIPPED_BUSY,
        SKIPPED_LOCKED,
        FRESH,
        WARMING_IN_PROGRESS_ELSEWHERE,
        WARMING_LAUNCHED,
        STORE_UNAVAILABLE,
        CHECK_FAILED
    }

    private final CacheWarmingService warmingService;
    private final DataSourceConfigProvider configProvider;
    private final AnalyticsIndexStore indexStore;
    private final DistributedLockService lockService;
    private final CacheKeyCodec keyCodec;
    private final CacheProperties properties;

    private final AtomicBoolean checkRunning = new AtomicBoolean(false);
    private final AtomicBoolean warmingInProgress = new AtomicBoolean(false);

    @Scheduled(fixedDelayString = "${app.cache.scheduler.check-interval-ms:1800000}",
            initialDelayString = "${app.cache.scheduler.initial-delay-ms:60000}")
    public void scheduledCheck() {
        TickOutcome outcome = tick();
        log.debug("Background warming tick finished: outcome={}", outcome);
    }

    public TickOutcome tick() {
        if (warmingInProgress.get()) {
            log.debug("Background warming check skipped, warming already in progress");
            return TickOutcome.SKIPPED_BUSY;
        }
        if (!checkRunning.compareAndSet(false, true)) {
            log.debug("Background warming check skipped, check already running");
            return TickOutcome.SKIPPED_BUSY;
        }

        long startTime = System.currentTimeMillis();
        try {
            CacheProperties.Scheduler scheduler = properties.getScheduler();

            Optional<LockHandle> schedulerLock = lockService.tryAcquire(keyCodec.schedulerLockKey(),
                    Duration.ofSeconds(scheduler.getSchedulerLockTtlSeconds()));
            if (schedulerLock.isEmpty()) {
                log.debug("Another instance is handling the background warming check");
                return TickOutcome.SKIPPED_LOCKED;
            }

            log.info("Background warming check started");

            if (!needsWarming()) {
                log.debug("Background warming check complete, all caches are fresh ({} ms)",
                        System.currentTimeMillis() - startTime);
                return TickOutcome.FRESH;
            }

            Optional<LockHandle> warmingLock = lockService.tryAcquire(keyCodec.globalWarmingLockKey(),
                    Duration.ofSeconds(scheduler.getWarmingLockTtlSeconds()));
            if (warmingLock.isEmpty()) {
                log.info("Warming already in progress on another instance");
                return TickOutcome.WARMING_IN_PROGRESS_ELSEWHERE;
            }

            launchWarmAll(warmingLock.get());
            log.info("Background warming launched, check continues ({} ms)", System.currentTimeMillis() - startTime);
            return TickOutcome.WARMING_LAUNCHED;
        } catch (CacheUnavailableException e) {
            log.warn("Redis unavailable, skipping background warming check: {}", e.getMessage());
            return TickOutcome.STORE_UNAVAILABLE;
        } catch (RuntimeException e) {
            log.error("Background warming check failed ({} ms): {}",
                    System.currentTimeMillis() - startTime, e.getMessage(), e);
            return TickOutcome.CHECK_FAILED;
        } finally {
            checkRunning.set(false);
        }
    }

    public boolean isWarmingInProgress() {
        return warmingInProgress.get();
    }

    /**
     * True when any active data source has no metadata or is older than the proactive threshold.
     * Store failures propagate so the tick does not warm on an error.
     */
    boolean needsWarming() {
        List<DataSourceConfig> dataSources = configProvider.findActive();
        Duration threshold = Duration.ofHours(properties.getScheduler().getWarmIfOlderThanHours());
        Instant now = Instant.now();

        for (DataSourceConfig dataSource : dataSources) {
            Optional<Instant> lastWarmed = indexStore.lastWarmed(dataSource.getDataSourceId());
            if (lastWarmed.isEmpty()) {
                log.info("Missing cache metadata, cache is cold: dataSourceId={}", dataSource.getDataSourceId());
                return true;
            }
            Duration age = Duration.between(lastWarmed.get(), now);
            if (age.compareTo(threshold) > 0) {
                log.info("Cache is getting stale, needs proactive warming: dataSourceId={}, ageMinutes={}, thresholdHours={}",
                        dataSource.getDataSourceId(), age.toMinutes(), threshold.toHours());
                return true;
            }
        }
        return false;
    }

    private void launchWarmAll(LockHandle warmingLock) {
        warmingInProgress.set(true);
        try {
            warmingService.warmAllDataSourcesAsync().whenComplete((result, error) -> {
                if (error != null) {
                    log.error("Background warming failed: {}", error.getMessage(), error);
                } else {
                    log.info("Background warming completed: warmed={}, failed={}, entries={}, rows={}, {} ms",
                            result.getDataSourcesWarmed(), result.getDataSourcesFailed(),
                            result.getTotalEntriesCached(), result.getTotalRows(), result.getDurationMs());
                }
                finishWarming(warmingLock);
            });
        } catch (RuntimeException e) {
            finishWarming(warmingLock);
            throw e;
        }
    }

    private void finishWarming(LockHandle warmingLock) {
        warmingInProgress.set(false);
        try {
            lockService.release(warmingLock);
        } catch (CacheUnavailableException e) {
            log.warn("Error releasing warming lock, it expires on its own: {}", e.getMessage());
        }
    }
}

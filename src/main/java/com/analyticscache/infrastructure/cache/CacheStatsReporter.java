package com.analyticscache.infrastructure.cache;

import com.analyticscache.config.CacheProperties;
import com.analyticscache.domain.model.CacheDimension;
import com.analyticscache.domain.model.CacheStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Read-only statistics for the admin dashboard.
 *
 * Walks every primary key with SCAN, so it is never called on the request path.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CacheStatsReporter {

    static final int DEFAULT_LARGEST_ENTRIES = 10;
    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    private final CacheStore cacheStore;
    private final CacheKeyCodec keyCodec;
    private final AnalyticsIndexStore indexStore;
    private final CacheProperties properties;

    public CacheStats collect() {
        return collect(DEFAULT_LARGEST_ENTRIES);
    }

    public CacheStats collect(int largestEntriesLimit) {
        long startTime = System.currentTimeMillis();
        Instant now = Instant.now();

        List<String> keys = cacheStore.scan(keyCodec.primaryPattern(), properties.getScanCount());

        Map<Integer, CacheStats.DataSourceStats> byDataSource = new TreeMap<>();
        List<CacheStats.EntrySize> sizes = new ArrayList<>(keys.size());
        long totalBytes = 0;

        for (String key : keys) {
            Optional<Integer> dataSourceId = keyCodec.dataSourceIdOf(key);
            if (dataSourceId.isEmpty()) {
                continue;
            }
            long bytes = cacheStore.valueSize(key);
            totalBytes += bytes;
            sizes.add(CacheStats.EntrySize.builder()
                    .key(key)
                    .sizeBytes(bytes)
                    .sizeMB(toMb(bytes))
                    .build());

            CacheStats.DataSourceStats stats = byDataSource.computeIfAbsent(dataSourceId.get(),
                    id -> CacheStats.DataSourceStats.builder().measures(new TreeSet<>()).build());
            stats.setKeys(stats.getKeys() + 1);
            stats.setMemoryMB(stats.getMemoryMB() + toMb(bytes));
            keyCodec.parsePrimaryKey(key)
                    .map(CacheDimension::getMeasure)
                    .ifPresent(stats.getMeasures()::add);
        }

        byDataSource.forEach((id, stats) -> {
            stats.setStaleness(indexStore.staleness(id, now));
            stats.setMemoryMB(round(stats.getMemoryMB()));
        });

        sizes.sort(Comparator.comparingLong(CacheStats.EntrySize::getSizeBytes).reversed());
        List<CacheStats.EntrySize> largest = new ArrayList<>(sizes.subList(0, Math.min(largestEntriesLimit, sizes.size())));

        log.info("Cache stats collected: keys={}, memoryMB={}, dataSources={}, {} ms",
                keys.size(), round(toMb(totalBytes)), byDataSource.size(), System.currentTimeMillis() - startTime);

        return CacheStats.builder()
                .totalKeys(keys.size())
                .totalMemoryMB(round(toMb(totalBytes)))
                .byDataSource(byDataSource)
                .largestEntries(largest)
                .build();
    }

    private static double toMb(long bytes) {
        return bytes / BYTES_PER_MB;
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}

package com.analyticscache.domain.service;

import com.analyticscache.domain.model.DataSourceConfig;
import com.analyticscache.domain.model.DataSourceType;
import com.github.benmanes.caffeine.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Read-through, bounded memo of data-source configuration.
 *
 * Saves a relational lookup per request for type detection and date-column
 * resolution. Never authoritative: entries expire and are evicted on invalidation.
 * Missing data sources are not memoized.
 */
@Slf4j
@Service
public class DataSourceConfigCache {

    private final DataSourceConfigProvider configProvider;
    private final Cache<Integer, DataSourceConfig> configCache;

    public DataSourceConfigCache(DataSourceConfigProvider configProvider,
                                 @Qualifier("dataSourceConfigLocalCache") Cache<Integer, DataSourceConfig> configCache) {
        this.configProvider = configProvider;
        this.configCache = configCache;
    }

    public Optional<DataSourceConfig> get(int dataSourceId) {
        return Optional.ofNullable(configCache.get(dataSourceId,
                id -> configProvider.findById(id).orElse(null)));
    }

    /**
     * Unknown data sources default to measure-based.
     */
    public DataSourceType typeOf(int dataSourceId) {
        Optional<DataSourceConfig> config = get(dataSourceId);
        if (config.isEmpty()) {
            log.warn("Data source not found, defaulting to measure-based: dataSourceId={}", dataSourceId);
            return DataSourceType.MEASURE_BASED;
        }
        return config.get().getType();
    }

    public void evict(int dataSourceId) {
        configCache.invalidate(dataSourceId);
    }
}

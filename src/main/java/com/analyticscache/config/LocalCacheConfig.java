package com.analyticscache.config;

import com.analyticscache.domain.model.DataSourceConfig;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * In-process Caffeine caches.
 */
@Slf4j
@Configuration
public class LocalCacheConfig {

    /**
     * Data-source configuration memo, read on every query for type and date column.
     * Bounded and time-limited; evicted explicitly on invalidation.
     */
    @Bean("dataSourceConfigLocalCache")
    public Cache<Integer, DataSourceConfig> dataSourceConfigLocalCache(CacheProperties properties,
                                                                       MeterRegistry meterRegistry) {
        CacheProperties.TypeCache settings = properties.getTypeCache();

        Cache<Integer, DataSourceConfig> cache = Caffeine.newBuilder()
                .maximumSize(settings.getMaximumSize())
                .expireAfterWrite(settings.getExpireAfterWriteSeconds(), TimeUnit.SECONDS)
                .recordStats()
                .build();

        CaffeineCacheMetrics.monitor(meterRegistry, cache, "data_source_config_cache");

        log.info("Data source config cache initialized: maximumSize={}, expireAfterWrite={}s",
                settings.getMaximumSize(), settings.getExpireAfterWriteSeconds());
        return cache;
    }
}

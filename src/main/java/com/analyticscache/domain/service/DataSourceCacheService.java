package com.analyticscache.domain.service;

import com.analyticscache.config.CacheProperties;
import com.analyticscache.domain.model.CacheStaleness;
import com.analyticscache.domain.model.CacheStatus;
import com.analyticscache.domain.model.DataSourceConfig;
import com.analyticscache.domain.model.DataSourceFetchResult;
import com.analyticscache.domain.model.DataSourceQueryRequest;
import com.analyticscache.domain.model.DataSourceType;
import com.analyticscache.domain.model.IndexQuery;
import com.analyticscache.domain.security.AccessScope;
import com.analyticscache.domain.security.AccessScopeResolver;
import com.analyticscache.domain.security.RbacFilterService;
import com.analyticscache.domain.security.UserContext;
import com.analyticscache.exception.CacheUnavailableException;
import com.analyticscache.exception.DataSourceNotFoundException;
import com.analyticscache.infrastructure.cache.AnalyticsIndexStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Serves data-source rows to charts: cache first, analytics database on a miss.
 *
 * Query Flow:
 * 1. Resolve the caller's access scope before touching any data
 * 2. Determine the data-source type (memoized configuration lookup)
 * 3. Read the index store using only the chart's explicit filters
 * 4. Cold cache or unavailable store: read the analytics database instead
 * 5. RBAC filter, then date-range filter, then advanced filters, on both paths
 *
 * Why filter in memory?
 * - Cache entries are shared by every user; keying them by user scope would multiply them
 * - One entry serves any date range or dashboard filter
 *
 * Freshness:
 * - Cold: served from the database, async warm triggered
 * - Stale: served from cache, async warm triggered
 * - Store unavailable: served from the database, no warm
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DataSourceCacheService {

    private final AnalyticsIndexStore indexStore;
    private final CacheWarmingService warmingService;
    private final DataSourceConfigCache configCache;
    private final AnalyticsRowSource rowSource;
    private final AccessScopeResolver accessScopeResolver;
    private final RbacFilterService rbacFilterService;
    private final InMemoryFilterService filterService;
    private final CacheProperties properties;
    private final MeterRegistry meterRegistry;

    public DataSourceFetchResult fetchDataSource(DataSourceQueryRequest request, UserContext userContext) {
        long startTime = System.currentTimeMillis();

        AccessScope scope = accessScopeResolver.resolve(userContext);
        rbacFilterService.validateScope(scope, userContext);

        int dataSourceId = request.getDataSourceId();
        DataSourceType type = request.getDataSourceType() != null
                ? request.getDataSourceType()
                : configCache.typeOf(dataSourceId);
        if (type == DataSourceType.MEASURE_BASED) {
            requireText(request.getMeasure(), "measure");
            requireText(request.getFrequency(), "frequency");
        }

        CacheRead read = request.isNocache() ? CacheRead.bypassed() : readCache(request, type);

        List<Map<String, Object>> rows = read.rows != null
                ? read.rows
                : fetchFromSource(request, type);

        List<Map<String, Object>> filtered = applyFilters(rows, request, scope, userContext);
        long elapsed = System.currentTimeMillis() - startTime;

        log.info("Data source fetched: dataSourceId={}, type={}, userId={}, scope={}, cacheHit={}, staleness={}, rows={}, returned={}, {} ms",
                dataSourceId, type.getCode(), userContext.getUserId(), scope.getPermissionScope(),
                read.rows != null, read.staleness, rows.size(), filtered.size(), elapsed);

        return DataSourceFetchResult.builder()
                .rows(filtered)
                .cacheHit(read.rows != null)
                .staleness(read.staleness)
                .queryTimeMs(elapsed)
                .build();
    }

    /**
     * Several measures of one data source and frequency in one call, keyed by measure.
     * Served from the index store when the cache is warm, otherwise measure by measure.
     */
    public Map<String, DataSourceFetchResult> fetchMeasures(DataSourceQueryRequest template,
                                                           List<String> measures,
                                                           UserContext userContext) {
        int dataSourceId = template.getDataSourceId();
        requireText(template.getFrequency(), "frequency");
        measures.forEach(measure -> requireText(measure, "measure"));

        Map<String, DataSourceFetchResult> results = new LinkedHashMap<>();
        Optional<Map<String, List<Map<String, Object>>>> cached = template.isNocache()
                ? Optional.empty()
                : readBatch(template, measures);

        if (cached.isEmpty()) {
            for (String measure : measures) {
                results.put(measure, fetchDataSource(withMeasure(template, measure), userContext));
            }
            return results;
        }

        long startTime = System.currentTimeMillis();
        AccessScope scope = accessScopeResolver.resolve(userContext);
        CacheStaleness staleness = indexStore.staleness(dataSourceId, Instant.now());
        if (staleness == CacheStaleness.STALE) {
            warmingService.triggerAutoWarmingIfNeeded(dataSourceId);
        }

        for (Map.Entry<String, List<Map<String, Object>>> entry : cached.get().entrySet()) {
            results.put(entry.getKey(), DataSourceFetchResult.builder()
                    .rows(applyFilters(entry.getValue(), template, scope, userContext))
                    .cacheHit(true)
                    .staleness(staleness)
                    .queryTimeMs(System.currentTimeMillis() - startTime)
                    .build());
        }
        return results;
    }

    /**
     * Drop every cached key of a data source and forget its memoized configuration.
     */
    public long invalidate(int dataSourceId) {
        long removed = indexStore.invalidate(dataSourceId);
        configCache.evict(dataSourceId);
        return removed;
    }

    public CacheStatus cacheStatus(int dataSourceId) {
        Instant now = Instant.now();
        Optional<Instant> lastWarmed = indexStore.lastWarmed(dataSourceId);

        return CacheStatus.builder()
                .dataSourceId(dataSourceId)
                .warm(lastWarmed.isPresent())
                .lastWarmed(lastWarmed.orElse(null))
                .ageMinutes(lastWarmed.map(warmedAt -> Duration.between(warmedAt, now).toMinutes()).orElse(null))
                .staleness(lastWarmed.map(warmedAt -> indexStore.classify(warmedAt, now)).orElse(CacheStaleness.COLD))
                .indexedEntries(indexStore.indexedEntryCount(dataSourceId))
                .build();
    }

    // Cache-first read, database fallback

    private CacheRead readCache(DataSourceQueryRequest request, DataSourceType type) {
        int dataSourceId = request.getDataSourceId();
        try {
            CacheStaleness staleness = indexStore.staleness(dataSourceId, Instant.now());
            if (staleness == CacheStaleness.COLD) {
                log.info("Cache cold, reading analytics database and triggering warm: dataSourceId={}", dataSourceId);
                warmingService.triggerAutoWarmingIfNeeded(dataSourceId);
                recordQuery("miss");
                return new CacheRead(null, CacheStaleness.COLD);
            }

            List<Map<String, Object>> rows = type == DataSourceType.TABLE_BASED
                    ? indexStore.readTable(dataSourceId).orElse(null)
                    : indexStore.query(toIndexQuery(request));

            if (staleness == CacheStaleness.STALE) {
                log.info("Serving stale cache, triggering background refresh: dataSourceId={}", dataSourceId);
                warmingService.triggerAutoWarmingIfNeeded(dataSourceId);
            }
            recordQuery(rows != null ? "hit" : "miss");
            return new CacheRead(rows, staleness);
        } catch (CacheUnavailableException e) {
            log.warn("Cache unavailable, reading analytics database: dataSourceId={}, error={}",
                    dataSourceId, e.getMessage());
            recordQuery("unavailable");
            return new CacheRead(null, CacheStaleness.COLD);
        }
    }

    private Optional<Map<String, List<Map<String, Object>>>> readBatch(DataSourceQueryRequest template,
                                                                       List<String> measures) {
        int dataSourceId = template.getDataSourceId();
        try {
            if (!indexStore.isWarm(dataSourceId)) {
                warmingService.triggerAutoWarmingIfNeeded(dataSourceId);
                return Optional.empty();
            }
            List<IndexQuery> queries = measures.stream()
                    .map(measure -> toIndexQuery(withMeasure(template, measure)))
                    .toList();
            return Optional.of(indexStore.batchQuery(queries));
        } catch (CacheUnavailableException e) {
            log.warn("Cache unavailable for batch query, reading analytics database: dataSourceId={}, error={}",
                    dataSourceId, e.getMessage());
            return Optional.empty();
        }
    }

    private List<Map<String, Object>> fetchFromSource(DataSourceQueryRequest request, DataSourceType type) {
        DataSourceConfig config = configCache.get(request.getDataSourceId())
                .orElseThrow(() -> new DataSourceNotFoundException(request.getDataSourceId()));

        if (type == DataSourceType.TABLE_BASED) {
            return rowSource.fetchAll(config.getSchemaName(), config.getTableName(),
                    properties.getWarming().getTableMaxRows());
        }

        Map<String, Object> filters = new LinkedHashMap<>();
        filters.put(CacheWarmingService.MEASURE_COLUMN, request.getMeasure());
        filters.put(config.getTimePeriodColumn() != null ? config.getTimePeriodColumn() : "frequency",
                request.getFrequency());
        if (request.getPracticeUid() != null) {
            filters.put(CacheWarmingService.PRACTICE_COLUMN, request.getPracticeUid());
        }
        if (request.getProviderUid() != null) {
            filters.put(CacheWarmingService.PROVIDER_COLUMN, request.getProviderUid());
        }
        return rowSource.fetch(config.getSchemaName(), config.getTableName(), filters);
    }

    private List<Map<String, Object>> applyFilters(List<Map<String, Object>> rows,
                                                   DataSourceQueryRequest request,
                                                   AccessScope scope,
                                                   UserContext userContext) {
        List<Map<String, Object>> visible = rbacFilterService.applyRbacFilter(rows, scope, userContext);
        List<Map<String, Object>> inRange = filterService.applyDateRangeFilter(visible,
                request.getDataSourceId(), request.getStartDate(), request.getEndDate());
        return filterService.applyAdvancedFilters(inRange, request.getAdvancedFilters());
    }

    // Explicit chart filters only; the caller's RBAC scope never narrows the index lookup
    private static IndexQuery toIndexQuery(DataSourceQueryRequest request) {
        IndexQuery.IndexQueryBuilder builder = IndexQuery.builder()
                .dataSourceId(request.getDataSourceId())
                .measure(request.getMeasure())
                .frequency(request.getFrequency());
        if (request.getPracticeUid() != null) {
            builder.practiceUid(request.getPracticeUid());
        }
        if (request.getProviderUid() != null) {
            builder.providerUid(request.getProviderUid());
        }
        return builder.build();
    }

    private static DataSourceQueryRequest withMeasure(DataSourceQueryRequest template, String measure) {
        return DataSourceQueryRequest.builder()
                .dataSourceId(template.getDataSourceId())
                .dataSourceType(DataSourceType.MEASURE_BASED)
                .measure(measure)
                .frequency(template.getFrequency())
                .practiceUid(template.getPracticeUid())
                .providerUid(template.getProviderUid())
                .startDate(template.getStartDate())
                .endDate(template.getEndDate())
                .advancedFilters(template.getAdvancedFilters())
                .nocache(template.isNocache())
                .build();
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required for measure-based data sources");
        }
    }

    private void recordQuery(String result) {
        Counter.builder("cache.query")
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }

    private static final class CacheRead {
        private final List<Map<String, Object>> rows;
        private final CacheStaleness staleness;

        private CacheRead(List<Map<String, Object>> rows, CacheStaleness staleness) {
            this.rows = rows;
            this.staleness = staleness;
        }

        private static CacheRead bypassed() {
            return new CacheRead(null, null);
        }
    }
}

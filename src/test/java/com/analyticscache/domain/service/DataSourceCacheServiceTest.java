package com.analyticscache.domain.service;

import com.analyticscache.config.CacheProperties;
import com.analyticscache.domain.model.CacheDimension;
import com.analyticscache.domain.model.CacheStaleness;
import com.analyticscache.domain.model.CacheStatus;
import com.analyticscache.domain.model.ChartFilter;
import com.analyticscache.domain.model.DataSourceConfig;
import com.analyticscache.domain.model.DataSourceFetchResult;
import com.analyticscache.domain.model.DataSourceQueryRequest;
import com.analyticscache.domain.model.DataSourceType;
import com.analyticscache.domain.model.FilterOperator;
import com.analyticscache.domain.security.AnalyticsPermissions;
import com.analyticscache.domain.security.PermissionAccessScopeResolver;
import com.analyticscache.domain.security.RbacFilterService;
import com.analyticscache.domain.security.UserContext;
import com.analyticscache.infrastructure.cache.AnalyticsIndexStore;
import com.analyticscache.infrastructure.cache.CacheKeyCodec;
import com.analyticscache.infrastructure.cache.InMemoryCacheStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Cache-first reads with the RBAC, date and advanced filters applied on both paths.
 */
@ExtendWith(MockitoExtension.class)
class DataSourceCacheServiceTest {

    private static final DataSourceConfig REVENUE = DataSourceConfig.builder()
            .dataSourceId(1).schemaName("ih").tableName("agg_revenue").active(true).build();

    @Mock
    private CacheWarmingService warmingService;

    @Mock
    private DataSourceConfigCache configCache;

    @Mock
    private AnalyticsRowSource rowSource;

    private InMemoryCacheStore store;
    private AnalyticsIndexStore indexStore;
    private SimpleMeterRegistry meterRegistry;
    private DataSourceCacheService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryCacheStore();
        CacheProperties properties = new CacheProperties();
        meterRegistry = new SimpleMeterRegistry();
        indexStore = new AnalyticsIndexStore(store, new CacheKeyCodec(properties), new ObjectMapper(),
                properties, meterRegistry);
        service = new DataSourceCacheService(indexStore, warmingService, configCache, rowSource,
                new PermissionAccessScopeResolver(), new RbacFilterService(meterRegistry),
                new InMemoryFilterService(configCache, properties), properties, meterRegistry);
    }

    @Test
    void testFetch_FreshCacheServesOnlyCallersPractices() {
        warmRevenue(Instant.now().minus(Duration.ofHours(1)));

        DataSourceFetchResult result = service.fetchDataSource(revenueRequest().build(), orgUser(114));

        assertTrue(result.isCacheHit());
        assertEquals(CacheStaleness.FRESH, result.getStaleness());
        assertEquals(Set.of(114), practices(result.getRows()));
        assertEquals(4, result.getRows().size());
        verifyNoInteractions(rowSource, warmingService);
        assertEquals(1.0, meterRegistry.counter("cache.query", "result", "hit").count());
    }

    @Test
    void testFetch_StaleCacheServedAndRefreshTriggered() {
        warmRevenue(Instant.now().minus(Duration.ofHours(5)));

        DataSourceFetchResult result = service.fetchDataSource(revenueRequest().build(), adminUser());

        assertTrue(result.isCacheHit());
        assertEquals(CacheStaleness.STALE, result.getStaleness());
        assertEquals(6, result.getRows().size());
        verify(warmingService).triggerAutoWarmingIfNeeded(1);
        verifyNoInteractions(rowSource);
    }

    @Test
    void testFetch_ColdCacheReadsDatabaseAndTriggersWarm() {
        when(configCache.get(1)).thenReturn(Optional.of(REVENUE));
        when(rowSource.fetch(eq("ih"), eq("agg_revenue"), anyMap())).thenReturn(List.of(
                row(114, 501, "2026-01-01"), row(115, 503, "2026-01-01")));

        DataSourceFetchResult result = service.fetchDataSource(revenueRequest().build(), orgUser(114));

        assertFalse(result.isCacheHit());
        assertEquals(CacheStaleness.COLD, result.getStaleness());
        assertEquals(Set.of(114), practices(result.getRows()));
        verify(warmingService).triggerAutoWarmingIfNeeded(1);

        Map<String, Object> expectedFilters = new LinkedHashMap<>();
        expectedFilters.put("measure", "Revenue");
        expectedFilters.put("frequency", "Monthly");
        verify(rowSource).fetch("ih", "agg_revenue", expectedFilters);
    }

    @Test
    void testFetch_ExplicitChartFiltersReachDatabase() {
        when(configCache.get(1)).thenReturn(Optional.of(REVENUE));
        when(rowSource.fetch(eq("ih"), eq("agg_revenue"), anyMap())).thenReturn(List.of(row(114, 502, "2026-01-01")));

        service.fetchDataSource(revenueRequest().practiceUid(114).providerUid(502).build(), adminUser());

        Map<String, Object> expectedFilters = new LinkedHashMap<>();
        expectedFilters.put("measure", "Revenue");
        expectedFilters.put("frequency", "Monthly");
        expectedFilters.put("practice_uid", 114);
        expectedFilters.put("provider_uid", 502);
        verify(rowSource).fetch("ih", "agg_revenue", expectedFilters);
    }

    @Test
    void testFetch_StoreUnavailableReadsDatabaseWithoutWarming() {
        warmRevenue(Instant.now());
        store.setAvailable(false);
        when(configCache.get(1)).thenReturn(Optional.of(REVENUE));
        when(rowSource.fetch(eq("ih"), eq("agg_revenue"), anyMap())).thenReturn(List.of(row(114, 501, "2026-01-01")));

        DataSourceFetchResult result = service.fetchDataSource(revenueRequest().build(), adminUser());

        assertFalse(result.isCacheHit());
        assertEquals(1, result.getRows().size());
        verify(warmingService, never()).triggerAutoWarmingIfNeeded(anyInt());
        assertEquals(1.0, meterRegistry.counter("cache.query", "result", "unavailable").count());
    }

    @Test
    void testFetch_NocacheBypassesStore() {
        warmRevenue(Instant.now());
        when(configCache.get(1)).thenReturn(Optional.of(REVENUE));
        when(rowSource.fetch(eq("ih"), eq("agg_revenue"), anyMap())).thenReturn(List.of(row(114, 501, "2026-01-01")));

        DataSourceFetchResult result = service.fetchDataSource(revenueRequest().nocache(true).build(), adminUser());

        assertFalse(result.isCacheHit());
        assertNull(result.getStaleness());
        verifyNoInteractions(warmingService);
    }

    @Test
    void testFetch_NoPermissionSeesNothing() {
        warmRevenue(Instant.now());
        UserContext user = UserContext.builder().userId("u-9").build();

        DataSourceFetchResult result = service.fetchDataSource(revenueRequest().build(), user);

        assertTrue(result.getRows().isEmpty());
        assertEquals(1.0, meterRegistry.counter("cache.rbac.denied", "reason", "no_analytics_permission").count());
    }

    @Test
    void testFetch_OwnScopeSeesOnlyOwnProvider() {
        warmRevenue(Instant.now());
        UserContext user = UserContext.builder()
                .userId("u-3")
                .permissions(new LinkedHashSet<>(Set.of(AnalyticsPermissions.READ_OWN)))
                .providerUid(503)
                .build();

        DataSourceFetchResult result = service.fetchDataSource(revenueRequest().build(), user);

        assertEquals(2, result.getRows().size());
        assertTrue(result.getRows().stream().allMatch(row -> Integer.valueOf(503).equals(row.get("provider_uid"))));
    }

    @Test
    void testFetch_DateAndAdvancedFiltersAfterRbac() {
        warmRevenue(Instant.now());
        when(configCache.get(1)).thenReturn(Optional.of(REVENUE));
        DataSourceQueryRequest request = revenueRequest()
                .startDate(LocalDate.of(2026, 2, 1))
                .endDate(LocalDate.of(2026, 2, 28))
                .advancedFilters(List.of(ChartFilter.builder()
                        .field("provider_uid").operator(FilterOperator.EQ).value(501).build()))
                .build();

        DataSourceFetchResult result = service.fetchDataSource(request, orgUser(114));

        assertEquals(1, result.getRows().size());
        assertEquals("2026-02-01", result.getRows().get(0).get("date_index"));
        assertEquals(501, result.getRows().get(0).get("provider_uid"));
    }

    @Test
    void testFetch_MeasureRequiredForMeasureBased() {
        when(configCache.typeOf(1)).thenReturn(DataSourceType.MEASURE_BASED);
        DataSourceQueryRequest request = DataSourceQueryRequest.builder().dataSourceId(1).frequency("Monthly").build();

        assertThrows(IllegalArgumentException.class, () -> service.fetchDataSource(request, adminUser()));
        verifyNoInteractions(rowSource, warmingService);
    }

    @Test
    void testFetch_TableBasedTypeResolvedFromConfiguration() {
        when(configCache.typeOf(2)).thenReturn(DataSourceType.TABLE_BASED);
        indexStore.writeTable(2, List.of(row(114, null, "2026-01-01"), row(116, null, "2026-01-01")),
                indexStore.defaultTtl());
        indexStore.writeMetadata(2, Instant.now(), DataSourceType.TABLE_BASED);

        DataSourceFetchResult result = service.fetchDataSource(
                DataSourceQueryRequest.builder().dataSourceId(2).build(), orgUser(116));

        assertTrue(result.isCacheHit());
        assertEquals(Set.of(116), practices(result.getRows()));
    }

    @Test
    void testFetchMeasures_WarmCacheServesEveryMeasure() {
        warmRevenue(Instant.now());
        indexStore.write(dimension("Charges", 114, 501), List.of(row(114, 501, "2026-01-01")));

        Map<String, DataSourceFetchResult> results = service.fetchMeasures(
                revenueRequest().measure(null).build(), List.of("Revenue", "Charges"), orgUser(114));

        assertEquals(List.of("Revenue", "Charges"), List.copyOf(results.keySet()));
        assertEquals(4, results.get("Revenue").getRows().size());
        assertEquals(1, results.get("Charges").getRows().size());
        assertTrue(results.get("Charges").isCacheHit());
        verifyNoInteractions(rowSource);
    }

    @Test
    void testFetchMeasures_ColdCacheFallsBackPerMeasure() {
        when(configCache.get(1)).thenReturn(Optional.of(REVENUE));
        when(rowSource.fetch(eq("ih"), eq("agg_revenue"), anyMap())).thenReturn(List.of(row(114, 501, "2026-01-01")));

        Map<String, DataSourceFetchResult> results = service.fetchMeasures(
                revenueRequest().measure(null).build(), List.of("Revenue", "Charges"), adminUser());

        assertEquals(2, results.size());
        assertFalse(results.get("Revenue").isCacheHit());
        verify(rowSource, times(2)).fetch(eq("ih"), eq("agg_revenue"), anyMap());
    }

    @Test
    void testInvalidate_DropsKeysAndForgetsConfiguration() {
        warmRevenue(Instant.now());

        long removed = service.invalidate(1);

        assertTrue(removed > 0);
        assertFalse(indexStore.isWarm(1));
        verify(configCache).evict(1);
    }

    @Test
    void testCacheStatus_ColdAndWarm() {
        CacheStatus cold = service.cacheStatus(1);
        assertFalse(cold.isWarm());
        assertEquals(CacheStaleness.COLD, cold.getStaleness());
        assertNull(cold.getAgeMinutes());

        warmRevenue(Instant.now().minus(Duration.ofMinutes(90)));

        CacheStatus warm = service.cacheStatus(1);
        assertTrue(warm.isWarm());
        assertEquals(CacheStaleness.FRESH, warm.getStaleness());
        assertTrue(warm.getAgeMinutes() >= 90);
        assertEquals(3, warm.getIndexedEntries());
    }

    private void warmRevenue(Instant warmedAt) {
        indexStore.write(dimension("Revenue", 114, 501),
                List.of(row(114, 501, "2026-01-01"), row(114, 501, "2026-02-01")));
        indexStore.write(dimension("Revenue", 114, 502),
                List.of(row(114, 502, "2026-01-01"), row(114, 502, "2026-02-01")));
        indexStore.write(dimension("Revenue", 115, 503),
                List.of(row(115, 503, "2026-01-01"), row(115, 503, "2026-02-01")));
        indexStore.writeMetadata(1, warmedAt, DataSourceType.MEASURE_BASED);
    }

    private static DataSourceQueryRequest.DataSourceQueryRequestBuilder revenueRequest() {
        return DataSourceQueryRequest.builder()
                .dataSourceId(1)
                .dataSourceType(DataSourceType.MEASURE_BASED)
                .measure("Revenue")
                .frequency("Monthly");
    }

    private static CacheDimension dimension(String measure, int practiceUid, int providerUid) {
        return CacheDimension.builder()
                .dataSourceId(1)
                .measure(measure)
                .practiceUid(practiceUid)
                .providerUid(providerUid)
                .frequency("Monthly")
                .build();
    }

    private static UserContext adminUser() {
        return UserContext.builder()
                .userId("u-1")
                .permissions(new LinkedHashSet<>(Set.of(AnalyticsPermissions.READ_ALL)))
                .build();
    }

    private static UserContext orgUser(int... practices) {
        Set<Integer> practiceUids = new LinkedHashSet<>();
        for (int practice : practices) {
            practiceUids.add(practice);
        }
        return UserContext.builder()
                .userId("u-2")
                .permissions(new LinkedHashSet<>(Set.of(AnalyticsPermissions.READ_ORGANIZATION)))
                .practiceUids(practiceUids)
                .build();
    }

    private static Map<String, Object> row(Integer practiceUid, Integer providerUid, String date) {
        Map<String, Object> row = new HashMap<>();
        row.put("practice_uid", practiceUid);
        row.put("provider_uid", providerUid);
        row.put("date_index", date);
        row.put("measure_value", 100);
        return row;
    }

    private static Set<Object> practices(List<Map<String, Object>> rows) {
        return rows.stream().map(row -> row.get("practice_uid")).collect(Collectors.toSet());
    }
}

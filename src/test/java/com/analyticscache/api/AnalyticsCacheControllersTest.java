package com.analyticscache.api;

import com.analyticscache.domain.model.DataSourceFetchResult;
import com.analyticscache.domain.model.DataSourceQueryRequest;
import com.analyticscache.domain.model.WarmAllResult;
import com.analyticscache.domain.model.WarmResult;
import com.analyticscache.domain.security.UserContext;
import com.analyticscache.domain.service.CacheWarmingService;
import com.analyticscache.domain.service.DataSourceCacheService;
import com.analyticscache.exception.DataSourceNotFoundException;
import com.analyticscache.infrastructure.cache.CacheStatsReporter;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * HTTP mapping of the query and admin endpoints, including error statuses.
 */
@WebMvcTest({AnalyticsQueryController.class, CacheAdminController.class})
@Import(GatewayUserContextResolver.class)
class AnalyticsCacheControllersTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private DataSourceCacheService dataSourceCacheService;

    @MockBean
    private CacheWarmingService warmingService;

    @MockBean
    private CacheStatsReporter statsReporter;

    @Test
    void testQuery_PathIdWinsOverBody() throws Exception {
        when(dataSourceCacheService.fetchDataSource(any(), any())).thenReturn(DataSourceFetchResult.builder()
                .rows(List.of(Map.of("practice_uid", 114)))
                .cacheHit(true)
                .build());

        mockMvc.perform(post("/api/v1/analytics/data-sources/7/query")
                        .header("X-User-Id", "u-1")
                        .header("X-User-Permissions", "analytics:read:organization")
                        .header("X-User-Practices", "114")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dataSourceId\":99,\"measure\":\"Revenue\",\"frequency\":\"Monthly\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cacheHit").value(true))
                .andExpect(jsonPath("$.rows[0].practice_uid").value(114));

        ArgumentCaptor<DataSourceQueryRequest> request = ArgumentCaptor.forClass(DataSourceQueryRequest.class);
        ArgumentCaptor<UserContext> user = ArgumentCaptor.forClass(UserContext.class);
        verify(dataSourceCacheService).fetchDataSource(request.capture(), user.capture());
        assertEquals(7, request.getValue().getDataSourceId());
        assertEquals(Integer.valueOf(114), user.getValue().getPracticeUids().iterator().next());
    }

    @Test
    void testQuery_MissingIdentityIsUnauthorized() throws Exception {
        mockMvc.perform(post("/api/v1/analytics/data-sources/7/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"measure\":\"Revenue\",\"frequency\":\"Monthly\"}"))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(dataSourceCacheService);
    }

    @Test
    void testQuery_UnknownOperatorIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/analytics/data-sources/7/query")
                        .header("X-User-Id", "u-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"measure\":\"Revenue\",\"frequency\":\"Monthly\","
                                + "\"advancedFilters\":[{\"field\":\"payer\",\"operator\":\"regex\",\"value\":\"x\"}]}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void testQuery_ServiceValidationIsBadRequest() throws Exception {
        when(dataSourceCacheService.fetchDataSource(any(), any()))
                .thenThrow(new IllegalArgumentException("measure is required for measure-based data sources"));

        mockMvc.perform(post("/api/v1/analytics/data-sources/7/query")
                        .header("X-User-Id", "u-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"frequency\":\"Monthly\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.message").value("measure is required for measure-based data sources"));
    }

    @Test
    void testWarm_RequiresReadAll() throws Exception {
        mockMvc.perform(post("/api/v1/admin/analytics-cache/1/warm")
                        .header("X-User-Id", "u-2")
                        .header("X-User-Permissions", "analytics:read:organization"))
                .andExpect(status().isForbidden());

        verifyNoInteractions(warmingService);
    }

    @Test
    void testWarm_LockHeldIsConflict() throws Exception {
        when(warmingService.warmDataSource(1)).thenReturn(WarmResult.skipped(1, 3));

        mockMvc.perform(post("/api/v1/admin/analytics-cache/1/warm")
                        .header("X-User-Id", "admin")
                        .header("X-User-Permissions", "analytics:read:all"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.skipped").value(true));
    }

    @Test
    void testWarm_UnknownDataSourceIsNotFound() throws Exception {
        when(warmingService.warmDataSource(42)).thenThrow(new DataSourceNotFoundException(42));

        mockMvc.perform(post("/api/v1/admin/analytics-cache/42/warm")
                        .header("X-User-Id", "admin")
                        .header("X-User-Permissions", "analytics:read:all"))
                .andExpect(status().isNotFound());
    }

    @Test
    void testWarmAll_StillRunningIsAccepted() throws Exception {
        when(warmingService.awaitWarm(ArgumentMatchers.<CompletableFuture<WarmAllResult>>any())).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/v1/admin/analytics-cache/warm-all")
                        .header("X-User-Id", "admin")
                        .header("X-User-Permissions", "analytics:read:all"))
                .andExpect(status().isAccepted());
    }

    @Test
    void testWarmAll_FinishedReturnsTotals() throws Exception {
        when(warmingService.awaitWarm(ArgumentMatchers.<CompletableFuture<WarmAllResult>>any()))
                .thenReturn(Optional.of(WarmAllResult.builder().dataSourcesWarmed(3).build()));

        mockMvc.perform(post("/api/v1/admin/analytics-cache/warm-all")
                        .header("X-User-Id", "admin")
                        .header("X-User-Permissions", "analytics:read:all"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.dataSourcesWarmed").value(3));
    }

    @Test
    void testInvalidate_ReportsKeysRemoved() throws Exception {
        when(dataSourceCacheService.invalidate(1)).thenReturn(12L);

        mockMvc.perform(delete("/api/v1/admin/analytics-cache/1")
                        .header("X-User-Id", "admin")
                        .header("X-User-Permissions", "analytics:read:all"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.dataSourceId").value(1))
                .andExpect(jsonPath("$.keysRemoved").value(12));
    }
}

package com.analyticscache.api;

import com.analyticscache.domain.model.BatchQueryRequest;
import com.analyticscache.domain.model.DataSourceFetchResult;
import com.analyticscache.domain.model.DataSourceQueryRequest;
import com.analyticscache.domain.security.UserContext;
import com.analyticscache.domain.service.DataSourceCacheService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST API for chart data.
 *
 * Endpoints:
 * - POST /api/v1/analytics/data-sources/{id}/query - Rows of one measure (or table) for the caller
 * - POST /api/v1/analytics/data-sources/{id}/query/batch - Several measures in one call
 *
 * Rows are always RBAC-filtered for the caller identified by the gateway headers.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/analytics/data-sources")
@RequiredArgsConstructor
public class AnalyticsQueryController {

    private final DataSourceCacheService dataSourceCacheService;
    private final GatewayUserContextResolver userContextResolver;

    /**
     * Response:
     * - rows: filtered rows
     * - cacheHit: whether rows came from the cache
     * - staleness: fresh, stale or cold (absent when nocache was requested)
     * - queryTimeMs: time spent serving the request
     */
    @PostMapping("/{dataSourceId}/query")
    public ResponseEntity<DataSourceFetchResult> query(
            @PathVariable int dataSourceId,
            @Valid @RequestBody DataSourceQueryRequest request,
            @RequestHeader(GatewayUserContextResolver.USER_ID_HEADER) String userId,
            @RequestHeader(value = GatewayUserContextResolver.PERMISSIONS_HEADER, required = false) String permissions,
            @RequestHeader(value = GatewayUserContextResolver.PRACTICES_HEADER, required = false) String practices,
            @RequestHeader(value = GatewayUserContextResolver.PROVIDER_HEADER, required = false) String provider) {

        UserContext user = userContextResolver.resolve(userId, permissions, practices, provider);
        request.setDataSourceId(dataSourceId);

        log.info("Query data source: dataSourceId={}, measure={}, frequency={}, userId={}",
                dataSourceId, request.getMeasure(), request.getFrequency(), user.getUserId());

        return ResponseEntity.ok(dataSourceCacheService.fetchDataSource(request, user));
    }

    @PostMapping("/{dataSourceId}/query/batch")
    public ResponseEntity<Map<String, DataSourceFetchResult>> batchQuery(
            @PathVariable int dataSourceId,
            @Valid @RequestBody BatchQueryRequest request,
            @RequestHeader(GatewayUserContextResolver.USER_ID_HEADER) String userId,
            @RequestHeader(value = GatewayUserContextResolver.PERMISSIONS_HEADER, required = false) String permissions,
            @RequestHeader(value = GatewayUserContextResolver.PRACTICES_HEADER, required = false) String practices,
            @RequestHeader(value = GatewayUserContextResolver.PROVIDER_HEADER, required = false) String provider) {

        UserContext user = userContextResolver.resolve(userId, permissions, practices, provider);
        request.getQuery().setDataSourceId(dataSourceId);

        log.info("Batch query data source: dataSourceId={}, measures={}, frequency={}, userId={}",
                dataSourceId, request.getMeasures(), request.getQuery().getFrequency(), user.getUserId());

        return ResponseEntity.ok(dataSourceCacheService.fetchMeasures(request.getQuery(), request.getMeasures(), user));
    }
}

package com.analyticscache.api;

import com.analyticscache.domain.model.CacheStats;
import com.analyticscache.domain.model.CacheStatus;
import com.analyticscache.domain.model.WarmAllResult;
import com.analyticscache.domain.model.WarmResult;
import com.analyticscache.domain.security.AnalyticsPermissions;
import com.analyticscache.domain.security.UserContext;
import com.analyticscache.domain.service.CacheWarmingService;
import com.analyticscache.domain.service.DataSourceCacheService;
import com.analyticscache.exception.SecurityViolationException;
import com.analyticscache.infrastructure.cache.CacheStatsReporter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.Optional;

/**
 * Cache administration.
 *
 * Endpoints:
 * - POST /api/v1/admin/analytics-cache/{id}/warm - Warm one data source now
 * - POST /api/v1/admin/analytics-cache/warm-all - Warm every active data source
 * - DELETE /api/v1/admin/analytics-cache/{id} - Invalidate one data source
 * - GET /api/v1/admin/analytics-cache/{id}/status - Warmth and freshness
 * - GET /api/v1/admin/analytics-cache/stats - Key counts, memory, largest entries
 *
 * Every endpoint exposes all organizations' data, so callers need analytics:read:all.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/admin/analytics-cache")
@RequiredArgsConstructor
public class CacheAdminController {

    private final CacheWarmingService warmingService;
    private final DataSourceCacheService dataSourceCacheService;
    private final CacheStatsReporter statsReporter;
    private final GatewayUserContextResolver userContextResolver;

    @PostMapping("/{dataSourceId}/warm")
    public ResponseEntity<WarmResult> warm(
            @PathVariable int dataSourceId,
            @RequestHeader(GatewayUserContextResolver.USER_ID_HEADER) String userId,
            @RequestHeader(value = GatewayUserContextResolver.PERMISSIONS_HEADER, required = false) String permissions) {

        requireAdmin(userId, permissions);
        log.info("Manual cache warm requested: dataSourceId={}, userId={}", dataSourceId, userId);

        WarmResult result = warmingService.warmDataSource(dataSourceId);
        return result.isSkipped()
                ? ResponseEntity.status(HttpStatus.CONFLICT).body(result)
                : ResponseEntity.ok(result);
    }

    /**
     * Waits up to the warming timeout; a warm still running after that answers 202.
     */
    @PostMapping("/warm-all")
    public ResponseEntity<WarmAllResult> warmAll(
            @RequestHeader(GatewayUserContextResolver.USER_ID_HEADER) String userId,
            @RequestHeader(value = GatewayUserContextResolver.PERMISSIONS_HEADER, required = false) String permissions) {

        requireAdmin(userId, permissions);
        log.info("Warm-all requested: userId={}", userId);

        Optional<WarmAllResult> result = warmingService.awaitWarm(warmingService.warmAllDataSourcesAsync());
        return result
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.ACCEPTED).build());
    }

    @DeleteMapping("/{dataSourceId}")
    public ResponseEntity<Map<String, Object>> invalidate(
            @PathVariable int dataSourceId,
            @RequestHeader(GatewayUserContextResolver.USER_ID_HEADER) String userId,
            @RequestHeader(value = GatewayUserContextResolver.PERMISSIONS_HEADER, required = false) String permissions) {

        requireAdmin(userId, permissions);
        long removed = dataSourceCacheService.invalidate(dataSourceId);
        log.info("Cache invalidated by admin: dataSourceId={}, keysRemoved={}, userId={}", dataSourceId, removed, userId);

        return ResponseEntity.ok(Map.of("dataSourceId", dataSourceId, "keysRemoved", removed));
    }

    @GetMapping("/{dataSourceId}/status")
    public ResponseEntity<CacheStatus> status(
            @PathVariable int dataSourceId,
            @RequestHeader(GatewayUserContextResolver.USER_ID_HEADER) String userId,
            @RequestHeader(value = GatewayUserContextResolver.PERMISSIONS_HEADER, required = false) String permissions) {

        requireAdmin(userId, permissions);
        return ResponseEntity.ok(dataSourceCacheService.cacheStatus(dataSourceId));
    }

    @GetMapping("/stats")
    public ResponseEntity<CacheStats> stats(
            @RequestHeader(GatewayUserContextResolver.USER_ID_HEADER) String userId,
            @RequestHeader(value = GatewayUserContextResolver.PERMISSIONS_HEADER, required = false) String permissions) {

        requireAdmin(userId, permissions);
        return ResponseEntity.ok(statsReporter.collect());
    }

    private void requireAdmin(String userId, String permissions) {
        UserContext user = userContextResolver.resolve(userId, permissions, null, null);
        if (!user.hasPermission(AnalyticsPermissions.READ_ALL)) {
            log.warn("SECURITY: cache administration denied: userId={}", user.getUserId());
            throw new SecurityViolationException("Cache administration requires " + AnalyticsPermissions.READ_ALL);
        }
    }
}

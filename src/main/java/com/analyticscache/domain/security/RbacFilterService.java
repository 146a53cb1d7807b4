package com.analyticscache.domain.security;

import com.analyticscache.exception.SecurityViolationException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Row-level access filter applied in memory after every cache or database fetch.
 *
 * Cached entries are shared by all users, so this is the only thing standing
 * between one user's request and another organization's rows.
 *
 * Rules:
 * - Claimed scope must be backed by the user's permissions, otherwise reject
 * - ALL passes rows through
 * - Narrower scope with an empty accessible list returns zero rows (fail-closed)
 * - ORGANIZATION keeps accessible practices; system rows (no provider) stay visible
 * - OWN keeps only the user's provider rows
 *
 * Does not touch the store, so it fails closed even when Redis is down.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RbacFilterService {

    public static final String PRACTICE_FIELD = "practice_uid";
    public static final String PROVIDER_FIELD = "provider_uid";

    private final MeterRegistry meterRegistry;

    public List<Map<String, Object>> applyRbacFilter(List<Map<String, Object>> rows,
                                                     AccessScope scope,
                                                     UserContext userContext) {
        validateScope(scope, userContext);

        switch (scope.getPermissionScope()) {
            case ALL:
                return rows;
            case ORGANIZATION:
                return filterByOrganization(rows, scope);
            case OWN:
                return filterByProvider(rows, scope);
            default:
                return deny(scope, rows.size(), "no_analytics_permission");
        }
    }

    /**
     * Reject scope spoofing: a scope is only honoured when a permission backs it.
     */
    public void validateScope(AccessScope scope, UserContext userContext) {
        if (scope == null || scope.getPermissionScope() == null) {
            throw new SecurityViolationException("Access scope missing");
        }
        if (userContext == null) {
            throw new SecurityViolationException("User context missing");
        }
        if (scope.getUserId() != null && !Objects.equals(scope.getUserId(), userContext.getUserId())) {
            log.warn("SECURITY: access scope belongs to another user: scopeUser={}, caller={}",
                    scope.getUserId(), userContext.getUserId());
            throw new SecurityViolationException("Access scope does not belong to the caller");
        }

        boolean backed = switch (scope.getPermissionScope()) {
            case ALL -> userContext.hasPermission(AnalyticsPermissions.READ_ALL);
            case ORGANIZATION -> userContext.hasPermission(AnalyticsPermissions.READ_ORGANIZATION)
                    || userContext.hasPermission(AnalyticsPermissions.READ_ALL);
            case OWN -> userContext.hasPermission(AnalyticsPermissions.READ_OWN)
                    || userContext.hasPermission(AnalyticsPermissions.READ_ORGANIZATION)
                    || userContext.hasPermission(AnalyticsPermissions.READ_ALL);
            case NONE -> true;
        };

        if (!backed) {
            log.warn("SECURITY: permission scope spoofing attempt: userId={}, claimedScope={}, permissions={}",
                    userContext.getUserId(), scope.getPermissionScope(), userContext.getPermissions());
            Counter.builder("cache.rbac.denied")
                    .tag("reason", "scope_spoofing")
                    .register(meterRegistry)
                    .increment();
            throw new SecurityViolationException(
                    "Permission scope " + scope.getPermissionScope() + " is not granted to user " + userContext.getUserId());
        }
    }

    private List<Map<String, Object>> filterByOrganization(List<Map<String, Object>> rows, AccessScope scope) {
        Set<Integer> practices = scope.getAccessiblePractices();
        if (practices == null || practices.isEmpty()) {
            return deny(scope, rows.size(), "empty_accessible_practices");
        }
        Set<Integer> providers = scope.getAccessibleProviders();
        boolean providerRestricted = providers != null && !providers.isEmpty();

        List<Map<String, Object>> visible = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            Integer practiceUid = asUid(row.get(PRACTICE_FIELD));
            if (practiceUid == null || !practices.contains(practiceUid)) {
                continue;
            }
            if (providerRestricted) {
                Object provider = row.get(PROVIDER_FIELD);
                // Rows without a provider are practice-level data, visible to the organization
                if (provider != null) {
                    Integer providerUid = asUid(provider);
                    if (providerUid == null || !providers.contains(providerUid)) {
                        continue;
                    }
                }
            }
            visible.add(row);
        }

        log.debug("RBAC organization filter: userId={}, practices={}, before={}, after={}",
                scope.getUserId(), practices.size(), rows.size(), visible.size());
        return visible;
    }

    private List<Map<String, Object>> filterByProvider(List<Map<String, Object>> rows, AccessScope scope) {
        Set<Integer> providers = scope.getAccessibleProviders();
        if (providers == null || providers.isEmpty()) {
            return deny(scope, rows.size(), "empty_accessible_providers");
        }

        List<Map<String, Object>> visible = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            Integer providerUid = asUid(row.get(PROVIDER_FIELD));
            // Null provider means cross-provider data, too broad for an own-scope user
            if (providerUid != null && providers.contains(providerUid)) {
                visible.add(row);
            }
        }

        log.debug("RBAC own filter: userId={}, providers={}, before={}, after={}",
                scope.getUserId(), providers, rows.size(), visible.size());
        return visible;
    }

    private List<Map<String, Object>> deny(AccessScope scope, int rowCount, String reason) {
        log.warn("SECURITY: fail-closed RBAC returned no data: userId={}, scope={}, reason={}, rowsBlocked={}",
                scope.getUserId(), scope.getPermissionScope(), reason, rowCount);
        Counter.builder("cache.rbac.denied")
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
        return Collections.emptyList();
    }

    /**
     * Exact int value of a UID column, or null when the value is absent, fractional
     * or outside the int range. Never narrows a large id onto a different UID.
     */
    static Integer asUid(Object value) {
        if (value == null) {
            return null;
        }
        try {
            if (value instanceof Number) {
                return new BigDecimal(value.toString()).intValueExact();
            }
            return Integer.valueOf(value.toString().trim());
        } catch (NumberFormatException | ArithmeticException e) {
            log.debug("Unusable UID value treated as absent: {}", value);
            return null;
        }
    }
}

package com.analyticscache.domain.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Permission-based scope resolution.
 *
 * - analytics:read:all          → ALL, no filtering
 * - analytics:read:organization → ORGANIZATION, the organizations' practice_uids
 * - analytics:read:own          → OWN, the user's provider_uid
 * - none of these               → NONE (fail-closed)
 */
@Slf4j
@Component
public class PermissionAccessScopeResolver implements AccessScopeResolver {

    @Override
    public AccessScope resolve(UserContext userContext) {
        if (userContext == null) {
            return AccessScope.none(null);
        }
        String userId = userContext.getUserId();

        if (userContext.hasPermission(AnalyticsPermissions.READ_ALL)) {
            return AccessScope.builder()
                    .userId(userId)
                    .permissionScope(PermissionScope.ALL)
                    .accessiblePractices(Set.of())
                    .accessibleProviders(Set.of())
                    .build();
        }

        if (userContext.hasPermission(AnalyticsPermissions.READ_ORGANIZATION)) {
            Set<Integer> practices = userContext.getPracticeUids() != null
                    ? Set.copyOf(userContext.getPracticeUids())
                    : Set.of();
            return AccessScope.builder()
                    .userId(userId)
                    .permissionScope(PermissionScope.ORGANIZATION)
                    .accessiblePractices(practices)
                    .accessibleProviders(Set.of())
                    .build();
        }

        if (userContext.hasPermission(AnalyticsPermissions.READ_OWN)) {
            Set<Integer> providers = userContext.getProviderUid() != null
                    ? Set.of(userContext.getProviderUid())
                    : Set.of();
            return AccessScope.builder()
                    .userId(userId)
                    .permissionScope(PermissionScope.OWN)
                    .accessiblePractices(Set.of())
                    .accessibleProviders(providers)
                    .build();
        }

        log.debug("No analytics permission, scope NONE: userId={}", userId);
        return AccessScope.none(userId);
    }
}

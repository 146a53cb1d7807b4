package com.analyticscache.domain.security;

import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * Resolved row-level access of one caller.
 */
@Value
@Builder
public class AccessScope {

    String userId;
    PermissionScope permissionScope;
    Set<Integer> accessiblePractices;
    Set<Integer> accessibleProviders;

    public static AccessScope none(String userId) {
        return AccessScope.builder()
                .userId(userId)
                .permissionScope(PermissionScope.NONE)
                .accessiblePractices(Set.of())
                .accessibleProviders(Set.of())
                .build();
    }
}

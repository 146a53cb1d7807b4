package com.analyticscache.domain.security;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Authenticated caller as handed over by the auth layer.
 *
 * practiceUids are the practices of the caller's organizations (hierarchy included);
 * providerUid is set for provider-level users.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserContext {

    private String userId;

    @Builder.Default
    private Set<String> permissions = new LinkedHashSet<>();

    @Builder.Default
    private Set<Integer> practiceUids = new LinkedHashSet<>();

    private Integer providerUid;

    public boolean hasPermission(String permission) {
        return permissions != null && permissions.contains(permission);
    }
}

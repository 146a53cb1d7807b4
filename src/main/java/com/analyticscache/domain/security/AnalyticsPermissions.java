package com.analyticscache.domain.security;

/**
 * Permission names backing each {@link PermissionScope}.
 */
public final class AnalyticsPermissions {

    public static final String READ_ALL = "analytics:read:all";
    public static final String READ_ORGANIZATION = "analytics:read:organization";
    public static final String READ_OWN = "analytics:read:own";

    private AnalyticsPermissions() {
    }
}

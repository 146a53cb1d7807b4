package com.analyticscache.domain.security;

/**
 * Breadth of analytics data a caller may see, broadest first.
 */
public enum PermissionScope {
    ALL,
    ORGANIZATION,
    OWN,
    NONE
}

package com.analyticscache.domain.model;

/**
 * Freshness of a data source's cache, derived from its last warm timestamp.
 */
public enum CacheStaleness {
    FRESH,
    STALE,
    COLD;

    public String getLabel() {
        return name().toLowerCase();
    }
}

package com.analyticscache.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Warmth and freshness of one data source's cache.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStatus {

    private int dataSourceId;
    private boolean warm;
    private Instant lastWarmed;
    private Long ageMinutes;
    private CacheStaleness staleness;
    private long indexedEntries;
}

package com.analyticscache.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Rows returned to one caller after RBAC, date-range and advanced filtering.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DataSourceFetchResult {

    private List<Map<String, Object>> rows;
    private boolean cacheHit;
    private CacheStaleness staleness;
    private long queryTimeMs;
}

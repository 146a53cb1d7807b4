package com.analyticscache.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Totals across a warm of every active data source.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WarmAllResult {

    private int dataSourcesWarmed;
    private int dataSourcesFailed;
    private int dataSourcesSkipped;
    private long totalEntriesCached;
    private long totalRows;
    private long durationMs;
}

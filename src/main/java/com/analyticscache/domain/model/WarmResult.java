package com.analyticscache.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of warming one data source.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WarmResult {

    private int dataSourceId;
    private int entriesCached;
    private int totalRows;
    private int skippedRows;
    private int oversizedEntries;
    private long durationMs;

    // Lock held elsewhere or inside the auto-warm cooldown
    private boolean skipped;

    // Table-based source hit its row ceiling, cache may be incomplete
    private boolean rowLimitReached;

    // Warm aborted by an error; nothing was marked warm
    private boolean failed;

    public static WarmResult skipped(int dataSourceId, long durationMs) {
        return WarmResult.builder()
                .dataSourceId(dataSourceId)
                .durationMs(durationMs)
                .skipped(true)
                .build();
    }

    public static WarmResult failed(int dataSourceId, long durationMs) {
        return WarmResult.builder()
                .dataSourceId(dataSourceId)
                .durationMs(durationMs)
                .failed(true)
                .build();
    }
}

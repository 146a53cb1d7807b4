package com.analyticscache.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Key counts and memory estimate across the whole cache.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStats {

    private long totalKeys;
    private double totalMemoryMB;

    @Builder.Default
    private Map<Integer, DataSourceStats> byDataSource = new TreeMap<>();

    @Builder.Default
    private List<EntrySize> largestEntries = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DataSourceStats {
        private long keys;
        private double memoryMB;
        private Set<String> measures;
        private CacheStaleness staleness;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EntrySize {
        private String key;
        private double sizeMB;
        private long sizeBytes;
    }
}

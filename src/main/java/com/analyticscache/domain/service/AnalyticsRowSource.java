package com.analyticscache.domain.service;

import java.util.List;
import java.util.Map;

/**
 * Bulk row access to the analytics database, the source of truth for cached rows.
 */
public interface AnalyticsRowSource {

    /**
     * Full scan used by warming.
     *
     * @param maxRows row ceiling, or null for no ceiling
     */
    List<Map<String, Object>> fetchAll(String schemaName, String tableName, Integer maxRows);

    /**
     * Rows matching every column = value pair, used on cache misses.
     */
    List<Map<String, Object>> fetch(String schemaName, String tableName, Map<String, Object> equalityFilters);
}

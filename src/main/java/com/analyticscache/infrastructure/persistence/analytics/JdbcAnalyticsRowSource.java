package com.analyticscache.infrastructure.persistence.analytics;

import com.analyticscache.config.CacheProperties;
import com.analyticscache.domain.service.AnalyticsRowSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Bulk reads from the analytics tables behind chart data sources.
 *
 * Table and column names come from configuration, so they are validated
 * and quoted instead of bound:
 * - Schema must be on the allowed list
 * - Every identifier must match ^[a-zA-Z_][a-zA-Z0-9_]*$
 * - Values are always bound parameters
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcAnalyticsRowSource implements AnalyticsRowSource {

    private static final Pattern IDENTIFIER = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*$");

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final CacheProperties properties;

    @Override
    public List<Map<String, Object>> fetchAll(String schemaName, String tableName, Integer maxRows) {
        String sql = "SELECT * FROM " + qualifiedTable(schemaName, tableName);
        MapSqlParameterSource params = new MapSqlParameterSource();
        if (maxRows != null) {
            sql += " LIMIT :maxRows";
            params.addValue("maxRows", maxRows);
        }

        long startTime = System.currentTimeMillis();
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(sql, params);
        log.debug("Analytics full read: table={}.{}, rows={}, {} ms",
                schemaName, tableName, rows.size(), System.currentTimeMillis() - startTime);
        return rows;
    }

    @Override
    public List<Map<String, Object>> fetch(String schemaName, String tableName, Map<String, Object> equalityFilters) {
        StringBuilder sql = new StringBuilder("SELECT * FROM ").append(qualifiedTable(schemaName, tableName));
        MapSqlParameterSource params = new MapSqlParameterSource();

        int index = 0;
        for (Map.Entry<String, Object> filter : equalityFilters.entrySet()) {
            String param = "p" + index++;
            sql.append(index == 1 ? " WHERE " : " AND ")
                    .append(quote(filter.getKey()))
                    .append(" = :")
                    .append(param);
            params.addValue(param, filter.getValue());
        }

        long startTime = System.currentTimeMillis();
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(sql.toString(), params);
        log.debug("Analytics filtered read: table={}.{}, filters={}, rows={}, {} ms",
                schemaName, tableName, equalityFilters.keySet(), rows.size(), System.currentTimeMillis() - startTime);
        return rows;
    }

    String qualifiedTable(String schemaName, String tableName) {
        if (schemaName == null || !properties.getWarming().getAllowedSchemas().contains(schemaName)) {
            throw new IllegalArgumentException("Schema not allowed for analytics reads: " + schemaName);
        }
        return quote(schemaName) + "." + quote(tableName);
    }

    static String quote(String identifier) {
        if (identifier == null || !IDENTIFIER.matcher(identifier).matches()) {
            throw new IllegalArgumentException("Invalid SQL identifier: " + identifier);
        }
        return "\"" + identifier + "\"";
    }
}

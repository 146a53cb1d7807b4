package com.analyticscache.domain.service;

import com.analyticscache.config.CacheProperties;
import com.analyticscache.domain.model.ChartFilter;
import com.analyticscache.domain.model.DataSourceConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Date-range and advanced filters applied in memory after RBAC.
 *
 * Cached entries hold every date and every dimension value, so one entry can
 * serve any date range or dashboard filter without a new warm.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InMemoryFilterService {

    static final String DEFAULT_DATE_COLUMN = "date_index";

    private final DataSourceConfigCache configCache;
    private final CacheProperties properties;

    /**
     * Keep rows whose configured date column falls in [startDate, endDate].
     * The end bound is exclusive when filter.end-date-inclusive is false.
     * Rows with a missing or unparsable date are dropped once a bound is set.
     */
    public List<Map<String, Object>> applyDateRangeFilter(List<Map<String, Object>> rows,
                                                          int dataSourceId,
                                                          LocalDate startDate,
                                                          LocalDate endDate) {
        if (startDate == null && endDate == null) {
            return rows;
        }

        String dateColumn = configCache.get(dataSourceId)
                .map(DataSourceConfig::getDateColumn)
                .filter(column -> !column.isBlank())
                .orElse(DEFAULT_DATE_COLUMN);
        boolean endInclusive = properties.getFilter().isEndDateInclusive();

        List<Map<String, Object>> filtered = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            LocalDate date = toLocalDate(row.get(dateColumn));
            if (date == null) {
                continue;
            }
            if (startDate != null && date.isBefore(startDate)) {
                continue;
            }
            if (endDate != null && (endInclusive ? date.isAfter(endDate) : !date.isBefore(endDate))) {
                continue;
            }
            filtered.add(row);
        }

        log.debug("Date range filter: dataSourceId={}, column={}, start={}, end={}, before={}, after={}",
                dataSourceId, dateColumn, startDate, endDate, rows.size(), filtered.size());
        return filtered;
    }

    /**
     * AND across all clauses.
     */
    public List<Map<String, Object>> applyAdvancedFilters(List<Map<String, Object>> rows, List<ChartFilter> filters) {
        if (filters == null || filters.isEmpty()) {
            return rows;
        }

        List<Map<String, Object>> filtered = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            if (filters.stream().allMatch(filter -> matches(row, filter))) {
                filtered.add(row);
            }
        }
        return filtered;
    }

    boolean matches(Map<String, Object> row, ChartFilter filter) {
        Object actual = row.get(filter.getField());
        Object expected = filter.getValue();

        return switch (filter.getOperator()) {
            case EQ -> valueEquals(actual, expected);
            case NEQ -> !valueEquals(actual, expected);
            case GT -> comparable(actual, expected) && compare(actual, expected) > 0;
            case GTE -> comparable(actual, expected) && compare(actual, expected) >= 0;
            case LT -> comparable(actual, expected) && compare(actual, expected) < 0;
            case LTE -> comparable(actual, expected) && compare(actual, expected) <= 0;
            case IN -> asCollection(expected).stream().anyMatch(value -> valueEquals(actual, value));
            case NOT_IN -> asCollection(expected).stream().noneMatch(value -> valueEquals(actual, value));
            case LIKE -> like(actual, expected);
        };
    }

    private static boolean valueEquals(Object actual, Object expected) {
        if (actual == null || expected == null) {
            return actual == null && expected == null;
        }
        BigDecimal a = asNumber(actual);
        BigDecimal b = asNumber(expected);
        if (a != null && b != null) {
            return a.compareTo(b) == 0;
        }
        return Objects.equals(actual.toString(), expected.toString());
    }

    private static boolean comparable(Object actual, Object expected) {
        return actual != null && expected != null;
    }

    /**
     * Numeric when both sides are numeric, otherwise lexical.
     */
    private static int compare(Object actual, Object expected) {
        BigDecimal a = asNumber(actual);
        BigDecimal b = asNumber(expected);
        if (a != null && b != null) {
            return a.compareTo(b);
        }
        return actual.toString().compareTo(expected.toString());
    }

    private static boolean like(Object actual, Object expected) {
        if (actual == null || expected == null) {
            return false;
        }
        String needle = expected.toString().replace("%", "").toLowerCase(Locale.ROOT);
        return actual.toString().toLowerCase(Locale.ROOT).contains(needle);
    }

    private static Collection<?> asCollection(Object value) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof Collection) {
            return (Collection<?>) value;
        }
        if (value instanceof Object[]) {
            return Arrays.asList((Object[]) value);
        }
        return List.of(value);
    }

    private static BigDecimal asNumber(Object value) {
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof Number) {
            return new BigDecimal(value.toString());
        }
        if (value instanceof String) {
            try {
                return new BigDecimal(((String) value).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    static LocalDate toLocalDate(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDate) {
            return (LocalDate) value;
        }
        if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate();
        }
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toLocalDateTime().toLocalDate();
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).toLocalDate();
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toLocalDate();
        }
        if (value instanceof Instant) {
            return ((Instant) value).atZone(ZoneOffset.UTC).toLocalDate();
        }
        if (value instanceof Date) {
            return ((Date) value).toInstant().atZone(ZoneOffset.UTC).toLocalDate();
        }
        String text = value.toString().trim();
        if (text.length() < 10) {
            return null;
        }
        try {
            return LocalDate.parse(text.substring(0, 10));
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}

package com.analyticscache.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Shape of a data source.
 *
 * MEASURE_BASED: long/narrow rows grouped by measure name.
 * TABLE_BASED: wide rows cached wholesale as one entry.
 */
public enum DataSourceType {
    MEASURE_BASED("measure-based"),
    TABLE_BASED("table-based");

    private final String code;

    DataSourceType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static DataSourceType fromCode(String code) {
        for (DataSourceType type : values()) {
            if (type.code.equalsIgnoreCase(code) || type.name().equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown data source type: " + code);
    }
}

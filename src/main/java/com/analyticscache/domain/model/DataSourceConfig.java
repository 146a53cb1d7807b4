package com.analyticscache.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Table, schema and column roles of a configured data source.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DataSourceConfig {

    private int dataSourceId;
    private String name;
    private String schemaName;
    private String tableName;

    @Builder.Default
    private DataSourceType type = DataSourceType.MEASURE_BASED;

    // Column holding the frequency value (e.g. "Monthly")
    @Builder.Default
    private String timePeriodColumn = "frequency";

    // Column holding the row date used by date-range filtering
    @Builder.Default
    private String dateColumn = "date_index";

    private boolean active;
}

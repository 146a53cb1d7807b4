package com.analyticscache.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Column metadata of a data source. Only the flags the cache relies on are mapped:
 * the time-period column (frequency) and the date column used for date-range filtering.
 */
@Entity
@Table(name = "chart_data_source_columns", indexes = {
    @Index(name = "idx_chart_data_source_columns_data_source", columnList = "data_source_id"),
    @Index(name = "idx_chart_data_source_columns_active", columnList = "is_active")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DataSourceColumnEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "column_id")
    private Integer columnId;

    @Column(name = "data_source_id", nullable = false)
    private Integer dataSourceId;

    @Column(name = "column_name", nullable = false, length = 100)
    private String columnName;

    @Column(name = "data_type", nullable = false, length = 50)
    private String dataType;

    @Builder.Default
    @Column(name = "is_time_period")
    private Boolean timePeriod = false;

    @Builder.Default
    @Column(name = "is_date_field")
    private Boolean dateField = false;

    @Builder.Default
    @Column(name = "sort_order")
    private Integer sortOrder = 0;

    @Builder.Default
    @Column(name = "is_active")
    private Boolean active = true;
}

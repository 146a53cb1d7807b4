package com.analyticscache.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Registered chart data source: which analytics table a chart reads and how it is cached.
 */
@Entity
@Table(name = "chart_data_sources", indexes = {
    @Index(name = "idx_chart_data_sources_active", columnList = "is_active"),
    @Index(name = "idx_chart_data_sources_type", columnList = "data_source_type,is_active")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DataSourceEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "data_source_id")
    private Integer dataSourceId;

    @Column(name = "data_source_name", nullable = false, length = 100)
    private String name;

    @Column(name = "data_source_description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "table_name", nullable = false, length = 100)
    private String tableName;

    @Column(name = "schema_name", nullable = false, length = 50)
    private String schemaName;

    @Builder.Default
    @Column(name = "data_source_type", nullable = false, length = 20)
    private String dataSourceType = "measure-based";

    @Builder.Default
    @Column(name = "is_active")
    private Boolean active = true;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}

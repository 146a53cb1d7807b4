package com.analyticscache.domain.model;

import jakarta.validation.Valid;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Request for the rows of one data source, as a chart asks for them.
 *
 * practiceUid / providerUid are explicit chart filters, never the caller's RBAC scope.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DataSourceQueryRequest {

    private int dataSourceId;

    // Derived from configuration when absent
    private DataSourceType dataSourceType;

    // Required for measure-based sources
    private String measure;
    private String frequency;

    private Integer practiceUid;
    private Integer providerUid;

    private LocalDate startDate;
    private LocalDate endDate;

    @Valid
    @Builder.Default
    private List<ChartFilter> advancedFilters = new ArrayList<>();

    // Skip the cache and read the source of truth
    private boolean nocache;
}

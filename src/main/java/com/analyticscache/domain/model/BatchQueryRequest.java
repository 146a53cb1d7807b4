package com.analyticscache.domain.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Several measures of one data source and frequency, sharing every other filter.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchQueryRequest {

    @Valid
    @NotNull
    private DataSourceQueryRequest query;

    @NotEmpty
    private List<String> measures;
}

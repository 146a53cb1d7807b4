package com.analyticscache.domain.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One advanced filter clause, e.g. {@code payer_name like "medicare"}.
 *
 * For IN / NOT_IN the value is a collection.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChartFilter {

    @NotBlank
    private String field;

    @NotNull
    private FilterOperator operator;

    private Object value;
}

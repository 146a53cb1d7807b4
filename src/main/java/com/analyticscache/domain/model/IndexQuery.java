package com.analyticscache.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Lookup against the secondary indexes of one data source.
 *
 * Measure and frequency are required; practice and provider lists narrow the result.
 */
@Value
@Builder
public class IndexQuery {

    int dataSourceId;
    String measure;
    String frequency;

    @Singular
    List<Integer> practiceUids;

    @Singular
    List<Integer> providerUids;
}

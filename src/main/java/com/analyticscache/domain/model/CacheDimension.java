package com.analyticscache.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Identifies one cached slice of a data source.
 *
 * Null optional fields mean "all values of this dimension" and are encoded
 * with the wildcard token in keys.
 */
@Value
@Builder
public class CacheDimension {

    int dataSourceId;
    String measure;
    Integer practiceUid;
    Integer providerUid;
    String frequency;
}

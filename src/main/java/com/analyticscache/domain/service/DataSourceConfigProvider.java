package com.analyticscache.domain.service;

import com.analyticscache.domain.model.DataSourceConfig;

import java.util.List;
import java.util.Optional;

/**
 * Lookup of data-source configuration held in the relational store.
 */
public interface DataSourceConfigProvider {

    Optional<DataSourceConfig> findById(int dataSourceId);

    List<DataSourceConfig> findActive();
}

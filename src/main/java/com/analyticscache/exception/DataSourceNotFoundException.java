package com.analyticscache.exception;

public class DataSourceNotFoundException extends RuntimeException {

    public DataSourceNotFoundException(int dataSourceId) {
        super("Data source not found: " + dataSourceId);
    }
}

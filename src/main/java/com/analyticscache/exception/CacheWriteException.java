package com.analyticscache.exception;

/**
 * A pipelined write batch failed. Aborts the warm it belongs to.
 */
public class CacheWriteException extends RuntimeException {

    public CacheWriteException(String message) {
        super(message);
    }

    public CacheWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}

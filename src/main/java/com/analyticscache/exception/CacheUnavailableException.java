package com.analyticscache.exception;

/**
 * The backing store could not be reached.
 *
 * Distinct from a cache miss: read paths fall back to the source of truth,
 * write paths abort.
 */
public class CacheUnavailableException extends RuntimeException {

    public CacheUnavailableException(String message) {
        super(message);
    }

    public CacheUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.analyticscache.exception;

/**
 * A dimension value would collide with the reserved tokens of the key format.
 */
public class InvalidCacheKeyException extends IllegalArgumentException {

    public InvalidCacheKeyException(String message) {
        super(message);
    }
}

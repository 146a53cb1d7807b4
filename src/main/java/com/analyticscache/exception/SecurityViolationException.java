package com.analyticscache.exception;

/**
 * Caller claimed an access scope its permissions do not back.
 */
public class SecurityViolationException extends RuntimeException {

    public SecurityViolationException(String message) {
        super(message);
    }
}

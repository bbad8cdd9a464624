package com.skyfinal.grid;

/**
 * The remote state service answered with an error or an unusable payload.
 */
public class StateFetchException extends RuntimeException {

    public StateFetchException(String message) {
        super(message);
    }

    public StateFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}

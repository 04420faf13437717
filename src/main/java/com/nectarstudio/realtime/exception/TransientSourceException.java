package com.nectarstudio.realtime.exception;

/**
 * The source table could not be read this cycle (timeout, dropped connection, open circuit).
 * The job keeps its cursor and tries again on its next scheduled tick.
 */
public class TransientSourceException extends RuntimeException {

    public TransientSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.nectarstudio.realtime.exception;

/**
 * A message could not be written to a connection. The connection is treated as lost.
 */
public class TransportException extends RuntimeException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}

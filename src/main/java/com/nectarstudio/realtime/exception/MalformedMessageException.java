package com.nectarstudio.realtime.exception;

/**
 * An inbound frame that is not a valid {@code {"event": ..., "data": ...}} envelope.
 */
public class MalformedMessageException extends RuntimeException {

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}

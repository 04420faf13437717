package com.nectarstudio.realtime.exception;

/**
 * A subscription that can never be served as configured: unknown service or entity,
 * no resolvable watermark column, or an invalid filter. Reported once as
 * {@code subscription_error} and never retried.
 */
public class SubscriptionConfigurationException extends RuntimeException {

    public SubscriptionConfigurationException(String message) {
        super(message);
    }

    public SubscriptionConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}

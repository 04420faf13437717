package com.nectarstudio.realtime.transport;

/**
 * Event names of the realtime protocol.
 */
public final class MessageTypes {

    // client -> server
    public static final String SUBSCRIBE_TABLE = "subscribe_table";
    public static final String UNSUBSCRIBE_TABLE = "unsubscribe_table";

    // server -> client
    public static final String TABLE_UPDATE = "table_update";
    public static final String SUBSCRIPTION_CONFIRMED = "subscription_confirmed";
    public static final String SUBSCRIPTION_ERROR = "subscription_error";
    public static final String POLLING_ERROR = "polling_error";

    public static final String METHOD_POLLING = "polling";
    public static final String METHOD_DATABASE_TRIGGERS = "database_triggers";

    private MessageTypes() {
        // Utility class - prevent instantiation
    }
}

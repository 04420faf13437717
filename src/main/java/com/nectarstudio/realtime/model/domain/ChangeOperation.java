package com.nectarstudio.realtime.model.domain;

import java.util.Locale;
import java.util.Optional;

public enum ChangeOperation {
    INSERT,
    UPDATE,
    DELETE;

    /**
     * Lenient lookup used for trigger payloads and client-side updates, where
     * producers may send lower-case names or values this version does not know.
     */
    public static Optional<ChangeOperation> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}

package com.nectarstudio.realtime.util;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Date;

/**
 * Conversions between raw watermark column values and UTC cursors.
 * <p>
 * {@code offsetMinutes} is how far the source database clock runs ahead of UTC
 * (EST without DST is {@code -300}). Values without zone information are read in
 * the source clock and shifted back by that offset.
 */
public final class WatermarkValues {

    private WatermarkValues() {
        // Utility class - prevent instantiation
    }

    /**
     * Normalises a column value to UTC. Returns null for values that are not temporal.
     */
    public static Instant toUtc(Object value, int offsetMinutes) {
        if (value == null) {
            return null;
        }
        if (value instanceof Timestamp ts) {
            return fromSourceClock(ts.toLocalDateTime(), offsetMinutes);
        }
        if (value instanceof java.sql.Date date) {
            return fromSourceClock(date.toLocalDate().atStartOfDay(), offsetMinutes);
        }
        if (value instanceof LocalDateTime ldt) {
            return fromSourceClock(ldt, offsetMinutes);
        }
        if (value instanceof LocalDate ld) {
            return fromSourceClock(ld.atStartOfDay(), offsetMinutes);
        }
        if (value instanceof OffsetDateTime odt) {
            return odt.toInstant();
        }
        if (value instanceof ZonedDateTime zdt) {
            return zdt.toInstant();
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof Date date) {
            return date.toInstant();
        }
        if (value instanceof Number epochMillis) {
            return Instant.ofEpochMilli(epochMillis.longValue());
        }
        return null;
    }

    /**
     * The cursor expressed in the source database clock, ready to bind as a query parameter.
     */
    public static Timestamp toSourceClock(Instant cursor, int offsetMinutes) {
        LocalDateTime local = LocalDateTime.ofInstant(cursor, ZoneOffset.UTC).plusMinutes(offsetMinutes);
        return Timestamp.valueOf(local);
    }

    private static Instant fromSourceClock(LocalDateTime local, int offsetMinutes) {
        return local.minusMinutes(offsetMinutes).toInstant(ZoneOffset.UTC);
    }
}

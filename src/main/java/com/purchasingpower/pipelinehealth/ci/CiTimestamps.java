package com.purchasingpower.pipelinehealth.ci;

import com.purchasingpower.pipelinehealth.exception.MalformedRunDataException;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Parser for the provider's fixed UTC timestamp format, {@code 2024-01-31T09:15:00Z}.
 */
public final class CiTimestamps {

    private static final DateTimeFormatter WIRE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'");

    private CiTimestamps() {
    }

    /**
     * @throws MalformedRunDataException if the value is missing or not in wire format
     */
    public static Instant parse(String field, String value) {
        if (value == null) {
            throw new MalformedRunDataException(field, null, null);
        }
        try {
            return LocalDateTime.parse(value, WIRE_FORMAT).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new MalformedRunDataException(field, value, e);
        }
    }

    /**
     * Like {@link #parse} but maps a missing value to null.
     */
    public static Instant parseOptional(String field, String value) {
        return value == null ? null : parse(field, value);
    }

    public static String format(Instant instant) {
        return instant == null ? null : WIRE_FORMAT.format(instant.atOffset(ZoneOffset.UTC));
    }
}

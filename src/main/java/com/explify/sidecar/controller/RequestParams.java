package com.explify.sidecar.controller;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

final class RequestParams {

    private RequestParams() {
    }

    /**
     * Parses an ISO-8601 offset date-time, local date-time (taken as UTC) or date.
     *
     * @return null for a blank value
     * @throws IllegalArgumentException for anything else
     */
    static Instant parseSince(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        try {
            if (trimmed.indexOf('T') < 0) {
                return LocalDate.parse(trimmed).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(trimmed, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime) {
                return ((OffsetDateTime)parsed).toInstant();
            }
            return ((LocalDateTime)parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid 'since' timestamp, expected ISO-8601");
        }
    }
}

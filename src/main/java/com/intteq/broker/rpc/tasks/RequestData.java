package com.intteq.broker.rpc.tasks;

import org.springframework.lang.Nullable;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Map;
import java.util.Optional;

/**
 * Typed access to the loosely-typed {@code data} map of a request.
 *
 * <p>A value is "blank" when it is absent, null, an empty string, {@code false} or a
 * numeric zero. Required arguments are checked with {@link #isBlank(String)}.
 */
final class RequestData {

    private static final DateTimeFormatter ISO_DATE_OR_DATE_TIME = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .optionalEnd()
            .toFormatter();

    private final Map<String, Object> data;

    RequestData(Map<String, Object> data) {
        this.data = data;
    }

    boolean has(String key) {
        return data.containsKey(key);
    }

    boolean hasValue(String key) {
        return data.get(key) != null;
    }

    boolean isBlank(String key) {
        Object value = data.get(key);
        if (value == null) {
            return true;
        }
        if (value instanceof String) {
            return ((String) value).isEmpty();
        }
        if (value instanceof Boolean) {
            return !((Boolean) value);
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() == 0d;
        }
        return false;
    }

    @Nullable
    String text(String key) {
        Object value = data.get(key);
        return value != null ? String.valueOf(value) : null;
    }

    /**
     * @return the value as a long, or empty when it is not an integral number
     */
    Optional<Long> id(String key) {
        Object value = data.get(key);
        if (value instanceof Number) {
            Number n = (Number) value;
            return n.doubleValue() == n.longValue() ? Optional.of(n.longValue()) : Optional.empty();
        }
        if (value instanceof String) {
            try {
                return Optional.of(Long.parseLong(((String) value).strip()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * Parse an ISO-8601 date ({@code 2025-12-31}, start of day) or date-time
     * ({@code 2025-12-31T10:00:00}, optionally with an offset, converted to UTC).
     *
     * @return empty when the value is not a string in one of those forms
     */
    static Optional<LocalDateTime> parseDateTime(@Nullable Object value) {
        if (!(value instanceof String)) {
            return Optional.empty();
        }
        TemporalAccessor parsed;
        try {
            parsed = ISO_DATE_OR_DATE_TIME.parseBest(((String) value).strip(),
                    OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
        if (parsed instanceof OffsetDateTime) {
            return Optional.of(((OffsetDateTime) parsed).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime());
        }
        if (parsed instanceof LocalDateTime) {
            return Optional.of((LocalDateTime) parsed);
        }
        return Optional.of(((LocalDate) parsed).atStartOfDay());
    }

    Object raw(String key) {
        return data.get(key);
    }
}

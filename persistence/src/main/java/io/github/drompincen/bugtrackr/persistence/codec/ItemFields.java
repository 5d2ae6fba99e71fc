package io.github.drompincen.bugtrackr.persistence.codec;

import io.github.drompincen.bugtrackr.persistence.store.StoredItem;
import io.github.drompincen.bugtrackr.protocol.api.WireValue;
import io.github.drompincen.bugtrackr.protocol.error.MalformedDataException;
import io.github.drompincen.bugtrackr.protocol.error.ValidationException;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Typed reads from a {@link StoredItem}. Every read either yields the expected Java type
 * or fails with {@link MalformedDataException} naming the field and the item.
 */
final class ItemFields {

    /** Date-time layout of {@code created_at} on overflow-encoded kinds. */
    static final DateTimeFormatter LEGACY_TIMESTAMP = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .appendLiteral(' ')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .toFormatter(Locale.ROOT)
            .withZone(ZoneOffset.UTC);

    private static final List<Function<String, Instant>> TEXT_LAYOUTS = List.of(
            Instant::parse,
            text -> OffsetDateTime.parse(text).toInstant(),
            text -> LocalDateTime.parse(text.replace(' ', 'T')).toInstant(ZoneOffset.UTC));

    private ItemFields() {}

    static String text(StoredItem item, String field) {
        Object value = item.get(field);
        if (value == null) {
            return null;
        }
        if (value instanceof String s) {
            return s;
        }
        throw new MalformedDataException(item.describeId(), field,
                "expected text but found " + value.getClass().getSimpleName());
    }

    static String requiredText(StoredItem item, String field) {
        String value = text(item, field);
        if (value == null || value.isBlank()) {
            throw new MalformedDataException(item.describeId(), field, "required attribute is missing");
        }
        return value;
    }

    static boolean flag(StoredItem item, String field) {
        Object value = item.get(field);
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s && ("true".equalsIgnoreCase(s) || "false".equalsIgnoreCase(s))) {
            return Boolean.parseBoolean(s);
        }
        throw new MalformedDataException(item.describeId(), field, "expected a boolean but found '" + value + "'");
    }

    static List<String> stringList(StoredItem item, String field) {
        Object value = item.get(field);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof Collection<?> values)) {
            throw new MalformedDataException(item.describeId(), field,
                    "expected a list but found " + value.getClass().getSimpleName());
        }
        List<String> result = new ArrayList<>(values.size());
        for (Object element : values) {
            if (!(element instanceof String s)) {
                throw new MalformedDataException(item.describeId(), field, "list element is not text");
            }
            result.add(s);
        }
        return result;
    }

    static <E extends Enum<E> & WireValue> E enumValue(StoredItem item, String field, Class<E> type) {
        String value = requiredText(item, field);
        try {
            return WireValue.parse(type, value, field);
        } catch (ValidationException e) {
            throw new MalformedDataException(item.describeId(), field, e.getMessage(), e);
        }
    }

    /**
     * Absent or blank stays null; a date-time object passes through; text is read as an ISO
     * instant, an ISO offset date-time, or a zone-less local date-time taken as UTC.
     */
    static Instant timestamp(StoredItem item, String field) {
        Object value = item.get(field);
        if (value == null) {
            return null;
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof OffsetDateTime odt) {
            return odt.toInstant();
        }
        if (value instanceof ZonedDateTime zdt) {
            return zdt.toInstant();
        }
        if (value instanceof LocalDateTime ldt) {
            return ldt.toInstant(ZoneOffset.UTC);
        }
        if (value instanceof Date date) {
            return date.toInstant();
        }
        if (value instanceof String text) {
            if (text.isBlank()) {
                return null;
            }
            return parseTimestamp(item, field, text.strip());
        }
        throw new MalformedDataException(item.describeId(), field,
                "expected a timestamp but found " + value.getClass().getSimpleName());
    }

    private static Instant parseTimestamp(StoredItem item, String field, String text) {
        DateTimeParseException failure = null;
        for (Function<String, Instant> layout : TEXT_LAYOUTS) {
            try {
                return layout.apply(text);
            } catch (DateTimeParseException e) {
                failure = e;
            }
        }
        throw new MalformedDataException(item.describeId(), field, "unparsable timestamp '" + text + "'", failure);
    }

    /** Stored representation of a domain value: ISO text for instants, wire text for enums. */
    static Object storedValue(Object value) {
        if (value instanceof Instant instant) {
            return instant.toString();
        }
        if (value instanceof WireValue wire) {
            return wire.wireValue();
        }
        if (value instanceof Collection<?> values) {
            return List.copyOf(values);
        }
        return value;
    }

    static String legacyTimestamp(Instant instant) {
        return instant != null ? LEGACY_TIMESTAMP.format(instant) : null;
    }

    /** Builds the entity, reporting a constraint violation as malformed stored data. */
    static <T> T build(StoredItem item, Supplier<T> constructor) {
        try {
            return constructor.get();
        } catch (ValidationException e) {
            throw new MalformedDataException(item.describeId(), null, e.getMessage(), e);
        }
    }
}

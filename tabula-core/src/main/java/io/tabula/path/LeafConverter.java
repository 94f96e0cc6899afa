package io.tabula.path;

import com.google.common.primitives.UnsignedInteger;
import com.google.common.primitives.UnsignedLong;
import io.tabula.core.Cell;
import io.tabula.core.Complex;
import io.tabula.core.ValueKind;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Date;

/**
 * Turns the non-null terminal value of a path into a {@link Cell}.
 * <p>
 * Chosen once per path from the terminal class, so reading a row never inspects runtime types.
 */
@FunctionalInterface
interface LeafConverter {

    Cell convert(Object value);

    static LeafConverter forType(Class<?> type, ValueKind kind) {
        return switch (kind) {
            case BOOLEAN -> value -> Cell.of(((Boolean) value).booleanValue());
            case INTEGER -> integerConverter(type);
            case FLOAT -> value -> Cell.of(((Number) value).doubleValue());
            case COMPLEX -> value -> Cell.of((Complex) value);
            case TEXT -> value -> Cell.of(value.toString());
            case TIMESTAMP -> timestampConverter(type);
            case DURATION -> value -> Cell.of((Duration) value);
            case UNAVAILABLE -> throw new IllegalArgumentException("No value kind for " + type.getName());
        };
    }

    private static LeafConverter integerConverter(Class<?> type) {
        if (type == UnsignedLong.class) {
            return value -> Cell.ofUnsigned(((UnsignedLong) value).longValue());
        }
        if (type == UnsignedInteger.class) {
            return value -> Cell.ofUnsigned(((UnsignedInteger) value).longValue());
        }
        return value -> Cell.of(((Number) value).longValue());
    }

    private static LeafConverter timestampConverter(Class<?> type) {
        if (type == ZonedDateTime.class) {
            return value -> Cell.of((ZonedDateTime) value);
        }
        if (type == OffsetDateTime.class) {
            return value -> Cell.of(((OffsetDateTime) value).toZonedDateTime());
        }
        if (type == Instant.class) {
            return value -> Cell.of(((Instant) value).atZone(ZoneOffset.UTC));
        }
        // java.sql.Date rejects toInstant(), go through epoch millis for every Date
        return value -> Cell.of(Instant.ofEpochMilli(((Date) value).getTime()).atZone(ZoneOffset.UTC));
    }
}

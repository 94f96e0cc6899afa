package io.tabula.core;

import com.google.common.primitives.UnsignedInteger;
import com.google.common.primitives.UnsignedLong;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Date;

/**
 * Maps Java types to {@link ValueKind value kinds}.
 * <p>
 * Pure functions of the class, no caching and no state. Called once per column when a path is
 * compiled, never per row.
 * <ul>
 *   <li>{@code boolean}, {@code Boolean} map to {@link ValueKind#BOOLEAN}</li>
 *   <li>{@link Duration} maps to {@link ValueKind#DURATION}</li>
 *   <li>integral primitives and boxes, Guava {@link UnsignedInteger} and {@link UnsignedLong}
 *       map to {@link ValueKind#INTEGER}</li>
 *   <li>{@code float}, {@code double} and boxes map to {@link ValueKind#FLOAT}</li>
 *   <li>{@link Complex} maps to {@link ValueKind#COMPLEX}</li>
 *   <li>{@link String}, {@code char}, {@link Character} map to {@link ValueKind#TEXT}</li>
 *   <li>{@link Instant}, {@link ZonedDateTime}, {@link OffsetDateTime} and {@link Date} map to
 *       {@link ValueKind#TIMESTAMP}</li>
 * </ul>
 * Everything else is {@link ValueKind#UNAVAILABLE}.
 */
public final class TypeClassifier {

    private TypeClassifier() { }

    /**
     * Classify a class.
     *
     * @param type the class to classify, may be primitive
     * @return the value kind, {@link ValueKind#UNAVAILABLE} if the class has none
     */
    public static ValueKind classify(Class<?> type) {
        if (type == null || type == void.class || type == Void.class) {
            return ValueKind.UNAVAILABLE;
        }
        if (type == boolean.class || type == Boolean.class) {
            return ValueKind.BOOLEAN;
        }
        // Durations are whole numbers of nanos underneath, decide them before any integer rule.
        if (type == Duration.class) {
            return ValueKind.DURATION;
        }
        if (isSignedIntegral(type) || isUnsigned(type)) {
            return ValueKind.INTEGER;
        }
        if (type == float.class || type == Float.class || type == double.class || type == Double.class) {
            return ValueKind.FLOAT;
        }
        if (type == Complex.class) {
            return ValueKind.COMPLEX;
        }
        if (type == String.class || type == char.class || type == Character.class) {
            return ValueKind.TEXT;
        }
        if (isTimestamp(type)) {
            return ValueKind.TIMESTAMP;
        }
        return ValueKind.UNAVAILABLE;
    }

    /**
     * Check whether integer values of a class must be read by their unsigned magnitude.
     *
     * @param type the class to check
     * @return true for Guava's unsigned integer types
     */
    public static boolean isUnsigned(Class<?> type) {
        return type == UnsignedLong.class || type == UnsignedInteger.class;
    }

    /**
     * Check whether a class can stand in as text through its own {@code toString()}.
     * <p>
     * Only an implementation declared below {@link Object} counts; an interface counts when it
     * redeclares {@code toString()} itself, as {@link CharSequence} does.
     *
     * @param type the class to check
     * @return true if {@code toString()} is overridden
     */
    public static boolean hasStringConversion(Class<?> type) {
        if (type == null || type.isPrimitive() || type.isArray()) {
            return false;
        }
        try {
            return type.getMethod("toString").getDeclaringClass() != Object.class;
        } catch (NoSuchMethodException e) {
            // interfaces that do not redeclare toString()
            return false;
        }
    }

    private static boolean isSignedIntegral(Class<?> type) {
        return type == int.class || type == Integer.class
                || type == long.class || type == Long.class
                || type == short.class || type == Short.class
                || type == byte.class || type == Byte.class;
    }

    private static boolean isTimestamp(Class<?> type) {
        return type == Instant.class
                || type == ZonedDateTime.class
                || type == OffsetDateTime.class
                || Date.class.isAssignableFrom(type);
    }
}

package io.tabula.core;

import java.math.BigInteger;
import java.time.Duration;
import java.time.ZonedDateTime;

/**
 * One value of one column in one row, tagged with its {@link ValueKind}.
 * <p>
 * Rows where a reference was null, an {@code Optional} was empty or an accessor failed yield
 * {@link #absent()} instead of a value.
 */
public sealed interface Cell permits Cell.Absent, Cell.BooleanCell, Cell.IntegerCell, Cell.FloatCell,
        Cell.ComplexCell, Cell.TextCell, Cell.TimestampCell, Cell.DurationCell {

    ValueKind kind();

    default boolean isAbsent() {
        return false;
    }

    static Cell absent() {
        return Absent.INSTANCE;
    }

    static Cell of(boolean value) {
        return value ? BooleanCell.TRUE : BooleanCell.FALSE;
    }

    static Cell of(long value) {
        return new IntegerCell(value, false);
    }

    static Cell ofUnsigned(long bits) {
        return new IntegerCell(bits, true);
    }

    static Cell of(double value) {
        return new FloatCell(value);
    }

    static Cell of(Complex value) {
        return new ComplexCell(value);
    }

    static Cell of(String value) {
        return new TextCell(value);
    }

    static Cell of(ZonedDateTime value) {
        return new TimestampCell(value);
    }

    static Cell of(Duration value) {
        return new DurationCell(value);
    }

    final class Absent implements Cell {
        private static final Absent INSTANCE = new Absent();

        private Absent() {
        }

        @Override
        public ValueKind kind() {
            return ValueKind.UNAVAILABLE;
        }

        @Override
        public boolean isAbsent() {
            return true;
        }

        @Override
        public String toString() {
            return "Absent";
        }
    }

    record BooleanCell(boolean value) implements Cell {
        static final BooleanCell TRUE = new BooleanCell(true);
        static final BooleanCell FALSE = new BooleanCell(false);

        @Override
        public ValueKind kind() {
            return ValueKind.BOOLEAN;
        }
    }

    /**
     * Integer value kept as raw 64 bits.
     * <p>
     * When {@code unsigned} is set the bits hold an unsigned magnitude; use
     * {@link #toBigInteger()} or {@link #toString()} rather than {@link #bits()} for display.
     */
    record IntegerCell(long bits, boolean unsigned) implements Cell {

        @Override
        public ValueKind kind() {
            return ValueKind.INTEGER;
        }

        public BigInteger toBigInteger() {
            if (unsigned && bits < 0) {
                return BigInteger.valueOf(bits).add(BigInteger.ONE.shiftLeft(Long.SIZE));
            }
            return BigInteger.valueOf(bits);
        }

        @Override
        public String toString() {
            return unsigned ? Long.toUnsignedString(bits) : Long.toString(bits);
        }
    }

    record FloatCell(double value) implements Cell {

        @Override
        public ValueKind kind() {
            return ValueKind.FLOAT;
        }
    }

    record ComplexCell(Complex value) implements Cell {

        @Override
        public ValueKind kind() {
            return ValueKind.COMPLEX;
        }
    }

    record TextCell(String value) implements Cell {

        @Override
        public ValueKind kind() {
            return ValueKind.TEXT;
        }
    }

    record TimestampCell(ZonedDateTime value) implements Cell {

        @Override
        public ValueKind kind() {
            return ValueKind.TIMESTAMP;
        }
    }

    record DurationCell(Duration value) implements Cell {

        @Override
        public ValueKind kind() {
            return ValueKind.DURATION;
        }
    }
}

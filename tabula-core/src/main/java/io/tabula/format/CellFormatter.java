package io.tabula.format;

import io.tabula.core.Cell;
import io.tabula.core.Complex;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.time.Duration;
import java.time.ZonedDateTime;

/**
 * Turns cells into text according to a {@link Format}.
 * <p>
 * Holds {@link DecimalFormat} instances, so one formatter belongs to one dump and must not be
 * shared between threads.
 */
public final class CellFormatter {

    private static final BigInteger NANOS_PER_SECOND = BigInteger.valueOf(1_000_000_000L);

    private final Format format;
    private final DecimalFormat integerFormat;
    private final DecimalFormat floatFormat;
    private final MathContext significantDigits;
    private final DecimalFormatSymbols symbols;

    public CellFormatter(Format format) {
        if (format == null) {
            throw new IllegalArgumentException("format required");
        }
        this.format = format;
        this.symbols = DecimalFormatSymbols.getInstance(format.locale());
        this.integerFormat = new DecimalFormat(format.integerPattern(), symbols);
        this.floatFormat = format.floatPattern() == null ? null : new DecimalFormat(format.floatPattern(), symbols);
        this.significantDigits = format.floatSignificantDigits() > 0
                ? new MathContext(format.floatSignificantDigits(), RoundingMode.HALF_EVEN)
                : null;
    }

    public Format format() {
        return format;
    }

    /**
     * Format one cell.
     *
     * @param cell the cell, absent cells included
     * @return the text, never {@code null}
     */
    public String format(Cell cell) {
        return switch (cell.kind()) {
            case UNAVAILABLE -> format.absentLiteral();
            case BOOLEAN -> ((Cell.BooleanCell) cell).value() ? format.trueLiteral() : format.falseLiteral();
            case INTEGER -> formatInteger((Cell.IntegerCell) cell);
            case FLOAT -> formatFloat(((Cell.FloatCell) cell).value());
            case COMPLEX -> formatComplex(((Cell.ComplexCell) cell).value());
            case TEXT -> formatText(((Cell.TextCell) cell).value());
            case TIMESTAMP -> formatTimestamp(((Cell.TimestampCell) cell).value());
            case DURATION -> formatDuration(((Cell.DurationCell) cell).value());
        };
    }

    private String formatInteger(Cell.IntegerCell cell) {
        if (cell.unsigned() && cell.bits() < 0) {
            return integerFormat.format(cell.toBigInteger());
        }
        return integerFormat.format(cell.bits());
    }

    private String formatFloat(double value) {
        if (Double.isNaN(value)) {
            return format.nanLiteral();
        }
        if (value == Double.POSITIVE_INFINITY) {
            return format.positiveInfinityLiteral();
        }
        if (value == Double.NEGATIVE_INFINITY) {
            return format.negativeInfinityLiteral();
        }
        return finite(value);
    }

    private String formatComplex(Complex value) {
        if (value.isNaN()) {
            return format.nanLiteral();
        }
        if (value.isInfinite()) {
            return format.positiveInfinityLiteral();
        }
        String imaginary = finite(value.imaginary());
        String sign = imaginary.startsWith("-") ? "" : "+";
        return "(" + finite(value.real()) + sign + imaginary + "i)";
    }

    private String finite(double value) {
        if (floatFormat != null) {
            return floatFormat.format(value);
        }
        if (significantDigits != null) {
            return significant(value);
        }
        return Double.toString(value);
    }

    /**
     * Round to the configured significant digits; scientific notation when the decimal exponent is
     * below -4 or not below the digit count, plain otherwise. Trailing zeros are dropped.
     */
    private String significant(double value) {
        if (value == 0) {
            return "0";
        }
        BigDecimal rounded = new BigDecimal(value).round(significantDigits).stripTrailingZeros();
        int exponent = rounded.precision() - rounded.scale() - 1;
        String text;
        if (exponent < -4 || exponent >= significantDigits.getPrecision()) {
            String digits = rounded.unscaledValue().abs().toString();
            StringBuilder sb = new StringBuilder();
            if (rounded.signum() < 0) {
                sb.append('-');
            }
            sb.append(digits.charAt(0));
            if (digits.length() > 1) {
                sb.append('.').append(digits, 1, digits.length());
            }
            sb.append('e').append(exponent < 0 ? '-' : '+');
            int magnitude = Math.abs(exponent);
            if (magnitude < 10) {
                sb.append('0');
            }
            text = sb.append(magnitude).toString();
        } else {
            text = rounded.toPlainString();
        }
        return text.replace('.', symbols.getDecimalSeparator());
    }

    private String formatText(String value) {
        return format.quoteText() ? quote(value) : value;
    }

    private String formatTimestamp(ZonedDateTime value) {
        ZonedDateTime shown = format.zone() == null ? value : value.withZoneSameInstant(format.zone());
        return format.timestampFormatter().format(shown);
    }

    private String formatDuration(Duration value) {
        return switch (format.durationStyle()) {
            case ISO -> value.toString();
            case NANOSECONDS -> BigInteger.valueOf(value.getSeconds())
                    .multiply(NANOS_PER_SECOND)
                    .add(BigInteger.valueOf(value.getNano()))
                    .toString();
            case HUMAN -> human(value);
        };
    }

    /**
     * Double-quoted literal with backslash escapes; control characters become {@code \}{@code uXXXX}.
     */
    static String quote(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                default -> {
                    if (Character.isISOControl(c)) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }

    /**
     * Compact form with the largest units first: {@code 1h2m3.5s}, {@code 4m0s}, {@code 1.5ms},
     * {@code 250ns}, {@code 0s}.
     */
    static String human(Duration value) {
        if (value.isZero()) {
            return "0s";
        }
        StringBuilder sb = new StringBuilder();
        BigInteger nanos = BigInteger.valueOf(value.getSeconds())
                .multiply(NANOS_PER_SECOND)
                .add(BigInteger.valueOf(value.getNano()));
        if (nanos.signum() < 0) {
            sb.append('-');
            nanos = nanos.negate();
        }

        if (nanos.compareTo(NANOS_PER_SECOND) < 0) {
            long n = nanos.longValueExact();
            if (n < 1_000L) {
                return sb.append(n).append("ns").toString();
            }
            if (n < 1_000_000L) {
                return sb.append(fraction(n, 1_000L, 3)).append("µs").toString();
            }
            return sb.append(fraction(n, 1_000_000L, 6)).append("ms").toString();
        }

        BigInteger[] split = nanos.divideAndRemainder(NANOS_PER_SECOND);
        BigInteger seconds = split[0];
        long nano = split[1].longValueExact();
        BigInteger[] hours = seconds.divideAndRemainder(BigInteger.valueOf(3600));
        long minutes = hours[1].longValueExact() / 60;
        long secs = hours[1].longValueExact() % 60;

        if (hours[0].signum() > 0) {
            sb.append(hours[0]).append('h');
        }
        if (hours[0].signum() > 0 || minutes > 0) {
            sb.append(minutes).append('m');
        }
        return sb.append(fraction(secs * 1_000_000_000L + nano, 1_000_000_000L, 9)).append('s').toString();
    }

    private static String fraction(long value, long unit, int digits) {
        long whole = value / unit;
        long rest = value % unit;
        if (rest == 0) {
            return Long.toString(whole);
        }
        String frac = String.format("%0" + digits + "d", rest);
        int end = frac.length();
        while (frac.charAt(end - 1) == '0') {
            end--;
        }
        return whole + "." + frac.substring(0, end);
    }
}

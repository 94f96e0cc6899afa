package io.tabula.format;

import java.text.DecimalFormat;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Immutable formatting options used by dumpers to turn cells into text.
 * <p>
 * Start from one of the presets and adjust:
 * <pre>
 * Format format = Format.DEFAULT.toBuilder()
 *     .floatPattern("0.00%")
 *     .zone(ZoneOffset.UTC)
 *     .build();
 * </pre>
 * Integers use {@link DecimalFormat} patterns. Floats either keep a number of significant digits
 * (plain notation for moderate exponents, {@code 1.5e-10} style otherwise) or follow a
 * {@link DecimalFormat} pattern, where a {@code %} renders the value as a percentage. Timestamps
 * use a {@link DateTimeFormatter}. The extractor never looks at a format, only dumpers do.
 */
public final class Format {

    /**
     * Human readable output: four significant digits, timestamps to the second in the system zone.
     */
    public static final Format DEFAULT = builder().build();

    /**
     * Output that keeps values as exact as text allows: shortest round-trip floats, quoted text,
     * ISO-8601 timestamps in their own zone.
     */
    public static final Format PRECISE = builder()
            .shortestFloats()
            .quoteText(true)
            .timestampFormatter(DateTimeFormatter.ISO_OFFSET_DATE_TIME)
            .zone(null)
            .durationStyle(DurationStyle.ISO)
            .nanLiteral("NaN")
            .build();

    /**
     * Output that R reads back: {@code TRUE}/{@code FALSE}, {@code NA}, quoted strings and
     * {@code as.POSIXct} timestamps.
     */
    public static final Format R = builder()
            .trueLiteral("TRUE")
            .falseLiteral("FALSE")
            .floatSignificantDigits(9)
            .quoteText(true)
            .timestampPattern("'as.POSIXct(\"'yyyy-MM-dd HH:mm:ss'\")'")
            .durationStyle(DurationStyle.NANOSECONDS)
            .absentLiteral("NA")
            .nanLiteral("NA")
            .positiveInfinityLiteral("Inf")
            .negativeInfinityLiteral("-Inf")
            .build();

    private final String trueLiteral;
    private final String falseLiteral;
    private final String integerPattern;
    private final String floatPattern;
    private final int floatSignificantDigits;
    private final boolean quoteText;
    private final String timestampPattern;
    private final DateTimeFormatter timestampFormatter;
    private final ZoneId zone;
    private final Locale locale;
    private final DurationStyle durationStyle;
    private final String absentLiteral;
    private final String nanLiteral;
    private final String positiveInfinityLiteral;
    private final String negativeInfinityLiteral;

    private Format(Builder builder) {
        this.trueLiteral = builder.trueLiteral;
        this.falseLiteral = builder.falseLiteral;
        this.integerPattern = builder.integerPattern;
        this.floatPattern = builder.floatPattern;
        this.floatSignificantDigits = builder.floatSignificantDigits;
        this.quoteText = builder.quoteText;
        this.timestampPattern = builder.timestampPattern;
        this.timestampFormatter = builder.timestampFormatter != null
                ? builder.timestampFormatter.withLocale(builder.locale)
                : DateTimeFormatter.ofPattern(builder.timestampPattern, builder.locale);
        this.zone = builder.zone;
        this.locale = builder.locale;
        this.durationStyle = builder.durationStyle;
        this.absentLiteral = builder.absentLiteral;
        this.nanLiteral = builder.nanLiteral;
        this.positiveInfinityLiteral = builder.positiveInfinityLiteral;
        this.negativeInfinityLiteral = builder.negativeInfinityLiteral;
    }

    /**
     * Create a new builder initialised with the {@link #DEFAULT} options.
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Create a builder initialised with this format's options.
     *
     * @return a new Builder instance
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.trueLiteral = trueLiteral;
        builder.falseLiteral = falseLiteral;
        builder.integerPattern = integerPattern;
        builder.floatPattern = floatPattern;
        builder.floatSignificantDigits = floatSignificantDigits;
        builder.quoteText = quoteText;
        builder.timestampPattern = timestampPattern;
        builder.timestampFormatter = timestampPattern == null ? timestampFormatter : null;
        builder.zone = zone;
        builder.locale = locale;
        builder.durationStyle = durationStyle;
        builder.absentLiteral = absentLiteral;
        builder.nanLiteral = nanLiteral;
        builder.positiveInfinityLiteral = positiveInfinityLiteral;
        builder.negativeInfinityLiteral = negativeInfinityLiteral;
        return builder;
    }

    public String trueLiteral() {
        return trueLiteral;
    }

    public String falseLiteral() {
        return falseLiteral;
    }

    public String integerPattern() {
        return integerPattern;
    }

    /**
     * The float and complex pattern, {@code null} unless one was set.
     */
    public String floatPattern() {
        return floatPattern;
    }

    /**
     * Significant digits of floats and complex parts, {@code 0} unless set.
     * <p>
     * With neither a pattern nor significant digits, floats print as the shortest text that reads
     * back to the same double.
     */
    public int floatSignificantDigits() {
        return floatSignificantDigits;
    }

    /**
     * Whether text values are rendered as quoted, escaped string literals.
     */
    public boolean quoteText() {
        return quoteText;
    }

    public DateTimeFormatter timestampFormatter() {
        return timestampFormatter;
    }

    /**
     * The zone timestamps are shown in, {@code null} to keep each value's own zone.
     */
    public ZoneId zone() {
        return zone;
    }

    public Locale locale() {
        return locale;
    }

    public DurationStyle durationStyle() {
        return durationStyle;
    }

    /**
     * Text standing in for absent cells.
     */
    public String absentLiteral() {
        return absentLiteral;
    }

    public String nanLiteral() {
        return nanLiteral;
    }

    public String positiveInfinityLiteral() {
        return positiveInfinityLiteral;
    }

    public String negativeInfinityLiteral() {
        return negativeInfinityLiteral;
    }

    /**
     * Builder for Format.
     */
    public static class Builder {
        private String trueLiteral = "true";
        private String falseLiteral = "false";
        private String integerPattern = "0";
        private String floatPattern;
        private int floatSignificantDigits = 4;
        private boolean quoteText = false;
        private String timestampPattern = "yyyy-MM-dd'T'HH:mm:ss";
        private DateTimeFormatter timestampFormatter;
        private ZoneId zone = ZoneId.systemDefault();
        private Locale locale = Locale.ROOT;
        private DurationStyle durationStyle = DurationStyle.HUMAN;
        private String absentLiteral = "";
        private String nanLiteral = "";
        private String positiveInfinityLiteral = "+∞";
        private String negativeInfinityLiteral = "-∞";

        private Builder() {
        }

        public Builder trueLiteral(String trueLiteral) {
            this.trueLiteral = requireLiteral(trueLiteral, "trueLiteral");
            return this;
        }

        public Builder falseLiteral(String falseLiteral) {
            this.falseLiteral = requireLiteral(falseLiteral, "falseLiteral");
            return this;
        }

        /**
         * Set the {@link DecimalFormat} pattern for integers.
         *
         * @param integerPattern the pattern, e.g. {@code "#,##0"}
         * @return this builder for method chaining
         */
        public Builder integerPattern(String integerPattern) {
            this.integerPattern = requirePattern(integerPattern, "integerPattern");
            return this;
        }

        /**
         * Set the {@link DecimalFormat} pattern for floats and both parts of complex numbers.
         * Replaces any significant digits setting.
         *
         * @param floatPattern the pattern, e.g. {@code "0.00%"}
         * @return this builder for method chaining
         */
        public Builder floatPattern(String floatPattern) {
            this.floatPattern = requirePattern(floatPattern, "floatPattern");
            this.floatSignificantDigits = 0;
            return this;
        }

        /**
         * Round floats and both parts of complex numbers to a number of significant digits.
         * Values whose decimal exponent is below -4 or at least {@code digits} are written in
         * scientific notation, e.g. {@code 1.5e-10}; trailing zeros are dropped. Replaces any
         * pattern setting.
         *
         * @param digits significant digits, at least 1
         * @return this builder for method chaining
         */
        public Builder floatSignificantDigits(int digits) {
            if (digits < 1) {
                throw new IllegalArgumentException("floatSignificantDigits must be positive");
            }
            this.floatSignificantDigits = digits;
            this.floatPattern = null;
            return this;
        }

        /**
         * Write floats as the shortest text that reads back to the same double.
         *
         * @return this builder for method chaining
         */
        public Builder shortestFloats() {
            this.floatSignificantDigits = 0;
            this.floatPattern = null;
            return this;
        }

        public Builder quoteText(boolean quoteText) {
            this.quoteText = quoteText;
            return this;
        }

        /**
         * Set a {@link DateTimeFormatter} pattern for timestamps.
         *
         * @param timestampPattern the pattern
         * @return this builder for method chaining
         */
        public Builder timestampPattern(String timestampPattern) {
            if (timestampPattern == null) {
                throw new IllegalArgumentException("timestampPattern required");
            }
            DateTimeFormatter.ofPattern(timestampPattern);
            this.timestampPattern = timestampPattern;
            this.timestampFormatter = null;
            return this;
        }

        public Builder timestampFormatter(DateTimeFormatter timestampFormatter) {
            if (timestampFormatter == null) {
                throw new IllegalArgumentException("timestampFormatter required");
            }
            this.timestampFormatter = timestampFormatter;
            this.timestampPattern = null;
            return this;
        }

        /**
         * Set the zone timestamps are converted to before formatting.
         *
         * @param zone the display zone, or {@code null} to keep each value's own zone
         * @return this builder for method chaining
         */
        public Builder zone(ZoneId zone) {
            this.zone = zone;
            return this;
        }

        /**
         * Set the locale for number symbols and timestamp texts (default: {@link Locale#ROOT}).
         *
         * @param locale the locale
         * @return this builder for method chaining
         */
        public Builder locale(Locale locale) {
            if (locale == null) {
                throw new IllegalArgumentException("locale required");
            }
            this.locale = locale;
            return this;
        }

        public Builder durationStyle(DurationStyle durationStyle) {
            if (durationStyle == null) {
                throw new IllegalArgumentException("durationStyle required");
            }
            this.durationStyle = durationStyle;
            return this;
        }

        public Builder absentLiteral(String absentLiteral) {
            this.absentLiteral = requireLiteral(absentLiteral, "absentLiteral");
            return this;
        }

        public Builder nanLiteral(String nanLiteral) {
            this.nanLiteral = requireLiteral(nanLiteral, "nanLiteral");
            return this;
        }

        /**
         * Set the text for positive infinity. Complex values use it for every infinite value,
         * whatever the sign of the infinite part.
         *
         * @param positiveInfinityLiteral the text
         * @return this builder for method chaining
         */
        public Builder positiveInfinityLiteral(String positiveInfinityLiteral) {
            this.positiveInfinityLiteral = requireLiteral(positiveInfinityLiteral, "positiveInfinityLiteral");
            return this;
        }

        public Builder negativeInfinityLiteral(String negativeInfinityLiteral) {
            this.negativeInfinityLiteral = requireLiteral(negativeInfinityLiteral, "negativeInfinityLiteral");
            return this;
        }

        /**
         * Build the immutable Format.
         *
         * @return a new Format instance
         */
        public Format build() {
            return new Format(this);
        }

        private static String requireLiteral(String literal, String name) {
            if (literal == null) {
                throw new IllegalArgumentException(name + " required");
            }
            return literal;
        }

        private static String requirePattern(String pattern, String name) {
            if (pattern == null || pattern.isEmpty()) {
                throw new IllegalArgumentException(name + " required");
            }
            // fail at build time rather than in the middle of a dump
            new DecimalFormat(pattern);
            return pattern;
        }
    }
}

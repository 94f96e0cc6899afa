package io.tabula.format;

/**
 * How durations are rendered.
 */
public enum DurationStyle {
    /** ISO-8601, as {@link java.time.Duration#toString()}: {@code PT1H2M3.5S}. */
    ISO,
    /** Whole nanoseconds: {@code 3723500000000}. */
    NANOSECONDS,
    /** Compact units, largest first: {@code 1h2m3.5s}, {@code 1.5ms}. */
    HUMAN
}

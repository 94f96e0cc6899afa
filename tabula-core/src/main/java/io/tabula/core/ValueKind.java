package io.tabula.core;

/**
 * Semantic kind of a column value.
 * <p>
 * A kind belongs to a compiled path, not to a single row: every row of a column carries the
 * column's kind or is {@link #UNAVAILABLE absent}.
 */
public enum ValueKind {
    UNAVAILABLE,
    BOOLEAN,
    INTEGER,
    FLOAT,
    COMPLEX,
    TEXT,
    TIMESTAMP,
    DURATION
}

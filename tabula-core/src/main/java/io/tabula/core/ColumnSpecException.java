package io.tabula.core;

/**
 * A column specification could not be compiled against a record type.
 * <p>
 * Thrown once at construction time; a spec that compiled never fails this way while rows are read.
 */
public class ColumnSpecException extends TabulaException {

    /**
     * Why a spec was rejected.
     */
    public enum Reason {
        /** The spec is blank or contains an empty segment. */
        MALFORMED_SPEC,
        /** A segment names neither a field nor an accessor of the current type. */
        NO_SUCH_MEMBER,
        /** A segment names a method that takes arguments or returns nothing. */
        ACCESSOR_SIGNATURE,
        /** The member's generic type cannot be reduced to a concrete class. */
        UNRESOLVABLE_TYPE,
        /** The last segment's type has no value kind and no string conversion. */
        UNSUPPORTED_TERMINAL_TYPE
    }

    private final Class<?> rootType;
    private final String spec;
    private final String segment;
    private final Reason reason;

    public ColumnSpecException(Class<?> rootType, String spec, String segment, Reason reason, String detail) {
        super(detail + " (column '" + spec + "' on " + (rootType == null ? "null" : rootType.getName()) + ")");
        this.rootType = rootType;
        this.spec = spec;
        this.segment = segment;
        this.reason = reason;
    }

    public Class<?> rootType() {
        return rootType;
    }

    public String spec() {
        return spec;
    }

    /**
     * The segment that failed, or {@code null} when the spec as a whole is malformed.
     */
    public String segment() {
        return segment;
    }

    public Reason reason() {
        return reason;
    }
}

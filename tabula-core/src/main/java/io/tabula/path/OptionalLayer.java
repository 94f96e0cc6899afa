package io.tabula.path;

import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;

/**
 * One level of optional indirection around a value.
 * <p>
 * {@code Optional<Optional<T>>} is two {@link #OBJECT} layers; the primitive optionals can only be
 * the innermost layer.
 */
public enum OptionalLayer {
    OBJECT(Optional.class, null),
    INT(OptionalInt.class, int.class),
    LONG(OptionalLong.class, long.class),
    DOUBLE(OptionalDouble.class, double.class);

    private final Class<?> wrapperType;
    private final Class<?> primitiveType;

    OptionalLayer(Class<?> wrapperType, Class<?> primitiveType) {
        this.wrapperType = wrapperType;
        this.primitiveType = primitiveType;
    }

    public Class<?> wrapperType() {
        return wrapperType;
    }

    /**
     * The value type inside a primitive optional, {@code null} for {@link #OBJECT}.
     */
    Class<?> primitiveType() {
        return primitiveType;
    }

    /**
     * Unwrap one layer.
     *
     * @param wrapper an instance of {@link #wrapperType()}
     * @return the contained value, or {@code null} if the optional is empty
     */
    public Object unwrap(Object wrapper) {
        return switch (this) {
            case OBJECT -> ((Optional<?>) wrapper).orElse(null);
            case INT -> {
                OptionalInt optional = (OptionalInt) wrapper;
                yield optional.isPresent() ? (Object) optional.getAsInt() : null;
            }
            case LONG -> {
                OptionalLong optional = (OptionalLong) wrapper;
                yield optional.isPresent() ? (Object) optional.getAsLong() : null;
            }
            case DOUBLE -> {
                OptionalDouble optional = (OptionalDouble) wrapper;
                yield optional.isPresent() ? (Object) optional.getAsDouble() : null;
            }
        };
    }

    static OptionalLayer forPrimitiveWrapper(Class<?> type) {
        if (type == OptionalInt.class) {
            return INT;
        }
        if (type == OptionalLong.class) {
            return LONG;
        }
        if (type == OptionalDouble.class) {
            return DOUBLE;
        }
        return null;
    }
}

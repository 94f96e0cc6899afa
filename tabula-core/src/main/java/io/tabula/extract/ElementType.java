package io.tabula.extract;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;

/**
 * Captures the full generic element type of a collection, e.g. {@code Optional<Order>}.
 * <p>
 * Create one through {@link #of(Class)} for plain classes, or with an anonymous subclass for
 * generic element types:
 * <pre>
 * ElementType&lt;Optional&lt;Order&gt;&gt; type = new ElementType&lt;&gt;() { };
 * </pre>
 *
 * @param <T> the element type
 */
public abstract class ElementType<T> {

    private final Type type;

    protected ElementType() {
        Type superclass = getClass().getGenericSuperclass();
        if (!(superclass instanceof ParameterizedType parameterized)) {
            throw new IllegalStateException("ElementType must be created with a type argument");
        }
        this.type = parameterized.getActualTypeArguments()[0];
    }

    private ElementType(Type type) {
        this.type = type;
    }

    public static <T> ElementType<T> of(Class<T> type) {
        if (type == null) {
            throw new IllegalArgumentException("type required");
        }
        return new ElementType<>(type) { };
    }

    public Type type() {
        return type;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof ElementType<?> other && type.equals(other.type));
    }

    @Override
    public int hashCode() {
        return type.hashCode();
    }

    @Override
    public String toString() {
        return type.getTypeName();
    }
}

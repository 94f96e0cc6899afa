package io.tabula.path;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.WildcardType;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A generic type reduced to the concrete class behind its optional layers.
 * <p>
 * {@code Optional<Optional<Address>>} resolves to {@code Address} with two {@link OptionalLayer#OBJECT}
 * layers, {@code OptionalLong} to {@code long} with one {@link OptionalLayer#LONG} layer.
 *
 * @param type   the class reached after all layers
 * @param layers the layers, outermost first
 */
public record ResolvedType(Class<?> type, List<OptionalLayer> layers) {

    public ResolvedType {
        if (type == null) {
            throw new IllegalArgumentException("type required");
        }
        layers = List.copyOf(layers);
    }

    /**
     * Number of optional layers in front of {@link #type()}.
     */
    public int indirection() {
        return layers.size();
    }

    /**
     * Resolve a generic type.
     *
     * @param genericType a field, return or element type
     * @return the resolved type, or empty if a type variable, raw {@code Optional} or generic array
     *         is in the way
     */
    public static Optional<ResolvedType> resolve(Type genericType) {
        List<OptionalLayer> layers = new ArrayList<>();
        Type current = genericType;
        while (true) {
            if (current instanceof Class<?> raw) {
                if (raw == Optional.class) {
                    return Optional.empty();
                }
                OptionalLayer primitive = OptionalLayer.forPrimitiveWrapper(raw);
                if (primitive != null) {
                    layers.add(primitive);
                    return Optional.of(new ResolvedType(primitive.primitiveType(), layers));
                }
                return Optional.of(new ResolvedType(raw, layers));
            }
            if (current instanceof ParameterizedType parameterized) {
                Class<?> raw = (Class<?>) parameterized.getRawType();
                if (raw != Optional.class) {
                    return Optional.of(new ResolvedType(raw, layers));
                }
                layers.add(OptionalLayer.OBJECT);
                current = parameterized.getActualTypeArguments()[0];
                continue;
            }
            if (current instanceof WildcardType wildcard
                    && wildcard.getLowerBounds().length == 0
                    && wildcard.getUpperBounds().length == 1) {
                current = wildcard.getUpperBounds()[0];
                continue;
            }
            return Optional.empty();
        }
    }
}

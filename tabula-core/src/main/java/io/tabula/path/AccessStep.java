package io.tabula.path;

import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.util.List;

/**
 * One hop of a compiled path: read a field or call a zero-argument accessor, then strip the
 * optional layers around the result.
 * <p>
 * All flags are fixed when the path is compiled.
 */
public sealed interface AccessStep permits AccessStep.FieldStep, AccessStep.CallStep {

    /**
     * The path segment this step was compiled from.
     */
    String name();

    /**
     * Optional layers stripped after the raw read, outermost first.
     */
    List<OptionalLayer> layers();

    /**
     * The class reached after this step.
     */
    Class<?> resultType();

    /**
     * Whether the raw read yields a reference that may be {@code null}.
     */
    boolean nullable();

    default int indirection() {
        return layers().size();
    }

    /**
     * Whether the accessor declares failures that turn the row absent.
     */
    default boolean mayFail() {
        return false;
    }

    /**
     * Whether the step was added by the compiler rather than named in the spec.
     */
    default boolean synthetic() {
        return false;
    }

    /**
     * Whether this step alone can make a row absent.
     */
    default boolean mayBeAbsent() {
        return nullable() || indirection() > 0 || mayFail();
    }

    record FieldStep(String name, Field field, boolean nullable, List<OptionalLayer> layers,
                     Class<?> resultType) implements AccessStep {

        public FieldStep {
            layers = List.copyOf(layers);
        }
    }

    record CallStep(String name, Method method, boolean nullable, boolean mayFail, boolean synthetic,
                    List<OptionalLayer> layers, Class<?> resultType) implements AccessStep {

        public CallStep {
            layers = List.copyOf(layers);
        }
    }
}

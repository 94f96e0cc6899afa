package io.tabula.path;

import io.tabula.core.Cell;
import io.tabula.core.ColumnAccessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;

/**
 * Reader that fuses every step of a path into a single method handle chain.
 * <p>
 * Equivalent composed Java (simplified):
 *
 * <pre>{@code
 * Object read(Object element) {
 *     if (element == null) return MISSING;
 *     Object v = step0.invoke(element);        // field getter or accessor
 *     if (v == null) return MISSING;
 *     v = ((Optional<?>) v).orElse(MISSING);   // one per optional layer
 *     if (v == MISSING) return MISSING;
 *     ...
 *     return converter.convert(v);
 * }
 * }</pre>
 * Accessors that may fail are wrapped so that an exception yields {@code MISSING} as well.
 * Once a stage produces {@code MISSING} every later stage passes it through untouched.
 */
final class FusedPathReader implements PathReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(FusedPathReader.class);

    private static final Object MISSING = new Object();
    private static final MethodType READER_TYPE = MethodType.methodType(Object.class, Object.class);

    private static final MethodHandle IS_MISSING;
    private static final MethodHandle ALWAYS_MISSING;
    private static final MethodHandle UNWRAP;
    private static final MethodHandle ACCESSOR_FAILED;
    private static final MethodHandle CONVERT;

    static {
        MethodHandles.Lookup lookup = MethodHandles.lookup();
        try {
            IS_MISSING = lookup.findStatic(FusedPathReader.class, "isMissing",
                    MethodType.methodType(boolean.class, Object.class));
            ALWAYS_MISSING = MethodHandles.dropArguments(
                    MethodHandles.constant(Object.class, MISSING), 0, Object.class);
            UNWRAP = lookup.findStatic(FusedPathReader.class, "unwrap",
                    MethodType.methodType(Object.class, OptionalLayer.class, Object.class));
            ACCESSOR_FAILED = lookup.findStatic(FusedPathReader.class, "accessorFailed",
                    MethodType.methodType(Object.class, String.class, String.class, Exception.class, Object.class));
            CONVERT = lookup.findVirtual(LeafConverter.class, "convert",
                    MethodType.methodType(Cell.class, Object.class));
        } catch (NoSuchMethodException | IllegalAccessException e) {
            throw new ExceptionInInitializerError(e);
        }
    }

    private final CompiledPath path;
    private final MethodHandle chain;

    private FusedPathReader(CompiledPath path, MethodHandle chain) {
        this.path = path;
        this.chain = chain;
    }

    static FusedPathReader create(CompiledPath path, int primaryIndirection) {
        MethodHandle chain = MethodHandles.identity(Object.class);
        for (int i = 0; i < primaryIndirection; i++) {
            chain = then(chain, UNWRAP.bindTo(OptionalLayer.OBJECT));
        }
        for (int i = 0; i < path.steps().size(); i++) {
            AccessStep step = path.steps().get(i);
            MethodHandle read = path.reader(i);
            if (step.mayFail()) {
                read = MethodHandles.catchException(read, Exception.class,
                        MethodHandles.insertArguments(ACCESSOR_FAILED, 0, path.spec(), step.name()));
            }
            chain = then(chain, read);
            for (OptionalLayer layer : step.layers()) {
                chain = then(chain, UNWRAP.bindTo(layer));
            }
        }
        chain = then(chain, CONVERT.bindTo(path.leafConverter()).asType(READER_TYPE));
        return new FusedPathReader(path, chain);
    }

    @Override
    public Cell read(Object element) {
        Object result;
        try {
            result = (Object) chain.invokeExact(element);
        } catch (Error e) {
            throw e;
        } catch (Throwable e) {
            throw new ColumnAccessException(path.spec(), e);
        }
        return result == MISSING ? Cell.absent() : (Cell) result;
    }

    /**
     * Append a stage that only runs when the previous stage produced a value.
     */
    private static MethodHandle then(MethodHandle chain, MethodHandle stage) {
        return MethodHandles.filterReturnValue(chain,
                MethodHandles.guardWithTest(IS_MISSING, ALWAYS_MISSING, stage));
    }

    private static boolean isMissing(Object value) {
        return value == null || value == MISSING;
    }

    private static Object unwrap(OptionalLayer layer, Object wrapper) {
        Object value = layer.unwrap(wrapper);
        return value == null ? MISSING : value;
    }

    private static Object accessorFailed(String spec, String step, Exception failure, Object receiver) {
        LOGGER.trace("Accessor {} of '{}' failed, row is absent", step, spec, failure);
        return MISSING;
    }

    @Override
    public String toString() {
        return "FusedPathReader[" + path.spec() + "]";
    }
}

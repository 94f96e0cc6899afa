package io.tabula.path;

import io.tabula.core.Cell;
import io.tabula.core.ColumnAccessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandle;
import java.util.List;
import java.util.Optional;

/**
 * Walks a compiled path over one element, step by step.
 * <p>
 * The first null reference, empty optional or failed accessor ends the walk with
 * {@link Cell#absent()}; later steps are never attempted.
 */
public final class PathExecutor {

    private static final Logger LOGGER = LoggerFactory.getLogger(PathExecutor.class);

    private PathExecutor() { }

    /**
     * Read a path off an element.
     *
     * @param element            the collection element
     * @param path               the compiled path
     * @param primaryIndirection number of {@code Optional} layers around the element
     * @return the leaf value of the path's kind, or absent
     * @throws ColumnAccessException if an accessor that declares no failure throws
     */
    public static Cell execute(Object element, CompiledPath path, int primaryIndirection) {
        Object current = element;
        for (int i = 0; i < primaryIndirection; i++) {
            if (current == null) {
                return Cell.absent();
            }
            current = ((Optional<?>) current).orElse(null);
        }
        if (current == null) {
            return Cell.absent();
        }

        List<AccessStep> steps = path.steps();
        for (int i = 0; i < steps.size(); i++) {
            AccessStep step = steps.get(i);
            current = read(path, i, step, current);
            if (current == null) {
                return Cell.absent();
            }
            for (OptionalLayer layer : step.layers()) {
                current = layer.unwrap(current);
                if (current == null) {
                    return Cell.absent();
                }
            }
        }
        return path.convertLeaf(current);
    }

    /**
     * Raw read of one step; {@code null} stands for a failed accessor as well as a null result.
     */
    private static Object read(CompiledPath path, int index, AccessStep step, Object receiver) {
        MethodHandle reader = path.reader(index);
        try {
            return (Object) reader.invokeExact(receiver);
        } catch (Error e) {
            throw e;
        } catch (Throwable e) {
            if (step.mayFail() && e instanceof Exception) {
                LOGGER.trace("Accessor {} of '{}' failed, row is absent", step.name(), path.spec(), e);
                return null;
            }
            throw new ColumnAccessException(path.spec(), e);
        }
    }
}

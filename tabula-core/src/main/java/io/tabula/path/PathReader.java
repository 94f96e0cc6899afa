package io.tabula.path;

import io.tabula.core.Cell;
import io.tabula.core.TabulaConfiguration.AccessStrategy;

/**
 * Reads one compiled path off one collection element.
 * <p>
 * Implementations hold no per-row state and may be shared by concurrent readers.
 */
@FunctionalInterface
public interface PathReader {

    /**
     * Read the path's value from an element of the bound collection.
     *
     * @param element the element, possibly {@code null} or wrapped in optional layers
     * @return the typed value, or {@link Cell#absent()}
     */
    Cell read(Object element);

    /**
     * Create a reader for a path.
     *
     * @param path               the compiled path
     * @param primaryIndirection optional layers around every element of the collection
     * @param strategy           how the steps are walked
     * @return a reader
     */
    static PathReader of(CompiledPath path, int primaryIndirection, AccessStrategy strategy) {
        if (path == null) {
            throw new IllegalArgumentException("path required");
        }
        if (primaryIndirection < 0) {
            throw new IllegalArgumentException("primaryIndirection must not be negative");
        }
        return switch (strategy) {
            case STEPWISE -> element -> PathExecutor.execute(element, path, primaryIndirection);
            case FUSED -> FusedPathReader.create(path, primaryIndirection);
        };
    }
}

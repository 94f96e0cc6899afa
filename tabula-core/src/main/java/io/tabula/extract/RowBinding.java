package io.tabula.extract;

import io.tabula.core.Cell;
import io.tabula.path.PathReader;

import java.util.List;
import java.util.Objects;

/**
 * A column's path reader bound to one backing collection.
 * <p>
 * The collection is borrowed, never copied or modified.
 */
record RowBinding(List<?> rows, int rowCount, PathReader reader) {

    Cell valueAt(int row) {
        Objects.checkIndex(row, rowCount);
        return reader.read(rows.get(row));
    }
}

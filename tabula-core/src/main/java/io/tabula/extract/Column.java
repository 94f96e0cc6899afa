package io.tabula.extract;

import io.tabula.core.Cell;
import io.tabula.core.ValueKind;
import io.tabula.path.CompiledPath;
import io.tabula.path.PathReader;

import java.util.List;

/**
 * A named, typed column of an {@link Extractor}.
 * <p>
 * The name starts out as the path name and may be changed freely; the path and kind never change.
 * The column is owned by one extractor and rebound whenever that extractor is.
 */
public final class Column {

    private final CompiledPath path;
    private final PathReader reader;
    private String name;
    private RowBinding binding;

    Column(CompiledPath path, PathReader reader) {
        this.path = path;
        this.reader = reader;
        this.name = path.name();
    }

    public String name() {
        return name;
    }

    /**
     * Change the column name. Has no effect on the path.
     *
     * @param name the new name
     */
    public void rename(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name required");
        }
        this.name = name;
    }

    public ValueKind kind() {
        return path.kind();
    }

    /**
     * Whether integer values of this column carry an unsigned magnitude.
     */
    public boolean unsigned() {
        return path.unsigned();
    }

    /**
     * Whether some rows of this column may be absent.
     */
    public boolean mayBeAbsent() {
        return path.mayBeAbsent();
    }

    public CompiledPath path() {
        return path;
    }

    /**
     * Read the value of a row of the bound collection.
     *
     * @param row row index, {@code 0 <= row < rowCount}
     * @return the value, or {@link Cell#absent()}
     * @throws IndexOutOfBoundsException if the row is out of range
     */
    public Cell valueAt(int row) {
        return binding.valueAt(row);
    }

    void bind(List<?> rows) {
        this.binding = new RowBinding(rows, rows.size(), reader);
    }

    @Override
    public String toString() {
        return "Column[" + name + ", " + path.kind() + "]";
    }
}

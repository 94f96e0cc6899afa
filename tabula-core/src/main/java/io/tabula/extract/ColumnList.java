package io.tabula.extract;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Column list of one extractor: supports reordering and removal, rejects columns it does not own.
 */
final class ColumnList extends AbstractList<Column> {

    private final List<Column> columns;
    private final Set<Column> owned;

    ColumnList(List<Column> columns) {
        this.columns = new ArrayList<>(columns);
        this.owned = Collections.newSetFromMap(new IdentityHashMap<>());
        this.owned.addAll(columns);
    }

    @Override
    public Column get(int index) {
        return columns.get(index);
    }

    @Override
    public int size() {
        return columns.size();
    }

    @Override
    public Column set(int index, Column column) {
        if (!owned.contains(column)) {
            throw new IllegalArgumentException("Column " + column + " belongs to another extractor");
        }
        return columns.set(index, column);
    }

    @Override
    public Column remove(int index) {
        modCount++;
        return columns.remove(index);
    }
}

package io.tabula.extract;

import io.tabula.core.ColumnSpecException;
import io.tabula.core.TabulaConfiguration;
import io.tabula.path.CompiledPath;
import io.tabula.path.OptionalLayer;
import io.tabula.path.PathCompiler;
import io.tabula.path.PathReader;
import io.tabula.path.ResolvedType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Tabular view over a list of records.
 * <p>
 * An extractor compiles its column specifications once, against the element type it was created
 * for, and can then be {@link #bind(List) bound} to any number of lists of that type without
 * recompiling:
 * <pre>
 * Extractor&lt;Order&gt; extractor = Extractor.create(Order.class, orders, "id", "customer.name", "total");
 * for (int row = 0; row &lt; extractor.rowCount(); row++) {
 *     for (Column column : extractor.columns()) {
 *         Cell cell = column.valueAt(row);
 *     }
 * }
 * extractor.bind(moreOrders);
 * </pre>
 * Elements may be {@code null} or wrapped in {@code Optional} layers (see {@link ElementType});
 * such rows are absent in every column.
 * <p>
 * Creation and rebinding must not run concurrently with anything else on the same extractor.
 * Reading values of a bound extractor is safe from many threads while the data is not modified.
 *
 * @param <T> the element type of the bound lists
 */
public final class Extractor<T> {

    private static final Logger LOGGER = LoggerFactory.getLogger(Extractor.class);

    private final ElementType<T> elementType;
    private final Class<?> recordType;
    private final int primaryIndirection;
    private final List<Column> columns;
    private int rowCount;

    private Extractor(ElementType<T> elementType, Class<?> recordType, int primaryIndirection, List<Column> columns) {
        this.elementType = elementType;
        this.recordType = recordType;
        this.primaryIndirection = primaryIndirection;
        this.columns = new ColumnList(columns);
    }

    /**
     * Create an extractor with the default configuration.
     *
     * @param type        the element class
     * @param rows        the initial rows
     * @param columnSpecs the column specifications, in column order
     * @return a bound extractor
     * @throws ColumnSpecException if any specification does not compile
     */
    public static <T> Extractor<T> create(Class<T> type, List<? extends T> rows, String... columnSpecs) {
        return create(ElementType.of(type), rows, TabulaConfiguration.defaults(), Arrays.asList(columnSpecs));
    }

    public static <T> Extractor<T> create(Class<T> type, List<? extends T> rows, TabulaConfiguration configuration,
                                          String... columnSpecs) {
        return create(ElementType.of(type), rows, configuration, Arrays.asList(columnSpecs));
    }

    public static <T> Extractor<T> create(ElementType<T> type, List<? extends T> rows, String... columnSpecs) {
        return create(type, rows, TabulaConfiguration.defaults(), Arrays.asList(columnSpecs));
    }

    /**
     * Create an extractor.
     * <p>
     * Every specification is compiled in order; the first one that fails aborts the whole
     * extractor. The result is bound to {@code rows}.
     *
     * @param type          the element type, optional layers included
     * @param rows          the initial rows
     * @param configuration compilation and access configuration
     * @param columnSpecs   the column specifications, in column order
     * @return a bound extractor
     * @throws ColumnSpecException if any specification does not compile
     */
    public static <T> Extractor<T> create(ElementType<T> type, List<? extends T> rows,
                                          TabulaConfiguration configuration, List<String> columnSpecs) {
        if (type == null) {
            throw new IllegalArgumentException("type required");
        }
        if (rows == null) {
            throw new IllegalArgumentException("rows required");
        }
        if (configuration == null) {
            throw new IllegalArgumentException("configuration required");
        }
        if (columnSpecs == null) {
            throw new IllegalArgumentException("columnSpecs required");
        }

        ResolvedType resolved = ResolvedType.resolve(type.type())
                .orElseThrow(() -> new IllegalArgumentException("Cannot build extractor for " + type));
        for (OptionalLayer layer : resolved.layers()) {
            if (layer != OptionalLayer.OBJECT) {
                throw new IllegalArgumentException("Cannot build extractor for primitive optionals: " + type);
            }
        }
        Class<?> recordType = resolved.type();

        PathCompiler compiler = new PathCompiler(configuration);
        List<Column> columns = new ArrayList<>(columnSpecs.size());
        for (String spec : columnSpecs) {
            CompiledPath path = compiler.compile(recordType, spec);
            PathReader reader = PathReader.of(path, resolved.indirection(), configuration.accessStrategy());
            columns.add(new Column(path, reader));
        }

        Extractor<T> extractor = new Extractor<>(type, recordType, resolved.indirection(), columns);
        LOGGER.debug("Created extractor for {} with {} columns ({})", type, columns.size(), configuration);
        extractor.bind(rows);
        return extractor;
    }

    /**
     * Bind this extractor to another list of the same element type.
     * <p>
     * Updates {@link #rowCount()} and every column's values; the compiled paths are reused as is.
     *
     * @param rows the new rows
     */
    public void bind(List<? extends T> rows) {
        if (rows == null) {
            throw new IllegalArgumentException("rows required");
        }
        for (Column column : columns) {
            column.bind(rows);
        }
        rowCount = rows.size();
        LOGGER.debug("Bound extractor for {} to {} rows", elementType, rowCount);
    }

    /**
     * Bind to a list whose element type is only known at runtime.
     *
     * @param type the element type of {@code rows}
     * @param rows the new rows
     * @throws IllegalArgumentException if {@code type} differs from this extractor's element type
     */
    @SuppressWarnings("unchecked")
    public void bind(ElementType<?> type, List<?> rows) {
        if (!elementType.equals(type)) {
            throw new IllegalArgumentException(
                    "Cannot bind extractor for " + elementType + " to data of type " + type);
        }
        bind((List<? extends T>) rows);
    }

    /**
     * Number of rows in the currently bound list.
     */
    public int rowCount() {
        return rowCount;
    }

    /**
     * The columns, in output order.
     * <p>
     * The list is live: columns may be renamed, reordered or removed. Adding columns is not
     * supported, and only this extractor's own columns may be set into it.
     *
     * @return the mutable column list
     */
    public List<Column> columns() {
        return columns;
    }

    /**
     * Find a column by its current name.
     *
     * @param name the column name
     * @return the first column with that name
     */
    public Optional<Column> column(String name) {
        for (Column column : columns) {
            if (column.name().equals(name)) {
                return Optional.of(column);
            }
        }
        return Optional.empty();
    }

    public ElementType<T> elementType() {
        return elementType;
    }

    /**
     * The class the column paths were compiled against, the element type without optional layers.
     */
    public Class<?> recordType() {
        return recordType;
    }

    /**
     * Number of {@code Optional} layers around each element.
     */
    public int primaryIndirection() {
        return primaryIndirection;
    }

    @Override
    public String toString() {
        return "Extractor[" + elementType + ", rows=" + rowCount + ", columns=" + columns + "]";
    }
}

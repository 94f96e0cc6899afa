package io.tabula.dump;

import io.tabula.extract.Column;
import io.tabula.extract.Extractor;
import io.tabula.format.CellFormatter;
import io.tabula.format.Format;

import java.io.IOException;
import java.util.List;

/**
 * R source: one {@code name <- c(...)} vector per column, optionally combined into a data frame.
 * <p>
 * Use together with {@link Format#R} so that the output reads back into R:
 * <pre>
 * new RVectorDumper(writer, "orders").dump(extractor, Format.R);
 * </pre>
 * Column names are written as they are; rename columns that are not valid R identifiers.
 */
public final class RVectorDumper implements Dumper {

    private static final int VALUES_PER_LINE = 10;

    private final Appendable out;
    private final String dataFrame;

    public RVectorDumper(Appendable out) {
        this(out, null);
    }

    /**
     * @param out       target
     * @param dataFrame name of a data frame built from all vectors, {@code null} or empty for none
     */
    public RVectorDumper(Appendable out, String dataFrame) {
        if (out == null) {
            throw new IllegalArgumentException("out required");
        }
        this.out = out;
        this.dataFrame = dataFrame;
    }

    @Override
    public void dump(Extractor<?> extractor, Format format) throws IOException {
        CellFormatter formatter = new CellFormatter(format);
        List<Column> columns = List.copyOf(extractor.columns());
        int rows = extractor.rowCount();
        for (Column column : columns) {
            out.append(column.name()).append(" <- c(");
            for (int row = 0; row < rows; row++) {
                out.append(formatter.format(column.valueAt(row)));
                if (row < rows - 1) {
                    out.append(row % VALUES_PER_LINE == VALUES_PER_LINE - 1 ? ",\n" : ", ");
                }
            }
            out.append(")\n");
        }

        if (dataFrame != null && !dataFrame.isEmpty()) {
            out.append(dataFrame).append(" <- data.frame(");
            for (int c = 0; c < columns.size(); c++) {
                if (c > 0) {
                    out.append(", ");
                }
                out.append(columns.get(c).name());
            }
            out.append(")\n");
        }
    }
}

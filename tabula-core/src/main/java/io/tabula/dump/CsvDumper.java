package io.tabula.dump;

import io.tabula.extract.Column;
import io.tabula.extract.Extractor;
import io.tabula.format.CellFormatter;
import io.tabula.format.Format;

import java.io.IOException;
import java.util.List;

/**
 * Comma separated values following RFC 4180, one record per row, {@code \n} line endings.
 * <p>
 * A field is enclosed in double quotes when it contains the delimiter, a quote, a line break or
 * starts with a space; quotes inside are doubled.
 */
public final class CsvDumper implements Dumper {

    private final Appendable out;
    private final char delimiter;
    private final boolean omitHeader;

    public CsvDumper(Appendable out) {
        this(out, ',', false);
    }

    public CsvDumper(Appendable out, char delimiter, boolean omitHeader) {
        if (out == null) {
            throw new IllegalArgumentException("out required");
        }
        if (delimiter == '"' || delimiter == '\r' || delimiter == '\n') {
            throw new IllegalArgumentException("Invalid delimiter: " + delimiter);
        }
        this.out = out;
        this.delimiter = delimiter;
        this.omitHeader = omitHeader;
    }

    @Override
    public void dump(Extractor<?> extractor, Format format) throws IOException {
        CellFormatter formatter = new CellFormatter(format);
        List<Column> columns = List.copyOf(extractor.columns());
        if (!omitHeader) {
            for (int c = 0; c < columns.size(); c++) {
                writeField(c, columns.get(c).name());
            }
            out.append('\n');
        }
        for (int row = 0; row < extractor.rowCount(); row++) {
            for (int c = 0; c < columns.size(); c++) {
                writeField(c, formatter.format(columns.get(c).valueAt(row)));
            }
            out.append('\n');
        }
    }

    private void writeField(int index, String field) throws IOException {
        if (index > 0) {
            out.append(delimiter);
        }
        if (!needsQuotes(field)) {
            out.append(field);
            return;
        }
        out.append('"');
        for (int i = 0; i < field.length(); i++) {
            char c = field.charAt(i);
            if (c == '"') {
                out.append('"');
            }
            out.append(c);
        }
        out.append('"');
    }

    private boolean needsQuotes(String field) {
        if (field.isEmpty()) {
            return false;
        }
        if (field.charAt(0) == ' ') {
            return true;
        }
        for (int i = 0; i < field.length(); i++) {
            char c = field.charAt(i);
            if (c == delimiter || c == '"' || c == '\n' || c == '\r') {
                return true;
            }
        }
        return false;
    }
}

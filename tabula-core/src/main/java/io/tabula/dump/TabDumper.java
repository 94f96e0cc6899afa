package io.tabula.dump;

import io.tabula.extract.Column;
import io.tabula.extract.Extractor;
import io.tabula.format.CellFormatter;
import io.tabula.format.Format;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Aligned plain text table.
 * <p>
 * Every column but the last is padded to its widest entry plus one space. All rows are formatted
 * before anything is written.
 */
public final class TabDumper implements Dumper {

    private final Appendable out;
    private final boolean omitHeader;

    public TabDumper(Appendable out) {
        this(out, false);
    }

    public TabDumper(Appendable out, boolean omitHeader) {
        if (out == null) {
            throw new IllegalArgumentException("out required");
        }
        this.out = out;
        this.omitHeader = omitHeader;
    }

    @Override
    public void dump(Extractor<?> extractor, Format format) throws IOException {
        CellFormatter formatter = new CellFormatter(format);
        List<Column> columns = List.copyOf(extractor.columns());
        if (columns.isEmpty()) {
            return;
        }

        List<String[]> lines = new ArrayList<>(extractor.rowCount() + 1);
        if (!omitHeader) {
            String[] header = new String[columns.size()];
            for (int c = 0; c < header.length; c++) {
                header[c] = columns.get(c).name();
            }
            lines.add(header);
        }
        for (int row = 0; row < extractor.rowCount(); row++) {
            String[] line = new String[columns.size()];
            for (int c = 0; c < line.length; c++) {
                line[c] = formatter.format(columns.get(c).valueAt(row));
            }
            lines.add(line);
        }

        int[] widths = new int[columns.size()];
        for (String[] line : lines) {
            for (int c = 0; c < line.length; c++) {
                widths[c] = Math.max(widths[c], width(line[c]));
            }
        }

        for (String[] line : lines) {
            int last = line.length - 1;
            for (int c = 0; c < last; c++) {
                out.append(line[c]);
                pad(widths[c] - width(line[c]) + 1);
            }
            out.append(line[last]).append('\n');
        }
    }

    private void pad(int count) throws IOException {
        for (int i = 0; i < count; i++) {
            out.append(' ');
        }
    }

    private static int width(String text) {
        return text.codePointCount(0, text.length());
    }
}

package io.tabula.dump;

import io.tabula.extract.Extractor;
import io.tabula.format.Format;

import java.io.IOException;

/**
 * Writes the rows of an extractor somewhere, one output format per implementation.
 * <p>
 * Rows are written in index order, columns in the order of {@link Extractor#columns()}, using each
 * column's current name. Dumpers do not close or flush the target they write to.
 */
public interface Dumper {

    /**
     * Dump every row of {@code extractor}.
     *
     * @param extractor a bound extractor
     * @param format    how cells become text
     * @throws IOException if writing to the target fails
     */
    void dump(Extractor<?> extractor, Format format) throws IOException;
}

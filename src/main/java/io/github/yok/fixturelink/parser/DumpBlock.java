package io.github.yok.fixturelink.parser;

import com.google.common.collect.ImmutableList;
import java.util.Iterator;
import java.util.List;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * One bulk-copy block of the dump: the table it belongs to, its declared column order, and a lazy
 * iterator over its data rows.
 *
 * <p>
 * Rows are read from the underlying stream on demand; each row holds one cell per column, parallel
 * to {@link #getColumns()} (fewer under the lenient row-length policy). The row iterator is only
 * valid until the parser moves on to the next block.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PACKAGE)
public class DumpBlock {

    // Legacy table name (last dot-separated segment of the qualified name)
    private final String table;

    private final ImmutableList<String> columns;

    // One-based line number of the header
    private final int headerLine;

    @Getter(AccessLevel.NONE)
    private final Iterator<List<String>> rows;

    /**
     * Returns the lazy iterator over this block's rows.
     *
     * @return row iterator; each element is an immutable list of cells
     */
    public Iterator<List<String>> rows() {
        return rows;
    }
}

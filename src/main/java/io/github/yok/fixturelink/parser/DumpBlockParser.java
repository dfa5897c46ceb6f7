package io.github.yok.fixturelink.parser;

import com.google.common.collect.ImmutableList;
import io.github.yok.fixturelink.config.ExtractConfig;
import io.github.yok.fixturelink.config.RowLengthPolicy;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Streaming reader for the bulk-copy sections of a PostgreSQL text dump.
 *
 * <p>
 * A block starts at a line beginning with the configured copy prefix, for example:
 * </p>
 *
 * <pre>
 * COPY public._core_team (id, name, initial_seed, origin_id) FROM stdin;
 * 1	Alpha	3	7
 * 2	Beta	\N	7
 * \.
 * </pre>
 *
 * <p>
 * Every following line is a tab-separated data row until the terminator line. Lines outside a
 * block (DDL, comments, SET statements, ...) are skipped. The dump is read in a single forward
 * pass; rows are only materialized one at a time.
 * </p>
 *
 * <p>
 * <strong>Error handling:</strong>
 * </p>
 * <ul>
 * <li>End of input inside a block → {@link MalformedDumpException} (truncated dump).</li>
 * <li>Header without a parenthesized column list → {@link MalformedDumpException}.</li>
 * <li>Row with a different number of cells than columns → {@link MalformedDumpException} under
 * {@link RowLengthPolicy#STRICT}; paired up to the shorter length under
 * {@link RowLengthPolicy#LENIENT}.</li>
 * <li>Read failures are rethrown as {@link UncheckedIOException}.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class DumpBlockParser {

    private final ExtractConfig config;

    /**
     * Creates a parser.
     *
     * @param config dump recognition settings
     */
    public DumpBlockParser(ExtractConfig config) {
        this.config = config;
    }

    /**
     * Returns a lazy iterator over the blocks of the dump.
     *
     * <p>
     * Advancing to the next block skips any rows of the current block that were not consumed. The
     * caller owns {@code reader} and must close it.
     * </p>
     *
     * @param reader dump text
     * @return block iterator
     */
    public Iterator<DumpBlock> parse(BufferedReader reader) {
        return new BlockIterator(reader);
    }

    /**
     * Parses a block header line into its table name and column list.
     *
     * @param line header line
     * @param lineNumber one-based line number
     * @return array of [table, column list text]
     */
    String[] parseHeader(String line, int lineNumber) {
        String header = line.trim();
        String[] parts = StringUtils.split(header);
        if (parts.length < 2) {
            throw new MalformedDumpException(null, lineNumber,
                    "copy header has no table name: " + header);
        }
        String qualified = StringUtils.substringBefore(parts[1], "(");
        String table = unquote(qualified.contains(".")
                ? StringUtils.substringAfterLast(qualified, ".")
                : qualified);
        int open = header.indexOf('(');
        int close = open < 0 ? -1 : header.indexOf(')', open);
        if (open < 0 || close < 0) {
            throw new MalformedDumpException(table, lineNumber,
                    "copy header has no column list: " + header);
        }
        return new String[] {table, header.substring(open + 1, close)};
    }

    private static String unquote(String identifier) {
        return StringUtils.strip(identifier.trim(), "\"");
    }

    private boolean isTerminator(String line) {
        return config.getTerminator().equals(line.trim());
    }

    private String readLine(BufferedReader reader) {
        try {
            return reader.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read dump", e);
        }
    }

    /**
     * Iterates over blocks, keeping track of the current line number.
     */
    private final class BlockIterator implements Iterator<DumpBlock> {

        private final BufferedReader reader;
        private int lineNumber;
        private RowIterator current;
        private DumpBlock next;
        private boolean exhausted;

        BlockIterator(BufferedReader reader) {
            this.reader = reader;
        }

        @Override
        public boolean hasNext() {
            if (next != null) {
                return true;
            }
            if (exhausted) {
                return false;
            }
            if (current != null) {
                current.skipRemaining();
                current = null;
            }
            String line;
            while ((line = nextLine()) != null) {
                if (line.startsWith(config.getCopyPrefix())) {
                    next = openBlock(line);
                    return true;
                }
            }
            exhausted = true;
            return false;
        }

        @Override
        public DumpBlock next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            DumpBlock block = next;
            next = null;
            return block;
        }

        private DumpBlock openBlock(String line) {
            String[] header = parseHeader(line, lineNumber);
            String table = header[0];
            ImmutableList<String> columns = Arrays.stream(header[1].split(","))
                    .map(DumpBlockParser::unquote).filter(StringUtils::isNotEmpty)
                    .collect(ImmutableList.toImmutableList());
            if (columns.isEmpty()) {
                throw new MalformedDumpException(table, lineNumber, "copy header lists no columns");
            }
            log.debug("Block started: table={}, columns={}, line={}", table, columns, lineNumber);
            current = new RowIterator(this, table, columns);
            return new DumpBlock(table, columns, lineNumber, current);
        }

        String nextLine() {
            String line = readLine(reader);
            if (line != null) {
                lineNumber++;
            }
            return line;
        }
    }

    /**
     * Iterates over the rows of one block.
     */
    private final class RowIterator implements Iterator<List<String>> {

        private final BlockIterator owner;
        private final String table;
        private final ImmutableList<String> columns;
        private List<String> pending;
        private boolean finished;
        private int rowCount;

        RowIterator(BlockIterator owner, String table, ImmutableList<String> columns) {
            this.owner = owner;
            this.table = table;
            this.columns = columns;
        }

        @Override
        public boolean hasNext() {
            if (pending != null) {
                return true;
            }
            if (finished) {
                return false;
            }
            String line = readDataLine();
            if (line == null) {
                return false;
            }
            pending = split(line);
            return true;
        }

        @Override
        public List<String> next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            List<String> row = pending;
            pending = null;
            return row;
        }

        void skipRemaining() {
            pending = null;
            int skipped = 0;
            while (readDataLine() != null) {
                skipped++;
            }
            if (skipped > 0) {
                log.debug("Table[{}] skipped {} unread rows", table, skipped);
            }
        }

        // Returns the next data line, or null once the terminator has been consumed
        private String readDataLine() {
            if (finished) {
                return null;
            }
            String line = owner.nextLine();
            if (line == null) {
                throw new MalformedDumpException(table, owner.lineNumber,
                        "end of input before block terminator '" + config.getTerminator()
                                + "' (" + rowCount + " rows read)");
            }
            if (isTerminator(line)) {
                finished = true;
                log.debug("Block finished: table={}, rows={}", table, rowCount);
                return null;
            }
            rowCount++;
            return line;
        }

        private List<String> split(String line) {
            String[] cells = StringUtils.removeEnd(line, "\r").split("\t", -1);
            for (int i = 0; i < cells.length; i++) {
                if (cells[i].equals(config.getNullMarker())) {
                    cells[i] = "";
                }
            }
            if (cells.length != columns.size()) {
                if (config.getRowLengthPolicy() == RowLengthPolicy.STRICT) {
                    throw new MalformedDumpException(table, owner.lineNumber, "expected "
                            + columns.size() + " cells but found " + cells.length);
                }
                log.debug("Table[{}] line {} has {} cells for {} columns; pairing leniently",
                        table, owner.lineNumber, cells.length, columns.size());
                return ImmutableList.copyOf(cells).subList(0,
                        Math.min(cells.length, columns.size()));
            }
            return ImmutableList.copyOf(cells);
        }
    }
}

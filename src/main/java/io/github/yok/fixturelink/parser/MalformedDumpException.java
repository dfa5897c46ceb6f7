package io.github.yok.fixturelink.parser;

import lombok.Getter;

/**
 * Thrown when the dump text cannot be read as a sequence of well-formed bulk-copy blocks.
 *
 * <p>
 * Covers truncated blocks (end of input before the terminator), headers without a column list,
 * rows whose cell count does not match the column count under
 * {@link io.github.yok.fixturelink.config.RowLengthPolicy#STRICT}, and primary keys that are not
 * integers. The message always names the table and, where known, the one-based line number.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class MalformedDumpException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    // Legacy table the error belongs to (null if the header itself could not be read)
    private final String table;

    // One-based line number in the dump, or -1 when not known
    private final int lineNumber;

    /**
     * Creates the exception.
     *
     * @param table legacy table name, may be {@code null}
     * @param lineNumber one-based line number, or {@code -1}
     * @param detail description of the problem
     */
    public MalformedDumpException(String table, int lineNumber, String detail) {
        super(format(table, lineNumber, detail));
        this.table = table;
        this.lineNumber = lineNumber;
    }

    private static String format(String table, int lineNumber, String detail) {
        StringBuilder sb = new StringBuilder("Malformed dump");
        if (table != null) {
            sb.append(" in table [").append(table).append(']');
        }
        if (lineNumber > 0) {
            sb.append(" at line ").append(lineNumber);
        }
        return sb.append(": ").append(detail).toString();
    }
}

package io.github.yok.fixturelink.core;

import lombok.Getter;

/**
 * Thrown when a legacy table or column has no schema mapping and the configured
 * {@link io.github.yok.fixturelink.config.UnmappedPolicy} is {@code FAIL}.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class UnmappedSchemaException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String table;

    // null when the whole table is unmapped
    private final String column;

    /**
     * Creates the exception.
     *
     * @param table legacy table name
     * @param column legacy column name, or {@code null} for an unmapped table
     */
    public UnmappedSchemaException(String table, String column) {
        super(column == null ? "No schema mapping for table [" + table + "]"
                : "No schema mapping for column [" + column + "] of table [" + table + "]");
        this.table = table;
        this.column = column;
    }
}

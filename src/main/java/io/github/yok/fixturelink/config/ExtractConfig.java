package io.github.yok.fixturelink.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that binds the {@code extract} section in {@code application.yml}.
 *
 * <p>
 * Controls how the dump file is recognized and how rows that do not fit the schema mapping are
 * treated.
 * </p>
 *
 * <pre>
 * extract:
 *   copy-prefix: "COPY "
 *   terminator: "\\."
 *   null-marker: "\\N"
 *   row-length-policy: STRICT
 *   unmapped-tables: DROP_SILENTLY
 *   unmapped-columns: DROP_SILENTLY
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "extract")
@Data
public class ExtractConfig {

    /**
     * Prefix of the line that opens a bulk-copy block.
     */
    private String copyPrefix = "COPY ";

    /**
     * Line that closes a bulk-copy block.
     */
    private String terminator = "\\.";

    /**
     * Cell value the dump uses for SQL NULL. Treated the same as an empty cell.
     */
    private String nullMarker = "\\N";

    /**
     * Behavior for rows whose cell count differs from the column count.
     */
    private RowLengthPolicy rowLengthPolicy = RowLengthPolicy.STRICT;

    /**
     * Behavior for blocks whose table has no schema mapping.
     */
    private UnmappedPolicy unmappedTables = UnmappedPolicy.DROP_SILENTLY;

    /**
     * Behavior for columns that have no entry in their table's rename dictionary.
     */
    private UnmappedPolicy unmappedColumns = UnmappedPolicy.DROP_SILENTLY;
}

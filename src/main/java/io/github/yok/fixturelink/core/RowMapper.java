package io.github.yok.fixturelink.core;

import io.github.yok.fixturelink.config.ExtractConfig;
import io.github.yok.fixturelink.config.SchemaMapping;
import io.github.yok.fixturelink.config.TableMapping;
import io.github.yok.fixturelink.config.UnmappedPolicy;
import io.github.yok.fixturelink.parser.MalformedDumpException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Translates one legacy dump row into a {@link FixtureRecord}.
 *
 * <p>
 * The row's cells are paired with the block's columns; the {@code id} cell becomes the primary
 * key and every column of the table's rename dictionary becomes a target field coerced by
 * {@link ValueCoercer}. Empty cells produce no field at all.
 * </p>
 *
 * <p>
 * Tables and columns missing from the {@link SchemaMapping} are handled according to the
 * {@link UnmappedPolicy} set in {@link ExtractConfig}, and always counted in the
 * {@link ExtractionReport}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class RowMapper {

    private final SchemaMapping mapping;
    private final ValueCoercer coercer;
    private final ExtractConfig config;
    private final ExtractionReport report;

    /**
     * Creates a mapper.
     *
     * @param mapping legacy-to-target schema mapping
     * @param coercer value coercer
     * @param config unmapped table/column policies
     * @param report report receiving drop counters
     */
    public RowMapper(SchemaMapping mapping, ValueCoercer coercer, ExtractConfig config,
            ExtractionReport report) {
        this.mapping = mapping;
        this.coercer = coercer;
        this.config = config;
        this.report = report;
    }

    /**
     * Maps a row.
     *
     * @param table legacy table name
     * @param columns legacy column names of the block
     * @param cells raw cells of the row, parallel to {@code columns}
     * @return the record, or empty if the table is not mapped
     * @throws UnmappedSchemaException if an unmapped table or column is met under
     *         {@link UnmappedPolicy#FAIL}
     * @throws MalformedDumpException if the {@code id} cell is not an integer
     */
    public Optional<FixtureRecord> mapRow(String table, List<String> columns, List<String> cells) {
        return mapRow(table, columns, cells, -1);
    }

    /**
     * Maps a row read from a known dump line.
     *
     * @param table legacy table name
     * @param columns legacy column names of the block
     * @param cells raw cells of the row, parallel to {@code columns}
     * @param lineNumber one-based dump line of the row, or {@code -1}
     * @return the record, or empty if the table is not mapped
     * @throws UnmappedSchemaException if an unmapped table or column is met under
     *         {@link UnmappedPolicy#FAIL}
     * @throws MalformedDumpException if the {@code id} cell is not an integer
     */
    public Optional<FixtureRecord> mapRow(String table, List<String> columns, List<String> cells,
            int lineNumber) {
        Optional<TableMapping> tableMapping = mapping.find(table);
        if (tableMapping.isEmpty()) {
            unmappedTable(table);
            return Optional.empty();
        }
        TableMapping tm = tableMapping.get();

        // Pair columns with cells up to the shorter list
        Map<String, String> data = new LinkedHashMap<>();
        int n = Math.min(columns.size(), cells.size());
        for (int i = 0; i < n; i++) {
            data.put(columns.get(i), cells.get(i));
        }

        for (String column : data.keySet()) {
            if (!TableMapping.PRIMARY_KEY_COLUMN.equals(column)
                    && !tm.getColumns().containsKey(column)) {
                unmappedColumn(table, column);
            }
        }

        Map<String, Object> fields = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : tm.getColumns().entrySet()) {
            String raw = data.get(e.getKey());
            if (StringUtils.isEmpty(raw)) {
                continue;
            }
            fields.put(e.getValue(), coercer.coerce(e.getValue(), raw));
        }
        Number pk = primaryKey(table, lineNumber, data.get(TableMapping.PRIMARY_KEY_COLUMN));
        return Optional.of(new FixtureRecord(tm.getEntity(), pk, fields));
    }

    private Number primaryKey(String table, int lineNumber, String raw) {
        if (StringUtils.isEmpty(raw)) {
            return null;
        }
        return ValueCoercer.toInteger(raw.trim()).orElseThrow(() -> new MalformedDumpException(
                table, lineNumber, "primary key is not an integer: " + raw));
    }

    private void unmappedTable(String table) {
        boolean first = report.tableDropped(table);
        switch (config.getUnmappedTables()) {
            case FAIL:
                throw new UnmappedSchemaException(table, null);
            case DROP_WITH_WARNING:
                if (first) {
                    log.warn("Table[{}] has no schema mapping; its rows are dropped", table);
                }
                break;
            default:
                break;
        }
    }

    private void unmappedColumn(String table, String column) {
        boolean first = report.columnDropped(table, column);
        switch (config.getUnmappedColumns()) {
            case FAIL:
                throw new UnmappedSchemaException(table, column);
            case DROP_WITH_WARNING:
                if (first) {
                    log.warn("Table[{}] Column[{}] has no schema mapping; its values are dropped",
                            table, column);
                }
                break;
            default:
                break;
        }
    }
}

package io.github.yok.fixturelink.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Counters collected during one extraction run.
 *
 * <p>
 * Keeps rows dropped because their table is unmapped apart from columns dropped because they have
 * no rename entry, so that operators can tell intentional schema filtering from other losses.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Getter
public class ExtractionReport {

    private int blockCount;

    private int rowCount;

    // entity → records written
    private Map<String, Integer> recordsPerEntity = new LinkedHashMap<>();

    // legacy table → rows dropped
    private final Map<String, Integer> droppedTables = new LinkedHashMap<>();

    // "table.column" → rows in which the column was dropped
    private final Map<String, Integer> droppedColumns = new LinkedHashMap<>();

    void blockRead() {
        blockCount++;
    }

    void rowRead() {
        rowCount++;
    }

    /**
     * Counts a row dropped because its table is unmapped.
     *
     * @param table legacy table
     * @return {@code true} the first time the table is seen
     */
    boolean tableDropped(String table) {
        return droppedTables.merge(table, 1, Integer::sum) == 1;
    }

    /**
     * Counts a column value dropped because the column is unmapped.
     *
     * @param table legacy table
     * @param column legacy column
     * @return {@code true} the first time the table/column pair is seen
     */
    boolean columnDropped(String table, String column) {
        return droppedColumns.merge(table + "." + column, 1, Integer::sum) == 1;
    }

    void setRecordsPerEntity(Map<String, Integer> recordsPerEntity) {
        this.recordsPerEntity = new LinkedHashMap<>(recordsPerEntity);
    }

    /**
     * Returns the number of records written over all entities.
     *
     * @return record count
     */
    public int getRecordCount() {
        return recordsPerEntity.values().stream().mapToInt(Integer::intValue).sum();
    }

    /**
     * Returns the rows dropped per unmapped table.
     *
     * @return unmodifiable map
     */
    public Map<String, Integer> getDroppedTables() {
        return Collections.unmodifiableMap(droppedTables);
    }

    /**
     * Returns the dropped values per {@code table.column}.
     *
     * @return unmodifiable map
     */
    public Map<String, Integer> getDroppedColumns() {
        return Collections.unmodifiableMap(droppedColumns);
    }

    /**
     * Logs the run summary.
     */
    public void logSummary() {
        log.info("===== Extraction summary: blocks={}, rows={}, records={} =====", blockCount,
                rowCount, getRecordCount());
        recordsPerEntity.forEach((entity, count) -> log.info("  Entity[{}] records={}", entity,
                count));
        droppedTables.forEach((table, count) -> log.info("  Unmapped table [{}] rows dropped={}",
                table, count));
        droppedColumns.forEach((column, count) -> log
                .info("  Unmapped column [{}] values dropped={}", column, count));
    }
}

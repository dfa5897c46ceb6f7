package io.github.yok.fixturelink.config;

/**
 * Decides what happens when a dump row does not have exactly one cell per declared column.
 *
 * <ul>
 * <li>{@code STRICT}: the row is rejected and the extraction run aborts</li>
 * <li>{@code LENIENT}: cells and columns are paired up to the shorter of the two; surplus cells are
 * discarded and columns without a cell are treated as absent</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public enum RowLengthPolicy {
    // Reject rows whose cell count differs from the column count
    STRICT,
    // Pair cells with columns up to the shorter length (legacy behavior)
    LENIENT
}

package io.github.yok.fixturelink.config;

/**
 * Filtering policy applied to legacy tables and columns that have no entry in the
 * {@link SchemaMapping}.
 *
 * <ul>
 * <li>{@code DROP_SILENTLY}: drop and only count them in the extraction report</li>
 * <li>{@code DROP_WITH_WARNING}: drop and log a warning the first time each name is seen</li>
 * <li>{@code FAIL}: abort the extraction run</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public enum UnmappedPolicy {
    // Drop without logging (legacy behavior)
    DROP_SILENTLY,
    // Drop and warn once per table or column
    DROP_WITH_WARNING,
    // Raise an UnmappedSchemaException
    FAIL
}

package io.github.yok.fixturelink.fixer;

import io.github.yok.fixturelink.core.FixtureRecord;

/**
 * Entity-specific repair rule applied after the generic normalization pass.
 *
 * <p>
 * Implementations must be idempotent: applying a fixer to its own output changes nothing. They
 * may rename or add fields but never lose a value that is already present.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface FixtureFixer {

    /**
     * Returns the entity whose records this fixer repairs.
     *
     * @return entity name, e.g. {@code authman.user}
     */
    String entity();

    /**
     * Repairs one record of {@link #entity()} in place.
     *
     * @param record record to repair
     * @return {@code true} if the record was changed
     */
    boolean apply(FixtureRecord record);
}

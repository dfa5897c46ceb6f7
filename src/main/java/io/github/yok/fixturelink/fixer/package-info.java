/**
 * Entity-specific fixture repairs.
 *
 * <p>
 * Each {@link io.github.yok.fixturelink.fixer.FixtureFixer} handles one legacy quirk of a single
 * entity and is run by {@link io.github.yok.fixturelink.fixer.FixerRunner} after the generic
 * normalization pass.
 * </p>
 */
package io.github.yok.fixturelink.fixer;

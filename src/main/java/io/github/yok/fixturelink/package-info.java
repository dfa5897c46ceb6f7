/**
 * Root package of FixtureLink.
 *
 * <p>
 * Provides a CLI that converts a legacy PostgreSQL text dump into JSON fixture files, one per
 * target entity, and repairs those files in place.
 * </p>
 *
 * <p>
 * Main responsibilities are separated into the following subpackages:
 * </p>
 *
 * <ul>
 * <li>{@code io.github.yok.fixturelink.config}: configuration models and the schema mapping</li>
 * <li>{@code io.github.yok.fixturelink.parser}: dump block parsing</li>
 * <li>{@code io.github.yok.fixturelink.core}: extraction, normalization and seed bundling</li>
 * <li>{@code io.github.yok.fixturelink.fixer}: entity-specific repairs</li>
 * <li>{@code io.github.yok.fixturelink.util}: fixture file I/O and error reporting</li>
 * </ul>
 */
package io.github.yok.fixturelink;

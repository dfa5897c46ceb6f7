/**
 * Configuration model package for FixtureLink.
 *
 * <p>
 * Defines classes that represent values loaded from {@code application.yml} (or equivalent
 * sources), such as the data path, dump recognition rules, coercion rules, normalization and fixer
 * settings, and the legacy-to-target schema mapping.
 * </p>
 *
 * <p>
 * This package primarily holds configuration data; execution logic is implemented in {@code core},
 * {@code parser} and {@code fixer}.
 * </p>
 */
package io.github.yok.fixturelink.config;

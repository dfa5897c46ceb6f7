/**
 * Core extraction and repair workflow package.
 *
 * <p>
 * Turns the blocks read by {@code parser} into fixture records (schema mapping and value
 * coercion), writes them as one fixture file per entity, and repairs existing fixture files
 * through an idempotent normalization pass. Also bundles all fixtures into one seed document.
 * </p>
 *
 * <p>
 * Entity-specific repairs are delegated to the fixers in {@code fixer}.
 * </p>
 */
package io.github.yok.fixturelink.core;

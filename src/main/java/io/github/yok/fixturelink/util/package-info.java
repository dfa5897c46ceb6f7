/**
 * Utility package for FixtureLink.
 *
 * <p>
 * Provides reusable helpers used across the project: fixture file I/O with backups and atomic
 * replacement, boolean literal recognition, and fatal error reporting.
 * </p>
 */
package io.github.yok.fixturelink.util;

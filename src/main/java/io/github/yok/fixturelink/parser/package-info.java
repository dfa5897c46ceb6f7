/**
 * Dump parsing package.
 *
 * <p>
 * Reads the bulk-copy ({@code COPY ... FROM stdin;}) sections of a PostgreSQL text dump as a lazy
 * sequence of {@link io.github.yok.fixturelink.parser.DumpBlock}s. Schema translation and type
 * coercion are done in {@code core}.
 * </p>
 */
package io.github.yok.fixturelink.parser;

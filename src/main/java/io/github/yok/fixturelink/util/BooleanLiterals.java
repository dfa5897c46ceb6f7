package io.github.yok.fixturelink.util;

import com.google.common.collect.ImmutableSet;
import java.util.Locale;
import java.util.Optional;

/**
 * Recognizes the textual boolean encodings found in legacy dumps and fixtures.
 *
 * <p>
 * {@code 1}, {@code t} and {@code true} mean true; {@code 0}, {@code f} and {@code false} mean
 * false. Matching is case-insensitive ({@code True}, {@code TRUE} are accepted). Anything else is
 * not a boolean literal.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class BooleanLiterals {

    private static final ImmutableSet<String> TRUE_LITERALS = ImmutableSet.of("1", "t", "true");

    private static final ImmutableSet<String> FALSE_LITERALS = ImmutableSet.of("0", "f", "false");

    private BooleanLiterals() {
        // Utility class; do not instantiate.
    }

    /**
     * Parses a boolean literal.
     *
     * @param text raw text, may be {@code null}
     * @return the boolean value, or empty if {@code text} is not a boolean literal
     */
    public static Optional<Boolean> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String key = text.trim().toLowerCase(Locale.ROOT);
        if (TRUE_LITERALS.contains(key)) {
            return Optional.of(Boolean.TRUE);
        }
        if (FALSE_LITERALS.contains(key)) {
            return Optional.of(Boolean.FALSE);
        }
        return Optional.empty();
    }

    /**
     * Returns whether a field value means "true": a {@link Boolean} {@code true}, a true literal
     * string, or the number 1.
     *
     * @param value field value, may be {@code null}
     * @return {@code true} if the value means true
     */
    public static boolean isTrue(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return parse((String) value).orElse(Boolean.FALSE);
        }
        if (value instanceof Number) {
            return ((Number) value).longValue() == 1L;
        }
        return false;
    }
}

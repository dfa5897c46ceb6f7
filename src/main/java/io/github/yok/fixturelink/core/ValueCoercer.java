package io.github.yok.fixturelink.core;

import io.github.yok.fixturelink.config.CoercionConfig;
import io.github.yok.fixturelink.util.BooleanLiterals;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Converts a raw dump cell into the canonical type of its target field.
 *
 * <p>
 * The rules are selected by target field name through {@link CoercionConfig}:
 * </p>
 * <ul>
 * <li>measurement fields → integer; the raw string is kept if it is not an integer</li>
 * <li>relation fields (suffix {@code _id} or listed) → integer only when the raw value is all
 * decimal digits; otherwise the raw string is kept</li>
 * <li>boolean fields → {@link Boolean} when the raw value is a boolean literal; otherwise the raw
 * string is kept</li>
 * <li>any other field → the raw string</li>
 * </ul>
 *
 * <p>
 * Coercion never throws. Integers that do not fit in an {@code int} are returned as {@code Long}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ValueCoercer {

    private final CoercionConfig config;

    /**
     * Creates a coercer.
     *
     * @param config field-name rules
     */
    public ValueCoercer(CoercionConfig config) {
        this.config = config;
    }

    /**
     * Coerces a non-empty raw value.
     *
     * @param field target field name
     * @param raw raw cell text
     * @return {@link Integer}, {@link Long}, {@link Boolean} or the raw {@link String}
     */
    public Object coerce(String field, String raw) {
        if (config.isNumericField(field)) {
            Optional<Number> number = toInteger(raw.trim());
            if (number.isEmpty()) {
                log.debug("Field[{}] value [{}] is not an integer; kept as string", field, raw);
                return raw;
            }
            return number.get();
        }
        if (config.isRelationField(field)) {
            if (!StringUtils.isNumeric(raw)) {
                log.debug("Field[{}] relation value [{}] is not numeric; kept as string", field,
                        raw);
                return raw;
            }
            return toInteger(raw).<Object>map(n -> n).orElse(raw);
        }
        if (config.isBooleanField(field)) {
            return BooleanLiterals.parse(raw).<Object>map(b -> b).orElse(raw);
        }
        return raw;
    }

    /**
     * Parses an integer, narrowing to {@link Integer} when the value fits.
     *
     * @param text text to parse
     * @return the number, or empty if {@code text} is not an integer within the {@code long} range
     */
    static Optional<Number> toInteger(String text) {
        try {
            long value = Long.parseLong(text);
            if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
                return Optional.of((int) value);
            }
            return Optional.of(value);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}

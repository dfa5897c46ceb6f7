package io.github.yok.fixturelink.config;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that holds the field-name rules used to coerce raw dump values.
 *
 * <p>
 * You can specify the following properties in {@code application.yml} or
 * {@code application.properties}.
 * </p>
 * <ul>
 * <li>{@code coercion.numericFields}: target fields holding measurements (capacities, seeds,
 * scores, counts)</li>
 * <li>{@code coercion.relationFields}: target fields holding foreign keys without an {@code _id}
 * suffix</li>
 * <li>{@code coercion.relationSuffix}: suffix that marks any other foreign-key field</li>
 * <li>{@code coercion.booleanFields}: target fields holding flags</li>
 * </ul>
 *
 * <p>
 * Field names are compared against <em>target</em> names, i.e. after the schema mapping has
 * renamed the legacy column.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "coercion")
@Getter
@Setter
@NoArgsConstructor
public class CoercionConfig {

    private List<String> numericFields = ImmutableList.of("capacity", "initial_seed",
            "team1_score", "team2_score", "goals", "assists");

    private List<String> relationFields = ImmutableList.of("team", "game", "player", "pool",
            "field", "team1", "team2", "scored_by", "mvp_female_nomination",
            "mvp_male_nomination", "spirit_female_nomination", "spirit_male_nomination");

    private String relationSuffix = "_id";

    private List<String> booleanFields = ImmutableList.of("is_superuser", "is_staff", "is_active");

    /**
     * Returns whether the target field holds an integer measurement.
     *
     * @param field target field name
     * @return {@code true} if listed in {@code numericFields}
     */
    public boolean isNumericField(String field) {
        return numericFields.contains(field);
    }

    /**
     * Returns whether the target field holds a foreign key.
     *
     * @param field target field name
     * @return {@code true} if the name ends with {@code relationSuffix} or is listed in
     *         {@code relationFields}
     */
    public boolean isRelationField(String field) {
        return (StringUtils.isNotEmpty(relationSuffix) && field.endsWith(relationSuffix))
                || relationFields.contains(field);
    }

    /**
     * Returns whether the target field holds a flag.
     *
     * @param field target field name
     * @return {@code true} if listed in {@code booleanFields}
     */
    public boolean isBooleanField(String field) {
        return booleanFields.contains(field);
    }
}

package io.github.yok.fixturelink.config;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Optional;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

/**
 * Mapping of one legacy table: the target entity it feeds and the rename dictionary from legacy
 * column to target field.
 *
 * <p>
 * The legacy {@value #PRIMARY_KEY_COLUMN} column is reserved as the record's primary key and is
 * never part of the rename dictionary.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class TableMapping {

    /**
     * Legacy column that carries the primary key.
     */
    public static final String PRIMARY_KEY_COLUMN = "id";

    String entity;

    // legacy column → target field, in declaration order
    ImmutableMap<String, String> columns;

    /**
     * Creates a table mapping.
     *
     * @param entity target entity name (for example {@code games.team})
     * @param columns rename dictionary; an entry for {@value #PRIMARY_KEY_COLUMN} is ignored
     * @throws IllegalArgumentException if the entity is blank or a column maps to a blank name
     */
    public TableMapping(String entity, Map<String, String> columns) {
        Preconditions.checkArgument(StringUtils.isNotBlank(entity), "entity must not be blank");
        ImmutableMap.Builder<String, String> builder = ImmutableMap.builder();
        for (Map.Entry<String, String> e : columns.entrySet()) {
            if (PRIMARY_KEY_COLUMN.equals(e.getKey())) {
                continue;
            }
            Preconditions.checkArgument(StringUtils.isNotBlank(e.getValue()),
                    "column %s of entity %s maps to a blank field name", e.getKey(), entity);
            builder.put(e.getKey(), e.getValue());
        }
        this.entity = entity;
        this.columns = builder.buildOrThrow();
    }

    /**
     * Returns the target field for a legacy column.
     *
     * @param legacyColumn legacy column name
     * @return the target field name, or empty if the column is not mapped
     */
    public Optional<String> targetField(String legacyColumn) {
        return Optional.ofNullable(columns.get(legacyColumn));
    }
}

package io.github.yok.fixturelink.config;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Immutable mapping from legacy table names to {@link TableMapping}s.
 *
 * <p>
 * Built once at startup and handed to every component that needs it. Instances cannot be changed
 * after construction; use {@link #builder()} to compose a new one.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
@ToString
public final class SchemaMapping {

    private final ImmutableMap<String, TableMapping> tables;

    private SchemaMapping(Map<String, TableMapping> tables) {
        this.tables = ImmutableMap.copyOf(tables);
    }

    /**
     * Looks up the mapping of a legacy table.
     *
     * @param legacyTable legacy table name (case-sensitive)
     * @return the table mapping, or empty if the table is not mapped
     */
    public Optional<TableMapping> find(String legacyTable) {
        return Optional.ofNullable(tables.get(legacyTable));
    }

    /**
     * Returns every target entity name, in table declaration order.
     *
     * @return set of entity names
     */
    public ImmutableSet<String> knownEntities() {
        return tables.values().stream().map(TableMapping::getEntity)
                .collect(ImmutableSet.toImmutableSet());
    }

    /**
     * Returns whether an entity name is produced by one of the mapped tables.
     *
     * @param entity entity name
     * @return {@code true} if known
     */
    public boolean isKnownEntity(String entity) {
        return knownEntities().contains(entity);
    }

    /**
     * Creates an empty builder.
     *
     * @return builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the mapping between the legacy tournament database and the current fixture
     * entities.
     *
     * @return built-in mapping
     */
    public static SchemaMapping legacyDefaults() {
        return builder()
                .table("_core_location", "core.location",
                        columns("name", "name", "address", "address", "city", "city", "country",
                                "country"))
                .table("_core_divisionpool", "games.divisionpool",
                        columns("name", "name", "description", "description"))
                .table("_core_field", "games.field",
                        columns("name", "name", "capacity", "capacity", "surface_type",
                                "surface_type", "location_id", "location"))
                .table("_core_gameround", "games.gameround",
                        columns("name", "name", "start_date", "start_date", "end_date",
                                "end_date"))
                .table("_core_team", "games.team",
                        columns("name", "name", "initial_seed", "initial_seed", "origin_id",
                                "origin"))
                .table("_core_player", "games.player",
                        columns("name", "name", "spirit_award_nominations",
                                "spirit_award_nominations", "mvp_nominations", "mvp_nominations",
                                "team_id", "team", "gender", "gender"))
                .table("_core_game", "games.game",
                        columns("date", "start_time", "home_team_score", "team1_score",
                                "away_team_score", "team2_score", "division_pool_id", "pool",
                                "field_id", "field", "away_team_id", "team2", "home_team_id",
                                "team1", "name", "name", "game_round_id", "game_round"))
                .table("_core_scoring", "games.scoring",
                        columns("goals", "goals", "assists", "assists", "game_id", "game",
                                "player_id", "player"))
                .table("_core_spiritscore", "games.spiritscore",
                        columns("rules_knowledge", "rules_knowledge", "fouls_body_contact",
                                "fouls_body_contact", "fair_mindedness", "fair_mindedness",
                                "attitude", "attitude", "communication", "communication",
                                "game_id", "game", "scored_by_id", "scored_by", "team_id", "team",
                                "mvp_female_nomination_id", "mvp_female_nomination",
                                "mvp_male_nomination_id", "mvp_male_nomination",
                                "spirit_female_nomination_id", "spirit_female_nomination",
                                "spirit_male_nomination_id", "spirit_male_nomination"))
                .table("_authman_user", "authman.user",
                        columns("password", "password", "last_login", "last_login",
                                "is_superuser", "is_superuser", "username", "username",
                                "first_name", "first_name", "last_name", "last_name", "email",
                                "email", "is_staff", "is_staff", "is_active", "is_active",
                                "date_joined", "date_joined", "role", "role", "team_id", "team"))
                .build();
    }

    // Pairs of (legacy column, target field)
    private static Map<String, String> columns(String... pairs) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < pairs.length; i += 2) {
            map.put(pairs[i], pairs[i + 1]);
        }
        return map;
    }

    /**
     * Builder of {@link SchemaMapping}.
     */
    public static final class Builder {

        private final Map<String, TableMapping> tables = new LinkedHashMap<>();

        private Builder() {}

        /**
         * Adds (or replaces) the mapping of a legacy table.
         *
         * @param legacyTable legacy table name
         * @param entity target entity name
         * @param columns rename dictionary from legacy column to target field
         * @return this builder
         */
        public Builder table(String legacyTable, String entity, Map<String, String> columns) {
            tables.put(legacyTable, new TableMapping(entity, columns));
            return this;
        }

        /**
         * Builds the immutable mapping.
         *
         * @return mapping
         */
        public SchemaMapping build() {
            return new SchemaMapping(tables);
        }
    }
}

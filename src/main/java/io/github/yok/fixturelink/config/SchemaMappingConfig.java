package io.github.yok.fixturelink.config;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that binds the {@code schema-mapping} section in {@code application.yml}
 * and turns it into an immutable {@link SchemaMapping}.
 *
 * <p>
 * Typical usage is to bind YAML like:
 * </p>
 *
 * <pre>
 * schema-mapping:
 *   tables:
 *     _core_team:
 *       entity: games.team
 *       columns:
 *         name: name
 *         origin_id: origin
 * </pre>
 *
 * <p>
 * When no table is configured, {@link SchemaMapping#legacyDefaults()} is used.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@ConfigurationProperties(prefix = "schema-mapping")
@Data
public class SchemaMappingConfig {

    /**
     * Map of “legacy table name → table definition”.
     */
    private Map<String, Table> tables = new LinkedHashMap<>();

    /**
     * Builds the immutable schema mapping from the bound properties.
     *
     * @return configured mapping, or the built-in legacy mapping when none is configured
     * @throws IllegalArgumentException if a table definition has no entity
     */
    public SchemaMapping toSchemaMapping() {
        if (tables == null || tables.isEmpty()) {
            log.info("No schema-mapping tables configured; using the built-in legacy mapping");
            return SchemaMapping.legacyDefaults();
        }
        SchemaMapping.Builder builder = SchemaMapping.builder();
        for (Map.Entry<String, Table> e : tables.entrySet()) {
            Table table = e.getValue();
            builder.table(e.getKey(), table.getEntity(), table.getColumns());
        }
        SchemaMapping mapping = builder.build();
        log.info("Loaded schema-mapping for {} legacy tables", mapping.getTables().size());
        return mapping;
    }

    /**
     * Definition of one legacy table.
     */
    @Data
    public static class Table {

        // Target entity name
        private String entity;

        // legacy column → target field
        private Map<String, String> columns = new LinkedHashMap<>();
    }
}

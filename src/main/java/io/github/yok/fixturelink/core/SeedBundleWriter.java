package io.github.yok.fixturelink.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.yok.fixturelink.config.SchemaMapping;
import io.github.yok.fixturelink.util.FixtureFiles;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;

/**
 * Combines all fixture files of a directory into a single seed document.
 *
 * <pre>
 * {
 *   "version": "1.0",
 *   "generated": "2026-10-18T09:00:00Z",
 *   "entities": {
 *     "core.location": [ {"model": ..., "pk": ..., "fields": {...}}, ... ],
 *     ...
 *   }
 * }
 * </pre>
 *
 * <p>
 * Entities appear in schema mapping order, followed by any unknown entities in name order. The
 * bundle file must not be placed inside the fixtures directory.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class SeedBundleWriter {

    /**
     * Version of the bundle layout.
     */
    public static final String VERSION = "1.0";

    private final SchemaMapping mapping;
    private final Clock clock;

    /**
     * Creates a writer that stamps bundles with the current UTC time.
     *
     * @param mapping schema mapping defining the entity order
     */
    public SeedBundleWriter(SchemaMapping mapping) {
        this(mapping, Clock.systemUTC());
    }

    /**
     * Creates a writer with an explicit clock.
     *
     * @param mapping schema mapping defining the entity order
     * @param clock clock used for the {@code generated} stamp
     */
    public SeedBundleWriter(SchemaMapping mapping, Clock clock) {
        this.mapping = mapping;
        this.clock = clock;
    }

    /**
     * Writes the bundle.
     *
     * @param fixturesDir fixtures directory
     * @param bundleFile destination file
     * @return number of records bundled
     * @throws IOException if a fixture cannot be read or the bundle cannot be written
     */
    public int write(Path fixturesDir, Path bundleFile) throws IOException {
        Map<String, List<FixtureRecord>> known = new LinkedHashMap<>();
        for (String entity : mapping.knownEntities()) {
            known.put(entity, new ArrayList<>());
        }
        Map<String, List<FixtureRecord>> unknown = new TreeMap<>();
        Path target = bundleFile.toAbsolutePath().normalize();
        for (Path file : FixtureFiles.list(fixturesDir)) {
            if (file.toAbsolutePath().normalize().equals(target)) {
                continue;
            }
            for (FixtureRecord record : FixtureFiles.read(file)) {
                String entity = record.getEntity() == null ? "" : record.getEntity();
                Map<String, List<FixtureRecord>> group =
                        known.containsKey(entity) ? known : unknown;
                group.computeIfAbsent(entity, k -> new ArrayList<>()).add(record);
            }
        }

        ObjectNode root = FixtureFiles.mapper().createObjectNode();
        root.put("version", VERSION);
        root.put("generated", DateTimeFormatter.ISO_INSTANT
                .format(Instant.now(clock).truncatedTo(ChronoUnit.SECONDS)));
        ObjectNode entities = root.putObject("entities");
        int total = 0;
        for (Map<String, List<FixtureRecord>> group : List.of(known, unknown)) {
            for (Map.Entry<String, List<FixtureRecord>> e : group.entrySet()) {
                if (e.getValue().isEmpty()) {
                    continue;
                }
                ArrayNode array = entities.putArray(e.getKey());
                for (FixtureRecord record : e.getValue()) {
                    JsonNode node = FixtureFiles.mapper().valueToTree(record);
                    array.add(node);
                }
                total += e.getValue().size();
                log.debug("Bundled entity [{}]: {} records", e.getKey(), e.getValue().size());
            }
        }
        FixtureFiles.writeDocument(bundleFile, root);
        log.info("Seed bundle written: {} records of {} entities → {}", total, entities.size(),
                bundleFile);
        return total;
    }
}

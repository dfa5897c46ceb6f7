package io.github.yok.fixturelink.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.yok.fixturelink.config.SchemaMapping;
import io.github.yok.fixturelink.util.FixtureFiles;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SeedBundleWriterTest {

    @TempDir
    Path tempDir;

    private Path fixtures;
    private SeedBundleWriter writer;

    @BeforeEach
    void setUp() throws Exception {
        fixtures = Files.createDirectories(tempDir.resolve("fixtures"));
        Clock clock = Clock.fixed(Instant.parse("2026-10-18T09:00:00.750Z"), ZoneOffset.UTC);
        writer = new SeedBundleWriter(SchemaMapping.legacyDefaults(), clock);
    }

    private void fixture(String entity, int... pks) throws Exception {
        List<FixtureRecord> records = new ArrayList<>();
        for (int pk : pks) {
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("name", entity + "-" + pk);
            records.add(new FixtureRecord(entity, pk, fields));
        }
        FixtureFiles.write(fixtures.resolve(FixtureFiles.fileName(entity)), records);
    }

    private static List<String> names(JsonNode node) {
        List<String> names = new ArrayList<>();
        node.fieldNames().forEachRemaining(names::add);
        return names;
    }

    @Test
    void write_正常ケース_複数エンティティ_マッピング順にまとめられること() throws Exception {
        fixture("games.team", 1, 2);
        fixture("authman.user", 1);
        fixture("core.location", 1);
        Path bundle = tempDir.resolve("seed_bundle.json");

        int total = writer.write(fixtures, bundle);

        assertEquals(4, total);
        JsonNode root = FixtureFiles.mapper().readTree(bundle.toFile());
        assertEquals("1.0", root.get("version").asText());
        assertEquals("2026-10-18T09:00:00Z", root.get("generated").asText());
        JsonNode entities = root.get("entities");
        assertEquals(List.of("core.location", "games.team", "authman.user"), names(entities));
        assertEquals(2, entities.get("games.team").size());
        assertEquals("games.team", entities.get("games.team").get(1).get("model").asText());
        assertEquals(2, entities.get("games.team").get(1).get("pk").asInt());
        assertEquals("games.team-2",
                entities.get("games.team").get(1).get("fields").get("name").asText());
    }

    @Test
    void write_正常ケース_未知のエンティティ_既知の後に名前順で追加されること() throws Exception {
        fixture("zeta.thing", 1);
        fixture("alpha.thing", 1);
        fixture("games.game", 5);
        Path bundle = tempDir.resolve("seed_bundle.json");

        writer.write(fixtures, bundle);

        JsonNode entities = FixtureFiles.mapper().readTree(bundle.toFile()).get("entities");
        assertEquals(List.of("games.game", "alpha.thing", "zeta.thing"), names(entities));
    }

    @Test
    void write_正常ケース_フィクスチャがない_空のentitiesが出力されること() throws Exception {
        Path bundle = tempDir.resolve("seed_bundle.json");

        assertEquals(0, writer.write(tempDir.resolve("missing"), bundle));

        JsonNode root = FixtureFiles.mapper().readTree(bundle.toFile());
        assertTrue(root.get("entities").isEmpty());
    }

    @Test
    void write_正常ケース_出力先がフィクスチャディレクトリ内_自身は読み込まれないこと() throws Exception {
        fixture("games.team", 1);
        Path bundle = fixtures.resolve("seed_bundle.json");

        assertEquals(1, writer.write(fixtures, bundle));
        assertEquals(1, writer.write(fixtures, bundle));

        JsonNode entities = FixtureFiles.mapper().readTree(bundle.toFile()).get("entities");
        assertEquals(List.of("games.team"), names(entities));
        assertFalse(Files.exists(fixtures.resolve("seed_bundle.json.bak")));
    }
}

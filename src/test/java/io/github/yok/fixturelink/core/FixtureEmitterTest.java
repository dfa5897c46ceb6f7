package io.github.yok.fixturelink.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import io.github.yok.fixturelink.util.FixtureFiles;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FixtureEmitterTest {

    @TempDir
    Path tempDir;

    private static FixtureRecord record(String entity, int pk) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("name", entity + pk);
        return new FixtureRecord(entity, pk, fields);
    }

    @Test
    void emit_正常ケース_複数エンティティが混在する_エンティティごとに出現順で書き出されること()
            throws Exception {
        Path out = tempDir.resolve("out");
        Iterator<FixtureRecord> records = List.of(record("games.team", 2),
                record("core.location", 1), record("games.team", 1)).iterator();

        Map<String, Integer> summary = new FixtureEmitter().emit(records, out);

        assertEquals(List.of("games.team", "core.location"), List.copyOf(summary.keySet()));
        assertEquals(2, summary.get("games.team"));
        assertEquals(1, summary.get("core.location"));
        List<FixtureRecord> teams = FixtureFiles.read(out.resolve("games_team.json"));
        assertEquals(2, teams.get(0).getPrimaryKey());
        assertEquals(1, teams.get(1).getPrimaryKey());
        assertEquals("core.location1",
                FixtureFiles.read(out.resolve("core_location.json")).get(0).getFields()
                        .get("name"));
    }

    @Test
    void emit_異常ケース_途中で例外が発生する_ファイルが書き出されないこと() {
        Path out = tempDir.resolve("out");
        Iterator<FixtureRecord> records = new Iterator<FixtureRecord>() {
            private int count;

            @Override
            public boolean hasNext() {
                return true;
            }

            @Override
            public FixtureRecord next() {
                if (count++ == 1) {
                    throw new IllegalStateException("boom");
                }
                return record("games.team", count);
            }
        };
        FixtureEmitter emitter = new FixtureEmitter();

        assertThrows(IllegalStateException.class, () -> emitter.emit(records, out));
        assertFalse(Files.exists(out));
    }
}

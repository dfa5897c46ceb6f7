package io.github.yok.fixturelink.fixer;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.fixturelink.config.FixerConfig;
import io.github.yok.fixturelink.core.FixtureRecord;
import io.github.yok.fixturelink.util.FixtureFiles;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FixerRunnerTest {

    @TempDir
    Path tempDir;

    private static FixtureRecord record(String entity, int pk, Object... pairs) {
        Map<String, Object> fields = new LinkedHashMap<>();
        for (int i = 0; i + 1 < pairs.length; i += 2) {
            fields.put((String) pairs[i], pairs[i + 1]);
        }
        return new FixtureRecord(entity, pk, fields);
    }

    private List<FixtureFixer> defaultFixers() {
        FixerConfig config = new FixerConfig();
        return List.of(new UserGroupFixer(config.getUserGroups()),
                new GameFieldRenameFixer(config.getGameFields()));
    }

    @Test
    void run_正常ケース_ユーザーと試合のファイル_修正されバックアップが作られること() throws Exception {
        Path users = tempDir.resolve("authman_user.json");
        FixtureFiles.write(users, List.of(record("authman.user", 1, "is_superuser", true),
                record("authman.user", 2, "role", "player")));
        Path games = tempDir.resolve("games_game.json");
        FixtureFiles.write(games, List.of(record("games.game", 10, "team1", 1)));
        byte[] originalUsers = Files.readAllBytes(users);

        Map<String, Integer> summary = new FixerRunner(".bak").run(tempDir, defaultFixers());

        assertEquals(Map.of("UserGroupFixer", 1, "GameFieldRenameFixer", 1), summary);
        assertArrayEquals(originalUsers,
                Files.readAllBytes(tempDir.resolve("authman_user.json.bak")));
        List<FixtureRecord> fixedUsers = FixtureFiles.read(users);
        assertEquals(List.of(1), fixedUsers.get(0).getFields().get("groups"));
        assertFalse(fixedUsers.get(1).getFields().containsKey("groups"));
        assertEquals(1, FixtureFiles.read(games).get(0).getFields().get("home_team"));
    }

    @Test
    void run_正常ケース_2回実行する_2回目は変更なしでファイルが同一であること() throws Exception {
        Path users = tempDir.resolve("authman_user.json");
        FixtureFiles.write(users, List.of(record("authman.user", 1, "is_superuser", true)));
        FixerRunner runner = new FixerRunner(".bak");
        runner.run(tempDir, defaultFixers());
        byte[] once = Files.readAllBytes(users);

        Map<String, Integer> summary = runner.run(tempDir, defaultFixers());

        assertEquals(Map.of("UserGroupFixer", 0), summary);
        assertArrayEquals(once, Files.readAllBytes(users));
    }

    @Test
    void run_正常ケース_ファイルが存在しない_スキップされること() throws Exception {
        Map<String, Integer> summary = new FixerRunner(".bak").run(tempDir, defaultFixers());

        assertTrue(summary.isEmpty());
        assertEquals(0, FixtureFiles.list(tempDir).size());
    }

    @Test
    void run_正常ケース_別エンティティのレコードが混在する_対象エンティティのみ適用されること()
            throws Exception {
        FixtureFixer fixer = mock(FixtureFixer.class);
        when(fixer.entity()).thenReturn("authman.user");
        when(fixer.apply(any(FixtureRecord.class))).thenReturn(false);
        Path users = tempDir.resolve("authman_user.json");
        FixtureFiles.write(users, List.of(record("other.entity", 1, "name", "x")));

        new FixerRunner(".bak").run(tempDir, List.of(fixer));

        verify(fixer, never()).apply(any(FixtureRecord.class));
        assertFalse(Files.exists(tempDir.resolve("authman_user.json.bak")));
    }
}

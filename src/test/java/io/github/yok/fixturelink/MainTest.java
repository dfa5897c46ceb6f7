package io.github.yok.fixturelink;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mockConstruction;
import static org.mockito.Mockito.mockStatic;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.yok.fixturelink.config.CoercionConfig;
import io.github.yok.fixturelink.config.ExtractConfig;
import io.github.yok.fixturelink.config.FixerConfig;
import io.github.yok.fixturelink.config.NormalizeConfig;
import io.github.yok.fixturelink.config.PathsConfig;
import io.github.yok.fixturelink.config.SchemaMappingConfig;
import io.github.yok.fixturelink.config.UnmappedPolicy;
import io.github.yok.fixturelink.core.FixtureExtractor;
import io.github.yok.fixturelink.core.FixtureRecord;
import io.github.yok.fixturelink.util.ErrorHandler;
import io.github.yok.fixturelink.util.FixtureFiles;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.MockedConstruction;
import org.mockito.MockedStatic;

/**
 * Unit tests for {@link Main}.
 */
class MainTest {

    @TempDir
    Path tempDir;

    private ExtractConfig extractConfig;
    private Main main;
    private Path fixtures;
    private Path dump;
    private PrintStream originalErr;
    private ByteArrayOutputStream err;

    @BeforeEach
    void setup() throws Exception {
        PathsConfig pathsConfig = new PathsConfig();
        pathsConfig.setDataPath(tempDir.toString());
        extractConfig = new ExtractConfig();
        main = new Main(pathsConfig, extractConfig, new CoercionConfig(), new NormalizeConfig(),
                new FixerConfig(), new SchemaMappingConfig());
        fixtures = tempDir.resolve("fixtures");
        dump = Path.of(MainTest.class.getResource("/legacy_dump.sql").toURI());

        originalErr = System.err;
        err = new ByteArrayOutputStream();
        System.setErr(new PrintStream(err));
    }

    @AfterEach
    void tearDown() {
        System.setErr(originalErr);
    }

    @Test
    void run_正常ケース_extractを指定する_dataPath配下にフィクスチャが出力されること() throws Exception {
        main.run("--extract", dump.toString());

        assertEquals(ErrorHandler.EXIT_SUCCESS, main.getExitCode());
        assertEquals(4, FixtureFiles.list(fixtures).size());
    }

    @Test
    void run_正常ケース_outを指定する_指定ディレクトリに出力されること() throws Exception {
        Path out = tempDir.resolve("custom");

        main.run("-e", dump.toString(), "-o", out.toString());

        assertEquals(ErrorHandler.EXIT_SUCCESS, main.getExitCode());
        assertEquals(4, FixtureFiles.list(out).size());
        assertFalse(Files.exists(fixtures));
    }

    @Test
    void run_正常ケース_全モードを順に実行する_正規化と修正と束ねが反映されること() throws Exception {
        main.run("--extract", dump.toString());
        main.run("--normalize");
        main.run("--fix");
        main.run("--bundle");

        assertEquals(ErrorHandler.EXIT_SUCCESS, main.getExitCode());

        FixtureRecord admin = FixtureFiles.read(fixtures.resolve("authman_user.json")).get(0);
        assertEquals("2024-03-01T10:00:00Z", admin.getFields().get("last_login"));
        assertEquals(List.of(1), admin.getFields().get("groups"));
        FixtureRecord coach = FixtureFiles.read(fixtures.resolve("authman_user.json")).get(1);
        assertEquals(List.of(2), coach.getFields().get("groups"));

        FixtureRecord game = FixtureFiles.read(fixtures.resolve("games_game.json")).get(0);
        assertEquals("2024-05-01T14:30:00Z", game.getFields().get("date"));
        assertEquals(4, game.getFields().get("game_round"));
        assertEquals("completed", game.getFields().get("status"));
        assertTrue(Files.exists(fixtures.resolve("games_game.json.bak")));

        Path bundle = tempDir.resolve(Main.DEFAULT_BUNDLE_NAME);
        JsonNode root = FixtureFiles.mapper().readTree(bundle.toFile());
        assertEquals("1.0", root.get("version").asText());
        assertEquals(2, root.get("entities").get("authman.user").size());
    }

    @Test
    void run_正常ケース_bundleにファイルを指定する_指定先に出力されること() throws Exception {
        main.run("--extract", dump.toString());
        Path bundle = tempDir.resolve("out/seed.json");

        main.run("-b", bundle.toString());

        assertEquals(ErrorHandler.EXIT_SUCCESS, main.getExitCode());
        assertTrue(Files.exists(bundle));
    }

    @Test
    void run_正常ケース_フィクスチャディレクトリ内にバンドルを出力後に正規化する_正常終了すること()
            throws Exception {
        main.run("--extract", dump.toString());
        main.run("--bundle", fixtures.resolve(Main.DEFAULT_BUNDLE_NAME).toString());

        main.run("--normalize");

        assertEquals(ErrorHandler.EXIT_SUCCESS, main.getExitCode());
        assertEquals(4, FixtureFiles.list(fixtures).size());
        assertEquals("2024-05-01T14:30:00Z", FixtureFiles.read(fixtures.resolve("games_game.json"))
                .get(0).getFields().get("date"));
    }

    @Test
    void run_正常ケース_normalizeを2回実行する_2回目はファイルが変わらないこと() throws Exception {
        main.run("--extract", dump.toString());
        main.run("-n");
        byte[] once = Files.readAllBytes(fixtures.resolve("games_game.json"));

        main.run("-n");

        assertEquals(ErrorHandler.EXIT_SUCCESS, main.getExitCode());
        assertEquals(new String(once), Files.readString(fixtures.resolve("games_game.json")));
    }

    @Test
    void run_異常ケース_モード未指定_終了コード1となること() {
        main.run();

        assertEquals(ErrorHandler.EXIT_FAILURE, main.getExitCode());
        assertTrue(err.toString().contains("No mode specified"));
    }

    @Test
    void run_異常ケース_extractでダンプ未指定_ErrorHandlerが呼ばれること() {
        try (MockedStatic<ErrorHandler> mocked = mockStatic(ErrorHandler.class)) {
            mocked.when(() -> ErrorHandler.errorAndExit(anyString())).thenAnswer(inv -> {
                throw new IllegalStateException("exit");
            });

            assertThrows(IllegalStateException.class, () -> main.run("--extract"));

            mocked.verify(() -> ErrorHandler
                    .errorAndExit(eq("A dump file is required in extract mode.")));
        }
    }

    @Test
    void run_異常ケース_存在しないダンプ_終了コード1でフィクスチャが出力されないこと() {
        main.run("--extract", tempDir.resolve("missing.sql").toString());

        assertEquals(ErrorHandler.EXIT_FAILURE, main.getExitCode());
        assertTrue(err.toString().contains("ERROR: Fatal error"));
        assertFalse(Files.exists(fixtures));
    }

    @Test
    void run_異常ケース_未マッピングのテーブルでFAIL指定_例外が原因付きで報告されること() {
        extractConfig.setUnmappedTables(UnmappedPolicy.FAIL);
        ErrorHandler.disableExitForCurrentThread();
        try {
            IllegalStateException ex = assertThrows(IllegalStateException.class,
                    () -> main.run("--extract", dump.toString()));
            assertTrue(ex.getMessage().contains("django_session"));
        } finally {
            ErrorHandler.restoreExitForCurrentThread();
        }
    }

    @Test
    void run_正常ケース_未知の引数_警告のみで実行が続くこと() throws Exception {
        try (MockedConstruction<FixtureExtractor> mocked =
                mockConstruction(FixtureExtractor.class, (mock, ctx) -> when(
                        mock.execute(any(Path.class), any(Path.class))).thenReturn(null))) {

            main.run("--verbose", "--extract", dump.toString());

            assertEquals(ErrorHandler.EXIT_SUCCESS, main.getExitCode());
            verify(mocked.constructed().get(0)).execute(dump, fixtures);
        }
    }

    @Test
    void run_異常ケース_抽出で入出力エラー_終了コード1となること() throws Exception {
        try (MockedConstruction<FixtureExtractor> mocked =
                mockConstruction(FixtureExtractor.class, (mock, ctx) -> when(
                        mock.execute(any(Path.class), any(Path.class)))
                                .thenThrow(new IOException("disk full")))) {

            main.run("--extract", dump.toString());

            assertEquals(ErrorHandler.EXIT_FAILURE, main.getExitCode());
            assertTrue(err.toString().contains("disk full"));
        }
    }
}

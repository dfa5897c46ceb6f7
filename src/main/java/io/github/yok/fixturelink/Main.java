package io.github.yok.fixturelink;

import io.github.yok.fixturelink.config.CoercionConfig;
import io.github.yok.fixturelink.config.ExtractConfig;
import io.github.yok.fixturelink.config.FixerConfig;
import io.github.yok.fixturelink.config.NormalizeConfig;
import io.github.yok.fixturelink.config.PathsConfig;
import io.github.yok.fixturelink.config.SchemaMapping;
import io.github.yok.fixturelink.config.SchemaMappingConfig;
import io.github.yok.fixturelink.core.FixtureExtractor;
import io.github.yok.fixturelink.core.FixtureNormalizer;
import io.github.yok.fixturelink.core.SeedBundleWriter;
import io.github.yok.fixturelink.fixer.FixerRunner;
import io.github.yok.fixturelink.fixer.FixtureFixer;
import io.github.yok.fixturelink.fixer.GameFieldRenameFixer;
import io.github.yok.fixturelink.fixer.UserGroupFixer;
import io.github.yok.fixturelink.util.ErrorHandler;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Provides the application entry point.
 *
 * <p>
 * Parses the command-line options below and runs exactly one mode per invocation.
 * </p>
 * <ul>
 * <li>{@code --extract <dump>} or {@code -e <dump>} converts a legacy dump into fixture files
 * (see {@link FixtureExtractor}).</li>
 * <li>{@code --normalize} or {@code -n} repairs the fixture files in place (see
 * {@link FixtureNormalizer}).</li>
 * <li>{@code --fix} or {@code -f} applies the entity-specific fixers (see
 * {@link FixerRunner}).</li>
 * <li>{@code --bundle [file]} or {@code -b [file]} writes the seed bundle (see
 * {@link SeedBundleWriter}); defaults to {@code seed_bundle.json} next to the fixtures
 * directory.</li>
 * <li>{@code --out <dir>} or {@code -o <dir>} overrides the fixtures directory, which otherwise
 * is {@code <data-path>/fixtures}.</li>
 * </ul>
 *
 * <p>
 * A failure in the selected mode is reported through {@link ErrorHandler} and the process ends
 * with exit status {@value ErrorHandler#EXIT_FAILURE}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see PathsConfig
 * @see ExtractConfig
 * @see SchemaMappingConfig
 */
@Slf4j
@SpringBootApplication
@RequiredArgsConstructor
public class Main implements CommandLineRunner, ExitCodeGenerator {

    static final String DEFAULT_BUNDLE_NAME = "seed_bundle.json";

    private final PathsConfig pathsConfig;
    private final ExtractConfig extractConfig;
    private final CoercionConfig coercionConfig;
    private final NormalizeConfig normalizeConfig;
    private final FixerConfig fixerConfig;
    private final SchemaMappingConfig schemaMappingConfig;

    private int exitCode = ErrorHandler.EXIT_SUCCESS;

    /**
     * Bootstraps the application and ends the process with the run's exit status.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        System.exit(SpringApplication.exit(app.run(args)));
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        // Parse CLI arguments
        String mode = null;
        String argument = null;
        String outDir = null;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--extract":
                case "-e":
                    mode = "extract";
                    argument = optionValue(args, i);
                    i += argument == null ? 0 : 1;
                    break;
                case "--normalize":
                case "-n":
                    mode = "normalize";
                    break;
                case "--fix":
                case "-f":
                    mode = "fix";
                    break;
                case "--bundle":
                case "-b":
                    mode = "bundle";
                    argument = optionValue(args, i);
                    i += argument == null ? 0 : 1;
                    break;
                case "--out":
                case "-o":
                    outDir = optionValue(args, i);
                    i += outDir == null ? 0 : 1;
                    break;
                default:
                    log.warn("Unknown argument: {}", args[i]);
            }
        }

        if (mode == null) {
            exitCode = ErrorHandler.errorAndExit(
                    "No mode specified. Use --extract <dump>, --normalize, --fix or --bundle.");
            return;
        }
        if ("extract".equals(mode) && StringUtils.isBlank(argument)) {
            exitCode = ErrorHandler.errorAndExit("A dump file is required in extract mode.");
            return;
        }

        try {
            Path fixturesDir = Path.of(outDir != null ? outDir : pathsConfig.getFixtures());
            SchemaMapping mapping = schemaMappingConfig.toSchemaMapping();
            log.info("Mode: {}, Fixtures: {}", mode, fixturesDir);

            switch (mode) {
                case "extract":
                    new FixtureExtractor(extractConfig, coercionConfig, mapping)
                            .execute(Path.of(argument), fixturesDir);
                    break;
                case "normalize":
                    new FixtureNormalizer(normalizeConfig, mapping).normalizeAll(fixturesDir);
                    break;
                case "fix":
                    List<FixtureFixer> fixers =
                            List.of(new UserGroupFixer(fixerConfig.getUserGroups()),
                                    new GameFieldRenameFixer(fixerConfig.getGameFields()));
                    new FixerRunner(normalizeConfig.getBackupSuffix()).run(fixturesDir, fixers);
                    break;
                default:
                    Path bundle = argument != null ? Path.of(argument)
                            : fixturesDir.toAbsolutePath().resolveSibling(DEFAULT_BUNDLE_NAME);
                    new SeedBundleWriter(mapping).write(fixturesDir, bundle);
                    break;
            }
            log.info("Mode [{}] completed.", mode);
        } catch (Exception e) {
            log.error("Fatal error occurred (mode={}): {}", mode, e.getMessage(), e);
            exitCode = ErrorHandler.errorAndExit("Fatal error: " + e.getMessage(), e);
        }
    }

    // Value following the option at index i, unless it is another option
    private static String optionValue(String[] args, int i) {
        if (i + 1 < args.length && !args[i + 1].startsWith("-")) {
            return args[i + 1];
        }
        return null;
    }
}

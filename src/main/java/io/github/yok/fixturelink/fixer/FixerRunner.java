package io.github.yok.fixturelink.fixer;

import io.github.yok.fixturelink.core.FixtureRecord;
import io.github.yok.fixturelink.util.FixtureFiles;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Applies {@link FixtureFixer}s to the fixture files of a directory.
 *
 * <p>
 * Each fixer is run against the file of its entity. The file is only rewritten when at least one
 * record changed, and its previous content is copied to the backup path first. A missing file is
 * skipped.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class FixerRunner {

    private final String backupSuffix;

    /**
     * Creates a runner.
     *
     * @param backupSuffix suffix appended to a fixture file's name for its backup
     */
    public FixerRunner(String backupSuffix) {
        this.backupSuffix = backupSuffix;
    }

    /**
     * Runs the fixers in order.
     *
     * @param dir fixtures directory
     * @param fixers fixers to apply
     * @return fixer class name → number of records changed (absent when the file was missing)
     * @throws IOException if a file cannot be read, backed up or rewritten
     */
    public Map<String, Integer> run(Path dir, List<FixtureFixer> fixers) throws IOException {
        Map<String, Integer> summary = new LinkedHashMap<>();
        for (FixtureFixer fixer : fixers) {
            String name = fixer.getClass().getSimpleName();
            Path file = dir.resolve(FixtureFiles.fileName(fixer.entity()));
            if (!Files.isRegularFile(file)) {
                log.info("Fixer[{}] skipped: no fixture file for entity [{}]", name,
                        fixer.entity());
                continue;
            }
            int changed = apply(file, fixer);
            summary.put(name, changed);
            log.info("Fixer[{}] entity [{}]: {} records changed", name, fixer.entity(), changed);
        }
        return summary;
    }

    private int apply(Path file, FixtureFixer fixer) throws IOException {
        List<FixtureRecord> records = FixtureFiles.read(file);
        int changed = 0;
        for (FixtureRecord record : records) {
            if (!fixer.entity().equals(record.getEntity()) || record.getFields() == null) {
                continue;
            }
            if (fixer.apply(record)) {
                changed++;
            }
        }
        if (changed > 0) {
            Path backup = FixtureFiles.backupAndWrite(file, records, backupSuffix);
            log.debug("Rewrote {} (backup {})", file.getFileName(), backup.getFileName());
        }
        return changed;
    }
}

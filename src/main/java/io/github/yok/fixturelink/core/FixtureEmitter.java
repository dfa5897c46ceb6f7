package io.github.yok.fixturelink.core;

import io.github.yok.fixturelink.util.FixtureFiles;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Groups records by entity and writes one fixture file per entity.
 *
 * <p>
 * All records are consumed before the first file is written, so a failure while producing records
 * leaves the output directory untouched. Entities without records produce no file. Existing files
 * are overwritten wholesale.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class FixtureEmitter {

    /**
     * Writes the records.
     *
     * @param records records of one extraction run
     * @param outputDir fixtures directory (created if missing)
     * @return entity → number of records written, in first-seen order
     * @throws IOException if a file cannot be written
     */
    public Map<String, Integer> emit(Iterator<FixtureRecord> records, Path outputDir)
            throws IOException {
        Map<String, List<FixtureRecord>> byEntity = new LinkedHashMap<>();
        while (records.hasNext()) {
            FixtureRecord record = records.next();
            byEntity.computeIfAbsent(record.getEntity(), k -> new ArrayList<>()).add(record);
        }

        Files.createDirectories(outputDir);
        Map<String, Integer> summary = new LinkedHashMap<>();
        for (Map.Entry<String, List<FixtureRecord>> e : byEntity.entrySet()) {
            Path file = outputDir.resolve(FixtureFiles.fileName(e.getKey()));
            FixtureFiles.write(file, e.getValue());
            summary.put(e.getKey(), e.getValue().size());
            log.info("Entity[{}] wrote {} records to {}", e.getKey(), e.getValue().size(),
                    file.getFileName());
        }
        return summary;
    }
}

package io.github.yok.fixturelink.core;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import lombok.Getter;

/**
 * Outcome of normalizing one fixture file.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class NormalizationResult {

    private final Path file;

    private int recordCount;

    private int changedFields;

    // Backup written before the rewrite; null when the file was left untouched
    private Path backup;

    private final Set<String> unknownEntities = new LinkedHashSet<>();

    NormalizationResult(Path file) {
        this.file = file;
    }

    /**
     * Returns whether at least one field was rewritten.
     *
     * @return {@code true} if the file was changed
     */
    public boolean isChanged() {
        return changedFields > 0;
    }

    /**
     * Returns whether some record names an entity unknown to the schema mapping.
     *
     * @return {@code true} if schema drift was detected
     */
    public boolean hasSchemaDrift() {
        return !unknownEntities.isEmpty();
    }

    /**
     * Returns the entity names that are not produced by the schema mapping.
     *
     * @return unmodifiable set
     */
    public Set<String> getUnknownEntities() {
        return Collections.unmodifiableSet(unknownEntities);
    }

    void setRecordCount(int recordCount) {
        this.recordCount = recordCount;
    }

    void fieldChanged() {
        changedFields++;
    }

    void setBackup(Path backup) {
        this.backup = backup;
    }

    boolean unknownEntity(String entity) {
        return unknownEntities.add(entity);
    }
}

package io.github.yok.fixturelink.core;

import io.github.yok.fixturelink.config.NormalizeConfig;
import io.github.yok.fixturelink.config.SchemaMapping;
import io.github.yok.fixturelink.util.BooleanLiterals;
import io.github.yok.fixturelink.util.FixtureFiles;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Repair pass that rewrites residual non-canonical values of existing fixture files in place.
 *
 * <p>
 * <strong>Rewrites (string values only):</strong>
 * </p>
 * <ul>
 * <li>{@code 2026-07-01 10:00:00} → {@code 2026-07-01T10:00:00Z} (fractional seconds are
 * kept)</li>
 * <li>{@code 2026-07-01 10:00:00+09} → {@code 2026-07-01T10:00:00+09:00}</li>
 * <li>{@code 2026-07-01T10:00:00} → {@code 2026-07-01T10:00:00Z}</li>
 * <li>in a configured boolean field, {@code "1"}/{@code "true"}/{@code "t"} → {@code true} and
 * {@code "0"}/{@code "false"}/{@code "f"} → {@code false}</li>
 * </ul>
 *
 * <p>
 * Values ending in {@code Z} or {@code ±HH:MM} and non-string values are canonical and left alone,
 * so a second pass over its own output changes nothing. A file is only rewritten when at least one
 * field changed; its previous content is copied to the backup path first.
 * </p>
 *
 * <p>
 * Records whose entity is not produced by the {@link SchemaMapping} are reported as schema drift;
 * they are still normalized.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class FixtureNormalizer {

    private static final Pattern NAIVE_DATE_TIME =
            Pattern.compile("^(\\d{4}-\\d{2}-\\d{2}) (\\d{2}:\\d{2}:\\d{2}(?:\\.\\d+)?)$");

    private static final Pattern SPACED_OFFSET_DATE_TIME = Pattern.compile(
            "^(\\d{4}-\\d{2}-\\d{2}) (\\d{2}:\\d{2}:\\d{2}(?:\\.\\d+)?)([+-])(\\d{2}):?(\\d{2})?$");

    private static final Pattern LOCAL_DATE_TIME =
            Pattern.compile("^\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}(?:\\.\\d+)?$");

    private final NormalizeConfig config;
    private final SchemaMapping mapping;

    /**
     * Creates a normalizer.
     *
     * @param config boolean fields and backup suffix
     * @param mapping schema mapping used for drift detection
     */
    public FixtureNormalizer(NormalizeConfig config, SchemaMapping mapping) {
        this.config = config;
        this.mapping = mapping;
    }

    /**
     * Normalizes every fixture file of a directory.
     *
     * <p>
     * A file that cannot be read or rewritten does not stop the pass: the remaining files are
     * still normalized, and the failures are reported together once all files were visited.
     * </p>
     *
     * @param dir fixtures directory
     * @return one result per file, in file name order
     * @throws IOException if the directory cannot be listed or any file failed; the first failure
     *         is the cause and the others are attached as suppressed exceptions
     */
    public List<NormalizationResult> normalizeAll(Path dir) throws IOException {
        List<NormalizationResult> results = new ArrayList<>();
        Map<Path, IOException> failures = new LinkedHashMap<>();
        for (Path file : FixtureFiles.list(dir)) {
            try {
                results.add(normalize(file));
            } catch (IOException e) {
                log.error("File[{}] could not be normalized: {}", file.getFileName(),
                        e.getMessage());
                failures.put(file, e);
            }
        }
        long changed = results.stream().filter(NormalizationResult::isChanged).count();
        long drift = results.stream().filter(NormalizationResult::hasSchemaDrift).count();
        log.info("=== Normalization completed: files={}, changed={}, with schema drift={},"
                + " failed={} ===", results.size(), changed, drift, failures.size());

        if (!failures.isEmpty()) {
            List<IOException> causes = new ArrayList<>(failures.values());
            IOException ex = new IOException("Normalization failed for " + failures.size()
                    + " file(s): " + failures.keySet().stream().map(p -> p.getFileName().toString())
                            .collect(Collectors.joining(", ")),
                    causes.get(0));
            causes.stream().skip(1).forEach(ex::addSuppressed);
            throw ex;
        }
        return results;
    }

    /**
     * Normalizes one fixture file.
     *
     * @param file fixture file
     * @return result; {@link NormalizationResult#isChanged()} is {@code false} when the file was
     *         left untouched
     * @throws IOException if the file cannot be read, backed up or rewritten
     */
    public NormalizationResult normalize(Path file) throws IOException {
        List<FixtureRecord> records = FixtureFiles.read(file);
        NormalizationResult result = new NormalizationResult(file);
        result.setRecordCount(records.size());

        for (FixtureRecord record : records) {
            checkEntity(file, record, result);
            if (record.getFields() == null) {
                continue;
            }
            for (Map.Entry<String, Object> field : record.getFields().entrySet()) {
                Object before = field.getValue();
                Object after = normalizeValue(field.getKey(), before);
                if (!Objects.equals(before, after)) {
                    field.setValue(after);
                    result.fieldChanged();
                    log.debug("Fixed {} pk={} field={}: [{}] → [{}]", record.getEntity(),
                            record.getPrimaryKey(), field.getKey(), before, after);
                }
            }
        }

        if (result.isChanged()) {
            result.setBackup(FixtureFiles.backupAndWrite(file, records, config.getBackupSuffix()));
            log.info("File[{}] fixed {} fields; backup at {}", file.getFileName(),
                    result.getChangedFields(), result.getBackup().getFileName());
        } else {
            log.info("File[{}] already canonical ({} records)", file.getFileName(),
                    records.size());
        }
        return result;
    }

    /**
     * Returns the canonical form of a field value.
     *
     * @param field field name
     * @param value current value
     * @return the canonical value; {@code value} itself when it is already canonical
     */
    Object normalizeValue(String field, Object value) {
        if (!(value instanceof String) || StringUtils.isEmpty((String) value)) {
            return value;
        }
        String text = (String) value;
        if (config.getBooleanFields().contains(field)) {
            Optional<Boolean> bool = BooleanLiterals.parse(text);
            if (bool.isPresent()) {
                return bool.get();
            }
        }
        return normalizeDateTime(text);
    }

    /**
     * Returns the zone-qualified ISO-8601 form of a date-time string.
     *
     * @param text string value
     * @return the rewritten value, or {@code text} if it is not a zone-less date-time
     */
    static String normalizeDateTime(String text) {
        Matcher naive = NAIVE_DATE_TIME.matcher(text);
        if (naive.matches()) {
            return naive.group(1) + "T" + naive.group(2) + "Z";
        }
        Matcher offset = SPACED_OFFSET_DATE_TIME.matcher(text);
        if (offset.matches()) {
            String minutes = offset.group(5) == null ? "00" : offset.group(5);
            return offset.group(1) + "T" + offset.group(2) + offset.group(3) + offset.group(4)
                    + ":" + minutes;
        }
        if (LOCAL_DATE_TIME.matcher(text).matches()) {
            return text + "Z";
        }
        return text;
    }

    private void checkEntity(Path file, FixtureRecord record, NormalizationResult result) {
        String entity = record.getEntity();
        if (StringUtils.isBlank(entity)) {
            if (result.unknownEntity("")) {
                log.warn("File[{}] has a record without model (pk={})", file.getFileName(),
                        record.getPrimaryKey());
            }
            return;
        }
        if (!mapping.isKnownEntity(entity) && result.unknownEntity(entity)) {
            log.warn("File[{}] schema drift: model [{}] is not produced by the schema mapping",
                    file.getFileName(), entity);
        }
    }
}

package io.github.yok.fixturelink.util;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import io.github.yok.fixturelink.core.FixtureRecord;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;

/**
 * Utility class for reading and writing fixture files.
 *
 * <p>
 * A fixture file is a UTF-8 JSON array of {@link FixtureRecord}s for one entity, indented with two
 * spaces and ending with a newline, so that it stays diffable and hand-editable.
 * </p>
 *
 * <p>
 * All writes go to a temporary file in the destination directory first, are flushed to disk, and
 * are then moved over the destination, so a reader never observes a partially written file. The
 * temporary file is deleted on every exit path.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class FixtureFiles {

    /**
     * Extension of fixture files.
     */
    public static final String EXTENSION = "json";

    private static final TypeReference<List<FixtureRecord>> RECORD_LIST =
            new TypeReference<List<FixtureRecord>>() {};

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final ObjectWriter WRITER = MAPPER.writer(prettyPrinter());

    private FixtureFiles() {
        // Utility class; do not instantiate.
    }

    private static DefaultPrettyPrinter prettyPrinter() {
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter().withSeparators(Separators
                .createDefaultInstance().withObjectFieldValueSpacing(Separators.Spacing.AFTER));
        printer.indentObjectsWith(indenter);
        printer.indentArraysWith(indenter);
        return printer;
    }

    /**
     * Returns the shared {@link ObjectMapper} used for fixture JSON.
     *
     * @return mapper
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Returns the file name that holds the records of an entity, e.g. {@code games.team} →
     * {@code games_team.json}.
     *
     * @param entity entity name
     * @return file name
     */
    public static String fileName(String entity) {
        return entity.replace('.', '_') + "." + EXTENSION;
    }

    /**
     * Returns the backup path of a fixture file.
     *
     * @param file fixture file
     * @param suffix backup suffix, e.g. {@code .bak}
     * @return sibling path with the suffix appended to the file name
     */
    public static Path backupPathOf(Path file, String suffix) {
        return file.resolveSibling(file.getFileName().toString() + suffix);
    }

    /**
     * Reads all records of a fixture file.
     *
     * @param file fixture file
     * @return records in file order
     * @throws IOException if the file cannot be read or is not a JSON array of records
     */
    public static List<FixtureRecord> read(Path file) throws IOException {
        List<FixtureRecord> records = MAPPER.readValue(file.toFile(), RECORD_LIST);
        return records == null ? new ArrayList<>() : records;
    }

    /**
     * Serializes records (or any other JSON document) to the fixture file format.
     *
     * @param document records or document to serialize
     * @return UTF-8 bytes including a trailing newline
     * @throws IOException if serialization fails
     */
    public static byte[] toBytes(Object document) throws IOException {
        String json = WRITER.writeValueAsString(document) + "\n";
        return json.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Replaces the content of a fixture file with the given records.
     *
     * @param file destination file (created or overwritten)
     * @param records records to write
     * @throws IOException on I/O error; the destination is left untouched in that case
     */
    public static void write(Path file, List<FixtureRecord> records) throws IOException {
        writeAtomically(file, toBytes(records));
    }

    /**
     * Replaces the content of a file with a JSON document in the fixture file layout.
     *
     * @param file destination file (created or overwritten)
     * @param document document to write
     * @throws IOException on I/O error; the destination is left untouched in that case
     */
    public static void writeDocument(Path file, Object document) throws IOException {
        writeAtomically(file, toBytes(document));
    }

    /**
     * Copies a fixture file byte-for-byte to its backup path and then replaces its content.
     *
     * <p>
     * The new content is only written after the backup copy has completed. Any previous backup is
     * overwritten.
     * </p>
     *
     * @param file fixture file to rewrite; must exist
     * @param records new records
     * @param backupSuffix backup suffix
     * @return path of the backup
     * @throws IOException if the backup or the rewrite fails
     */
    public static Path backupAndWrite(Path file, List<FixtureRecord> records, String backupSuffix)
            throws IOException {
        byte[] content = toBytes(records);
        Path backup = backupPathOf(file, backupSuffix);
        Files.copy(file, backup, StandardCopyOption.REPLACE_EXISTING,
                StandardCopyOption.COPY_ATTRIBUTES);
        log.debug("Backed up {} → {}", file.getFileName(), backup.getFileName());
        writeAtomically(file, content);
        return backup;
    }

    /**
     * Lists the fixture files of a directory, sorted by name. Backups and other files are
     * ignored.
     *
     * <p>
     * A {@code .json} file whose top-level value is not an array (a seed bundle written into the
     * directory, for instance) is not a fixture file; it is skipped with a warning. A file that is
     * not valid JSON at all is still listed so that reading it reports the error.
     * </p>
     *
     * @param dir fixtures directory
     * @return fixture files; empty if the directory does not exist
     * @throws IOException if the directory cannot be listed
     */
    public static List<Path> list(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            return new ArrayList<>();
        }
        List<Path> candidates;
        try (Stream<Path> stream = Files.list(dir)) {
            candidates = stream.filter(Files::isRegularFile)
                    .filter(p -> FilenameUtils.isExtension(p.getFileName().toString(), EXTENSION))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        }
        List<Path> files = new ArrayList<>();
        for (Path file : candidates) {
            JsonToken first = firstToken(file);
            if (first != null && first != JsonToken.START_ARRAY) {
                log.warn("File[{}] is not a JSON array of records; skipped", file.getFileName());
                continue;
            }
            files.add(file);
        }
        return files;
    }

    // Returns null when the file is empty or not parseable JSON
    private static JsonToken firstToken(Path file) throws IOException {
        try (JsonParser parser = MAPPER.getFactory().createParser(file.toFile())) {
            return parser.nextToken();
        } catch (JsonParseException e) {
            log.debug("File[{}] is not valid JSON: {}", file.getFileName(), e.getOriginalMessage());
            return null;
        }
    }

    private static void writeAtomically(Path file, byte[] content) throws IOException {
        Path dir = file.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        Path temp = Files.createTempFile(dir, "." + file.getFileName(), ".tmp");
        try {
            try (FileOutputStream out = new FileOutputStream(temp.toFile())) {
                out.write(content);
                out.getFD().sync();
            }
            try {
                Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE,
                        StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported in {}; falling back to replace", dir);
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}

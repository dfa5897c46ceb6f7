package io.github.yok.fixturelink.core;

import com.google.common.collect.Iterators;
import io.github.yok.fixturelink.config.CoercionConfig;
import io.github.yok.fixturelink.config.ExtractConfig;
import io.github.yok.fixturelink.config.SchemaMapping;
import io.github.yok.fixturelink.parser.DumpBlock;
import io.github.yok.fixturelink.parser.DumpBlockParser;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;

/**
 * Core class that turns a legacy dump into fixture files in one pass.
 *
 * <p>
 * <strong>Main responsibilities:</strong>
 * </p>
 * <ul>
 * <li>Read the dump's bulk-copy blocks with {@link DumpBlockParser}.</li>
 * <li>Translate each row with {@link RowMapper} / {@link ValueCoercer}.</li>
 * <li>Write one fixture file per entity with {@link FixtureEmitter}.</li>
 * <li>Log the per-entity counts and the dropped tables/columns.</li>
 * </ul>
 *
 * <p>
 * A {@link io.github.yok.fixturelink.parser.MalformedDumpException} or
 * {@link UnmappedSchemaException} aborts the run before any fixture file is written.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class FixtureExtractor {

    private final ExtractConfig extractConfig;
    private final CoercionConfig coercionConfig;
    private final SchemaMapping mapping;

    /**
     * Creates an extractor.
     *
     * @param extractConfig dump recognition and unmapped policies
     * @param coercionConfig coercion rules
     * @param mapping schema mapping
     */
    public FixtureExtractor(ExtractConfig extractConfig, CoercionConfig coercionConfig,
            SchemaMapping mapping) {
        this.extractConfig = extractConfig;
        this.coercionConfig = coercionConfig;
        this.mapping = mapping;
    }

    /**
     * Extracts fixtures from a dump file.
     *
     * @param dumpFile UTF-8 dump file
     * @param outputDir fixtures directory
     * @return run report
     * @throws IOException if the dump cannot be read or a fixture cannot be written
     */
    public ExtractionReport execute(Path dumpFile, Path outputDir) throws IOException {
        log.info("=== Extraction started: dump [{}] → [{}] ===", dumpFile, outputDir);
        ExtractionReport report = new ExtractionReport();
        RowMapper mapper =
                new RowMapper(mapping, new ValueCoercer(coercionConfig), extractConfig, report);
        DumpBlockParser parser = new DumpBlockParser(extractConfig);

        try (BufferedReader reader = Files.newBufferedReader(dumpFile, StandardCharsets.UTF_8)) {
            Iterator<FixtureRecord> records = records(parser.parse(reader), mapper, report);
            Map<String, Integer> summary = new FixtureEmitter().emit(records, outputDir);
            report.setRecordsPerEntity(summary);
        }

        report.logSummary();
        log.info("=== Extraction completed: {} records in {} files ===", report.getRecordCount(),
                report.getRecordsPerEntity().size());
        return report;
    }

    /**
     * Flattens the blocks into a lazy sequence of mapped records.
     *
     * @param blocks dump blocks
     * @param mapper row mapper
     * @param report report receiving block/row counters
     * @return lazy record iterator
     */
    private Iterator<FixtureRecord> records(Iterator<DumpBlock> blocks, RowMapper mapper,
            ExtractionReport report) {
        return Iterators.concat(Iterators.transform(blocks, block -> {
            report.blockRead();
            log.debug("Table[{}] reading rows (header line {})", block.getTable(),
                    block.getHeaderLine());
            // One data line per row, right after the header
            AtomicInteger line = new AtomicInteger(block.getHeaderLine());
            Iterator<FixtureRecord> mapped = Iterators.transform(block.rows(), row -> {
                report.rowRead();
                return mapper.mapRow(block.getTable(), block.getColumns(), row,
                        line.incrementAndGet()).orElse(null);
            });
            return Iterators.filter(mapped, Objects::nonNull);
        }));
    }
}

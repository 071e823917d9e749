package com.civicintel.dumping.service;

import com.civicintel.dumping.model.BuildRun;
import com.civicintel.dumping.model.CleanRecord;
import com.civicintel.dumping.model.DataQualityReport;
import com.civicintel.dumping.model.RawRecord;
import com.civicintel.dumping.model.StarSchema;
import com.civicintel.dumping.output.StarSchemaExporter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Runs one build end to end: read, clean, quality report, model, validate,
 * export. Single-threaded, everything held in memory.
 *
 * Export is all-or-nothing: validation runs before the first file is written,
 * so a failed build leaves the export directory untouched.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class StarSchemaBuildService {

    private static final String RULE = "=".repeat(60);

    private final RawCsvReader reader;
    private final RecordCleaner cleaner;
    private final DataQualityReporter qualityReporter;
    private final DimensionalModeler modeler;
    private final IntegrityValidator validator;
    private final StarSchemaExporter exporter;

    public BuildRun build(Path input, Path exportDir) {
        BuildRun run = BuildRun.builder()
                .runId(UUID.randomUUID().toString())
                .inputPath(input.toString())
                .exportDir(exportDir.toAbsolutePath().toString())
                .startedAt(LocalDateTime.now())
                .status("RUNNING")
                .build();

        try {
            banner("STEP 1: Loading and cleaning raw data...");
            List<RawRecord> raw = reader.read(input);
            List<CleanRecord> clean = cleaner.clean(raw);

            DataQualityReport quality = qualityReporter.report(clean);
            qualityReporter.logReport(quality);
            run.setQualityReport(quality);

            banner("STEP 2: Building star schema...");
            StarSchema schema = modeler.build(clean);

            banner("STEP 3: Running QA checks and exporting...");
            validator.validate(schema);
            Map<String, Integer> counts = exporter.export(schema, exportDir);

            run.setRowCounts(counts);
            run.setStatus("SUCCESS");
            run.setCompletedAt(LocalDateTime.now());
            exporter.writeManifest(run, exportDir);

            return run;

        } catch (RuntimeException e) {
            log.error("Star schema build {} failed: {}", run.getRunId(), e.getMessage());
            throw e;
        }
    }

    private void banner(String step) {
        log.info(RULE);
        log.info(step);
        log.info(RULE);
    }
}

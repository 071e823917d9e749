package com.civicintel.dumping.runner;

import com.civicintel.dumping.config.StarSchemaProperties;
import com.civicintel.dumping.model.BuildRun;
import com.civicintel.dumping.service.StarSchemaBuildService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

/**
 * Command-line entry point.
 *
 *   java -jar dumping-star-schema.jar --input=raw.csv [--export-dir=exports/star_schema]
 *
 * Any exception escapes to Spring Boot, which logs it and exits non-zero
 * (validation failures exit with 2, I/O failures with 1).
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class StarSchemaCliRunner implements ApplicationRunner {

    static final String INPUT_OPTION = "input";
    static final String EXPORT_DIR_OPTION = "export-dir";

    private final StarSchemaBuildService buildService;
    private final StarSchemaProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            log.debug("star-schema.cli.run=false, not building");
            return;
        }

        String input = option(args, INPUT_OPTION, properties.getInput());
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException(
                    "Missing required option --input=<path to raw Illegal Dumping CSV>");
        }
        String exportDir = option(args, EXPORT_DIR_OPTION, properties.getOutput().getExportDir());

        BuildRun run = buildService.build(Paths.get(input), Paths.get(exportDir));
        logSummary(run);
    }

    private void logSummary(BuildRun run) {
        Map<String, Integer> counts = run.getRowCounts();
        log.info("BUILD OK");
        log.info("  Exports: {}", Path.of(run.getExportDir()).toAbsolutePath());
        counts.forEach((table, rows) -> log.info("  {}: {} rows", table, String.format("%,d", rows)));
        log.info("COMPLETE: star schema ready for import");
    }

    private static String option(ApplicationArguments args, String name, String fallback) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) return fallback;
        return values.get(values.size() - 1);
    }
}

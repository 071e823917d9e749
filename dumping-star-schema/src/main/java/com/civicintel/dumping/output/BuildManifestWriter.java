package com.civicintel.dumping.output;

import com.civicintel.dumping.model.BuildRun;
import com.civicintel.dumping.service.StarSchemaIoException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Writes build_manifest.json next to the exported tables: run id, timings,
 * row counts and the data quality report.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class BuildManifestWriter {

    public static final String MANIFEST_FILE = "build_manifest.json";

    private final ObjectMapper objectMapper;

    public Path write(BuildRun run, Path exportDir) {
        Path manifest = exportDir.resolve(MANIFEST_FILE);
        try {
            objectMapper.writer()
                    .with(SerializationFeature.INDENT_OUTPUT)
                    .without(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                    .writeValue(manifest.toFile(), run);
            log.info("Build manifest written: {}", manifest);
            return manifest;
        } catch (IOException e) {
            log.error("Failed to write build manifest {}: {}", manifest, e.getMessage(), e);
            throw new StarSchemaIoException("Manifest write failed: " + manifest, e);
        }
    }
}

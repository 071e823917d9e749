package com.civicintel.dumping.output;

import com.civicintel.dumping.config.StarSchemaProperties;
import com.civicintel.dumping.model.BuildRun;
import com.civicintel.dumping.model.StarSchema;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Map;

/**
 * Routes a validated star schema to the export directory: the six table CSVs,
 * then the manifest when enabled. Only ever called after validation passed.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class StarSchemaExporter {

    private final StarSchemaCsvWriter csvWriter;
    private final BuildManifestWriter manifestWriter;
    private final StarSchemaProperties properties;

    public Map<String, Integer> export(StarSchema schema, Path exportDir) {
        csvWriter.write(schema, exportDir);
        return schema.rowCounts();
    }

    public void writeManifest(BuildRun run, Path exportDir) {
        if (properties.getOutput().isWriteManifest()) {
            manifestWriter.write(run, exportDir);
        } else {
            log.debug("Manifest disabled, skipping {}", BuildManifestWriter.MANIFEST_FILE);
        }
    }
}

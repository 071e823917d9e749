package com.civicintel.dumping.output;

import com.civicintel.dumping.config.StarSchemaProperties;
import com.civicintel.dumping.model.BuildRun;
import com.civicintel.dumping.model.DataQualityReport;
import com.civicintel.dumping.model.StarSchema;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class StarSchemaExporterTest {

    @Mock
    private StarSchemaCsvWriter csvWriter;

    @Mock
    private BuildManifestWriter manifestWriter;

    @TempDir
    Path tempDir;

    @Test
    void exportsTablesAndReturnsRowCounts() {
        StarSchemaExporter exporter = new StarSchemaExporter(csvWriter, manifestWriter, new StarSchemaProperties());
        StarSchema schema = StarSchemaCsvWriterTest.sampleSchema();

        Map<String, Integer> counts = exporter.export(schema, tempDir);

        verify(csvWriter).write(schema, tempDir);
        assertThat(counts).containsExactly(
                Map.entry("fact_illegal_dumping", 1),
                Map.entry("dim_date", 1),
                Map.entry("dim_location", 1),
                Map.entry("dim_category", 1),
                Map.entry("dim_intake", 1),
                Map.entry("dim_status", 1));
    }

    @Test
    void manifestIsSkippedWhenDisabled() {
        StarSchemaProperties properties = new StarSchemaProperties();
        properties.getOutput().setWriteManifest(false);
        StarSchemaExporter exporter = new StarSchemaExporter(csvWriter, manifestWriter, properties);

        exporter.writeManifest(BuildRun.builder().runId("r").build(), tempDir);

        verify(manifestWriter, never()).write(any(), any());
    }

    @Test
    void manifestRecordsRunAsJson() throws Exception {
        ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
        BuildManifestWriter writer = new BuildManifestWriter(mapper);
        BuildRun run = BuildRun.builder()
                .runId("run-1")
                .inputPath("raw.csv")
                .exportDir(tempDir.toString())
                .startedAt(LocalDateTime.of(2024, 5, 1, 9, 0))
                .completedAt(LocalDateTime.of(2024, 5, 1, 9, 1))
                .status("SUCCESS")
                .rowCounts(StarSchemaCsvWriterTest.sampleSchema().rowCounts())
                .qualityReport(DataQualityReport.builder()
                        .totalRows(1)
                        .totalColumns(17)
                        .missingValuesPctTop5(Map.of("ZIP Code", 0.0))
                        .build())
                .build();

        Path manifest = writer.write(run, tempDir);

        JsonNode json = mapper.readTree(manifest.toFile());
        assertEquals("run-1", json.get("runId").asText());
        assertEquals("2024-05-01T09:00:00", json.get("startedAt").asText());
        assertEquals(1, json.get("rowCounts").get("dim_status").asInt());
        assertEquals(17, json.get("qualityReport").get("totalColumns").asInt());
    }
}

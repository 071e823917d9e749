package com.civicintel.dumping.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Tracks one star schema build, written to build_manifest.json on success.
 */
@Data
@Builder
public class BuildRun {

    private String runId;           // UUID
    private String inputPath;
    private String exportDir;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private String status;          // RUNNING | SUCCESS
    private Map<String, Integer> rowCounts;
    private DataQualityReport qualityReport;
}

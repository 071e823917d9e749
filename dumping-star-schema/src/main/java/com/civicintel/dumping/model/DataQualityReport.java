package com.civicintel.dumping.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Snapshot of the cleaned record set, logged before modeling and stored in
 * the build manifest. Informational only.
 */
@Value
@Builder
public class DataQualityReport {

    int totalRows;
    int totalColumns;

    /** Share of rows with at least one absent field, 0-100, two decimals */
    double rowsWithNullsPct;

    int duplicateRows;

    /** Column name → percent absent, worst five first */
    Map<String, Double> missingValuesPctTop5;
}

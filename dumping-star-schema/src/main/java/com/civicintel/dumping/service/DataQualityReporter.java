package com.civicintel.dumping.service;

import com.civicintel.dumping.model.CleanRecord;
import com.civicintel.dumping.model.DataQualityReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Summarises completeness of the cleaned records. Purely informational,
 * nothing here can fail the build.
 */
@Component
@Slf4j
public class DataQualityReporter {

    private static final int TOP_MISSING = 5;

    public DataQualityReport report(List<CleanRecord> records) {
        Map<String, Integer> nullsByColumn = new LinkedHashMap<>();
        Set<List<Object>> seenRows = new HashSet<>();
        int rowsWithNulls = 0;
        int duplicateRows = 0;

        for (CleanRecord record : records) {
            Map<String, Object> cols = record.columns();
            boolean anyNull = false;
            for (Map.Entry<String, Object> col : cols.entrySet()) {
                int missing = col.getValue() == null ? 1 : 0;
                nullsByColumn.merge(col.getKey(), missing, Integer::sum);
                anyNull |= missing == 1;
            }
            if (anyNull) rowsWithNulls++;
            if (!seenRows.add(new ArrayList<>(cols.values()))) duplicateRows++;
        }

        int total = records.size();
        Map<String, Double> top = new LinkedHashMap<>();
        nullsByColumn.entrySet().stream()
                .sorted(Comparator.comparing((Map.Entry<String, Integer> e) -> e.getValue()).reversed())
                .limit(TOP_MISSING)
                .forEach(e -> top.put(e.getKey(), percent(e.getValue(), total)));

        return DataQualityReport.builder()
                .totalRows(total)
                .totalColumns(nullsByColumn.size())
                .rowsWithNullsPct(percent(rowsWithNulls, total))
                .duplicateRows(duplicateRows)
                .missingValuesPctTop5(top)
                .build();
    }

    public void logReport(DataQualityReport report) {
        log.info("Data Quality Report:");
        log.info("  Total rows: {}", String.format("%,d", report.getTotalRows()));
        log.info("  Total columns: {}", report.getTotalColumns());
        log.info("  Rows with nulls: {}%", report.getRowsWithNullsPct());
        log.info("  Duplicate rows: {}", String.format("%,d", report.getDuplicateRows()));
        log.info("  Top missing columns: {}", report.getMissingValuesPctTop5());
    }

    static double percent(long part, long total) {
        if (total == 0) return 0.0;
        return BigDecimal.valueOf(part * 100.0 / total)
                .setScale(2, RoundingMode.HALF_EVEN)
                .doubleValue();
    }
}

package com.civicintel.dumping.service;

import com.civicintel.dumping.model.CleanRecord;
import com.civicintel.dumping.model.DataQualityReport;
import com.civicintel.dumping.model.RawRecord;
import com.civicintel.dumping.model.SourceColumns;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class DataQualityReporterTest {
    private final DataQualityReporter reporter = new DataQualityReporter();

    @Test
    void summarisesCompletenessAndDuplicates() {
        CleanRecord complete = full("1");
        CleanRecord missingZip = full("2").toBuilder().zipCode(null).build();

        DataQualityReport report = reporter.report(List.of(complete, missingZip, full("1"), missingZip));

        assertEquals(4, report.getTotalRows());
        assertEquals(complete.columns().size(), report.getTotalColumns());
        assertEquals(50.0, report.getRowsWithNullsPct());
        assertEquals(2, report.getDuplicateRows());
        assertThat(report.getMissingValuesPctTop5()).hasSize(5);
        assertThat(report.getMissingValuesPctTop5().keySet()).first().isEqualTo("ZIP Code");
        assertThat(report.getMissingValuesPctTop5()).containsEntry("ZIP Code", 50.0);
    }

    @Test
    void countsOnlyColumnsTheSourceHeaderCarried() {
        RecordCleaner cleaner = new RecordCleaner();
        List<CleanRecord> records = cleaner.clean(List.of(
                narrowRow("SR-1", "1 MAIN ST"),
                narrowRow("SR-2", "2 PIKE ST")));

        DataQualityReport report = reporter.report(records);

        // Service Request Number, Location, Created Date and five date parts
        assertEquals(8, report.getTotalColumns());
        assertThat(records.get(0).columns().keySet()).containsExactly(
                "Service Request Number", "Created Date", "Location",
                "Year", "Month", "Day", "Weekday", "Hour");
        assertThat(report.getMissingValuesPctTop5())
                .containsEntry("Created Date", 100.0)
                .doesNotContainKeys("Latitude", "Longitude", "ZIP Code", "Council District");
        assertEquals(0, report.getDuplicateRows());
    }

    @Test
    void emptyInputReportsZeros() {
        DataQualityReport report = reporter.report(List.of());

        assertEquals(0, report.getTotalRows());
        assertEquals(0.0, report.getRowsWithNullsPct());
        assertThat(report.getMissingValuesPctTop5()).isEmpty();
    }

    @Test
    void roundsPercentagesToTwoDecimals() {
        assertEquals(33.33, DataQualityReporter.percent(1, 3));
        assertEquals(66.67, DataQualityReporter.percent(2, 3));
    }

    private static CleanRecord full(String id) {
        LocalDateTime created = LocalDateTime.of(2021, 6, 1, 10, 0);
        return CleanRecord.builder()
                .serviceRequestNumber(id)
                .createdDate(created)
                .methodReceived("Phone")
                .status("Closed")
                .location("1 MAIN ST")
                .latitude(47.6)
                .longitude(-122.3)
                .zipCode("98101")
                .councilDistrict(7)
                .policePrecinct("West")
                .violationLocatedAt("Alley")
                .dumpingDescription("Tires")
                .year(2021)
                .month(6)
                .day(1)
                .weekday("Tuesday")
                .hour(10)
                .presentColumns(SourceColumns.TYPED)
                .build();
    }

    private static RawRecord narrowRow(String requestNumber, String location) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("Service Request Number", requestNumber);
        values.put("Location", location);
        return RawRecord.of(values);
    }
}

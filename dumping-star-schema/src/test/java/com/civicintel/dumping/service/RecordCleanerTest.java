package com.civicintel.dumping.service;

import com.civicintel.dumping.model.CleanRecord;
import com.civicintel.dumping.model.RawRecord;
import com.civicintel.dumping.model.SourceColumns;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class RecordCleanerTest {
    private final RecordCleaner cleaner = new RecordCleaner();

    @Test
    void cleansAWellFormedRow() {
        CleanRecord r = cleaner.clean(row(Map.of(
                SourceColumns.SERVICE_REQUEST_NUMBER, " 21-00012345 ",
                SourceColumns.CREATED_DATE, "03/04/2021 08:15:00 PM",
                SourceColumns.ZIP_CODE, "98101-1234",
                SourceColumns.COUNCIL_DISTRICT, "7.0",
                SourceColumns.LATITUDE, "47.6062",
                SourceColumns.LONGITUDE, "-122.3321",
                SourceColumns.STATUS, "Closed",
                SourceColumns.LOCATION, "123 MAIN ST")));

        assertEquals("21-00012345", r.getServiceRequestNumber());
        assertEquals(LocalDateTime.of(2021, 3, 4, 20, 15), r.getCreatedDate());
        assertEquals("98101", r.getZipCode());
        assertEquals(7, r.getCouncilDistrict());
        assertEquals(47.6062, r.getLatitude());
        assertEquals(-122.3321, r.getLongitude());
        assertEquals("Closed", r.getStatus());
        assertEquals(2021, r.getYear());
        assertEquals(3, r.getMonth());
        assertEquals(4, r.getDay());
        assertEquals("Thursday", r.getWeekday());
        assertEquals(20, r.getHour());
    }

    @Test
    void malformedFieldsBecomeNullNotDefaults() {
        CleanRecord r = cleaner.clean(row(Map.of(
                SourceColumns.CREATED_DATE, "not a date",
                SourceColumns.ZIP_CODE, "WA",
                SourceColumns.COUNCIL_DISTRICT, "N/A",
                SourceColumns.LATITUDE, "north",
                SourceColumns.LONGITUDE, "-122.3")));

        assertNull(r.getCreatedDate());
        assertNull(r.getZipCode());
        assertNull(r.getCouncilDistrict());
        assertNull(r.getLatitude());
        assertEquals(-122.3, r.getLongitude());
        assertNull(r.getYear());
        assertNull(r.getWeekday());
        assertNull(r.getHour());
    }

    @Test
    void absentCouncilDistrictStaysAbsent() {
        CleanRecord r = cleaner.clean(row(Map.of(SourceColumns.COUNCIL_DISTRICT, "")));
        assertNull(r.getCouncilDistrict());

        assertNull(RecordCleaner.parseInteger("3.5"));
        assertEquals(3, RecordCleaner.parseInteger("3"));
    }

    @Test
    void nullIslandCoordinatesAreCleared() {
        CleanRecord r = cleaner.clean(row(Map.of(
                SourceColumns.LATITUDE, "0",
                SourceColumns.LONGITUDE, "0.0")));

        assertNull(r.getLatitude());
        assertNull(r.getLongitude());
    }

    @Test
    void categoricalColumnsFallBackToUnknown() {
        CleanRecord r = cleaner.clean(row(Map.of(SourceColumns.SERVICE_REQUEST_NUMBER, "1")));

        assertEquals("Unknown", r.getPolicePrecinct());
        assertEquals("Unknown", r.getStatus());
        assertEquals("Unknown", r.getMethodReceived());
        assertEquals("Unknown", r.getViolationLocatedAt());
        assertEquals("Unknown", r.getDumpingDescription());
        assertEquals("Unknown", r.getLocation());
    }

    @Test
    void nonCategoricalColumnsAreNeverFilled() {
        CleanRecord r = cleaner.clean(row(Map.of()));

        assertNull(r.getServiceRequestNumber());
        assertNull(r.getZipCode());
        assertNull(r.getCouncilDistrict());
        assertNull(r.getLatitude());
        assertNull(r.getCreatedDate());
    }

    @Test
    void dropsCommunityReportingAreaAndKeepsOtherColumns() {
        Map<String, String> values = new LinkedHashMap<>();
        values.put(SourceColumns.SERVICE_REQUEST_NUMBER, "1");
        values.put(SourceColumns.COMMUNITY_REPORTING_AREA, "DOWNTOWN");
        values.put("Source", "  Find It Fix It ");
        values.put("Notes", "nan");

        CleanRecord r = cleaner.clean(RawRecord.of(values));

        assertThat(r.getOtherFields())
                .doesNotContainKey(SourceColumns.COMMUNITY_REPORTING_AREA)
                .containsEntry("Source", "Find It Fix It")
                .containsEntry("Notes", null);
        assertThat(r.columns()).doesNotContainKey(SourceColumns.COMMUNITY_REPORTING_AREA);
    }

    @Test
    void impossibleCalendarDateLeavesCreatedDateAndPartsAbsent() {
        CleanRecord r = cleaner.clean(row(Map.of(
                SourceColumns.SERVICE_REQUEST_NUMBER, "A1",
                SourceColumns.CREATED_DATE, "02/30/2021 10:00:00 AM")));

        assertNull(r.getCreatedDate());
        assertNull(r.getYear());
        assertNull(r.getDay());
    }

    @Test
    void parsesTheSupportedTimestampForms() {
        LocalDateTime expected = LocalDateTime.of(2022, 11, 5, 9, 30);

        assertEquals(expected, RecordCleaner.parseTimestamp("2022-11-05T09:30:00"));
        assertEquals(expected, RecordCleaner.parseTimestamp("2022-11-05T09:30:00.000"));
        assertEquals(expected, RecordCleaner.parseTimestamp("2022-11-05 09:30:00"));
        assertEquals(expected, RecordCleaner.parseTimestamp("2022-11-05 09:30"));
        assertEquals(expected, RecordCleaner.parseTimestamp("11/05/2022 09:30:00 AM"));
        assertEquals(expected, RecordCleaner.parseTimestamp("11/05/2022 09:30"));
        assertEquals(expected, RecordCleaner.parseTimestamp("2022-11-05T09:30:00-08:00"));
        assertEquals(expected.toLocalDate().atStartOfDay(), RecordCleaner.parseTimestamp("2022-11-05"));
        assertEquals(expected.toLocalDate().atStartOfDay(), RecordCleaner.parseTimestamp("11/05/2022"));
        assertNull(RecordCleaner.parseTimestamp("2022-13-45"));
        assertNull(RecordCleaner.parseTimestamp("02/30/2021 10:00:00 AM"));
        assertNull(RecordCleaner.parseTimestamp("2021-04-31 10:00:00"));
        assertNull(RecordCleaner.parseTimestamp("02/30/2021"));
        assertNull(RecordCleaner.parseTimestamp("2021-02-29"));
        assertNull(RecordCleaner.parseTimestamp(null));
    }

    @Test
    void extractsFirstFiveDigitRun() {
        assertEquals("98118", RecordCleaner.extractZip("WA 98118"));
        assertEquals("01234", RecordCleaner.extractZip("01234"));
        assertNull(RecordCleaner.extractZip("9811"));
        assertNull(RecordCleaner.extractZip(null));
    }

    @Test
    void neverDropsRows() {
        List<CleanRecord> cleaned = cleaner.clean(List.of(
                row(Map.of()),
                row(Map.of(SourceColumns.CREATED_DATE, "garbage")),
                row(Map.of(SourceColumns.SERVICE_REQUEST_NUMBER, "3"))));

        assertThat(cleaned).hasSize(3);
    }

    private static RawRecord row(Map<String, String> values) {
        return RawRecord.of(new HashMap<>(values));
    }
}

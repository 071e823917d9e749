package com.civicintel.dumping.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A service request after field-level cleaning.
 *
 * Every field is nullable: a value that could not be parsed is absent, never
 * defaulted. The only substituted values are the "Unknown" placeholders on the
 * categorical columns listed in {@link SourceColumns#UNKNOWN_FILLED}.
 */
@Value
@Builder(toBuilder = true)
public class CleanRecord {

    String serviceRequestNumber;
    LocalDateTime createdDate;
    String methodReceived;
    String status;
    String location;
    Double latitude;
    Double longitude;

    /** Five-digit code, kept as text to preserve leading zeros. */
    String zipCode;

    Integer councilDistrict;
    String policePrecinct;
    String violationLocatedAt;
    String dumpingDescription;

    // ── Derived from createdDate ────────────────────────────────────────────
    Integer year;
    Integer month;
    Integer day;
    String weekday;
    Integer hour;

    /** Remaining source columns, normalized but untyped, in header order. */
    @Singular("otherField")
    Map<String, String> otherFields;

    /** Typed columns that appeared in the source header. */
    @Singular("presentColumn")
    Set<String> presentColumns;

    /**
     * Flattened view of every retained column, in a stable order. Used for the
     * data quality summary, where nulls and whole-row duplicates are counted.
     * A typed column is listed only when the source header carried it;
     * Created Date and its derived parts are always listed.
     */
    public Map<String, Object> columns() {
        Map<String, Object> cols = new LinkedHashMap<>();
        putIfPresent(cols, SourceColumns.SERVICE_REQUEST_NUMBER, serviceRequestNumber);
        cols.put(SourceColumns.CREATED_DATE, createdDate);
        putIfPresent(cols, SourceColumns.METHOD_RECEIVED, methodReceived);
        putIfPresent(cols, SourceColumns.STATUS, status);
        putIfPresent(cols, SourceColumns.LOCATION, location);
        putIfPresent(cols, SourceColumns.LATITUDE, latitude);
        putIfPresent(cols, SourceColumns.LONGITUDE, longitude);
        putIfPresent(cols, SourceColumns.ZIP_CODE, zipCode);
        putIfPresent(cols, SourceColumns.COUNCIL_DISTRICT, councilDistrict);
        putIfPresent(cols, SourceColumns.POLICE_PRECINCT, policePrecinct);
        putIfPresent(cols, SourceColumns.VIOLATION_LOCATED_AT, violationLocatedAt);
        putIfPresent(cols, SourceColumns.DUMPING_DESCRIPTION, dumpingDescription);
        cols.putAll(otherFields);
        cols.put("Year", year);
        cols.put("Month", month);
        cols.put("Day", day);
        cols.put("Weekday", weekday);
        cols.put("Hour", hour);
        return cols;
    }

    private void putIfPresent(Map<String, Object> cols, String column, Object value) {
        if (presentColumns.contains(column)) {
            cols.put(column, value);
        }
    }
}

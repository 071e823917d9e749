package com.civicintel.dumping.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One row of the source extract exactly as read, keyed by header name.
 * Kept separate from {@link CleanRecord} so the loose CSV shape never leaks
 * past the cleaner.
 */
@ToString
@EqualsAndHashCode
public class RawRecord {

    private final Map<String, String> values;

    public RawRecord(Map<String, String> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /** Value for a column, or null when the column is missing from the file. */
    public String get(String column) {
        return values.get(column);
    }

    public Map<String, String> values() {
        return values;
    }

    public static RawRecord of(Map<String, String> values) {
        return new RawRecord(values);
    }
}

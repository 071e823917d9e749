package com.civicintel.dumping.service;

import lombok.Getter;

/** A dimension table has the same natural key on more than one row. */
@Getter
public class DuplicateDimensionKeyException extends StarSchemaValidationException {

    private final String table;
    private final String keyColumn;

    public DuplicateDimensionKeyException(String table, String keyColumn, long duplicates) {
        super("dimension-key-uniqueness", duplicates,
                String.format("%s has %d duplicate %s values.", table, duplicates, keyColumn));
        this.table = table;
        this.keyColumn = keyColumn;
    }
}

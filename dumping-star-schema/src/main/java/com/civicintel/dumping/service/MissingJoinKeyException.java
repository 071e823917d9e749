package com.civicintel.dumping.service;

import lombok.Getter;

/** A fact row has no value for one of the dimension join keys. */
@Getter
public class MissingJoinKeyException extends StarSchemaValidationException {

    private final String keyColumn;

    public MissingJoinKeyException(String keyColumn, long nulls) {
        super("join-key-completeness", nulls,
                String.format("Null join keys found in fact: %s has %d nulls.", keyColumn, nulls));
        this.keyColumn = keyColumn;
    }
}

package com.civicintel.dumping.service;

/** More than one fact row for the same service request number. */
public class FactGrainViolationException extends StarSchemaValidationException {

    public FactGrainViolationException(long duplicates) {
        super("fact-grain", duplicates,
                String.format("Fact grain broken: %d duplicate ServiceRequestNumber values found.", duplicates));
    }
}

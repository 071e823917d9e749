package com.civicintel.dumping.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DimCategory {

    String violationLocatedAt;
    String dumpingDescription;

    /** UPPER(violationLocatedAt) + "|" + UPPER(dumpingDescription) */
    String categoryKey;
}

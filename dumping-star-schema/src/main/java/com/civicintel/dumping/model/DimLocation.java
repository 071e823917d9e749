package com.civicintel.dumping.model;

import lombok.Builder;
import lombok.Value;

/**
 * One row per distinct location key. Attributes come from the first fact
 * record (in input order) that produced the key.
 */
@Value
@Builder
public class DimLocation {

    String locationKey;
    String location;
    Double latitude;
    Double longitude;
    String zipCode;
    String policePrecinct;
    Integer councilDistrict;
}

package com.civicintel.dumping.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Fact row. Grain: one row per service request.
 *
 * Dimensions are referenced by natural key: {@code createdDate} joins dim_date,
 * {@code locationKey} dim_location, {@code categoryKey} dim_category,
 * {@code methodReceived} dim_intake and {@code status} dim_status.
 */
@Value
@Builder
public class FactIllegalDumping {

    String serviceRequestNumber;
    LocalDateTime createdDateTime;

    /** createdDateTime truncated to the day, for date-table relationships */
    LocalDate createdDate;

    String methodReceived;
    String status;
    String policePrecinct;
    Integer councilDistrict;
    String zipCode;
    String violationLocatedAt;
    String dumpingDescription;
    String locationKey;
    String categoryKey;
}

package com.civicintel.dumping.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/** Calendar row, one per distinct fact date. */
@Value
@Builder
public class DimDate {

    LocalDate date;
    int year;
    int monthNumber;
    String monthName;

    /** Monday = 0 ... Sunday = 6 */
    int dayOfWeekNumber;

    String dayOfWeekName;

    /** ISO-8601 week number */
    int weekOfYear;
}

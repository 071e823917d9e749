package com.civicintel.dumping.model;

import java.util.List;

/**
 * Header names of the Seattle illegal dumping extract.
 * Columns are always looked up by name, never by position.
 */
public final class SourceColumns {

    public static final String SERVICE_REQUEST_NUMBER = "Service Request Number";
    public static final String CREATED_DATE           = "Created Date";
    public static final String METHOD_RECEIVED        = "Method Received";
    public static final String STATUS                 = "Status";
    public static final String LOCATION               = "Location";
    public static final String LATITUDE               = "Latitude";
    public static final String LONGITUDE              = "Longitude";
    public static final String ZIP_CODE               = "ZIP Code";
    public static final String COUNCIL_DISTRICT       = "Council District";
    public static final String POLICE_PRECINCT        = "Police Precinct";
    public static final String VIOLATION_LOCATED_AT   = "Where is the Illegal Dumping Violation located?";
    public static final String DUMPING_DESCRIPTION    = "Choose a description of the Illegal Dumping";

    /** Over 75% empty in the source; removed during cleaning. */
    public static final String COMMUNITY_REPORTING_AREA = "Community Reporting Area";

    /** Columns that get the literal "Unknown" instead of staying absent. */
    public static final List<String> UNKNOWN_FILLED = List.of(
            POLICE_PRECINCT,
            STATUS,
            METHOD_RECEIVED,
            VIOLATION_LOCATED_AT,
            DUMPING_DESCRIPTION,
            LOCATION
    );

    /** Columns the cleaner parses into typed fields; everything else is carried as text. */
    public static final List<String> TYPED = List.of(
            SERVICE_REQUEST_NUMBER, CREATED_DATE, METHOD_RECEIVED, STATUS, LOCATION,
            LATITUDE, LONGITUDE, ZIP_CODE, COUNCIL_DISTRICT, POLICE_PRECINCT,
            VIOLATION_LOCATED_AT, DUMPING_DESCRIPTION
    );

    public static final String UNKNOWN = "Unknown";

    private SourceColumns() {
    }
}

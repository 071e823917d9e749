package com.civicintel.dumping.model;

/** Export names of the star schema tables; each becomes {name}.csv. */
public final class TableNames {

    public static final String FACT_TABLE   = "fact_illegal_dumping";
    public static final String DIM_DATE     = "dim_date";
    public static final String DIM_LOCATION = "dim_location";
    public static final String DIM_CATEGORY = "dim_category";
    public static final String DIM_INTAKE   = "dim_intake";
    public static final String DIM_STATUS   = "dim_status";

    private TableNames() {
    }
}

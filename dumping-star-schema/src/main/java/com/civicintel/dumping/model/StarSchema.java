package com.civicintel.dumping.model;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The modeled tables: one fact, five dimensions. Lists are unmodifiable and
 * owned by whoever holds this object; nothing mutates them after modeling.
 */
@Value
@Builder
public class StarSchema {

    List<FactIllegalDumping> fact;
    List<DimDate> dimDate;
    List<DimLocation> dimLocation;
    List<DimCategory> dimCategory;
    List<DimIntake> dimIntake;
    List<DimStatus> dimStatus;

    /** Row count per table, fact first, in export order. */
    public Map<String, Integer> rowCounts() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        counts.put(TableNames.FACT_TABLE, fact.size());
        counts.put(TableNames.DIM_DATE, dimDate.size());
        counts.put(TableNames.DIM_LOCATION, dimLocation.size());
        counts.put(TableNames.DIM_CATEGORY, dimCategory.size());
        counts.put(TableNames.DIM_INTAKE, dimIntake.size());
        counts.put(TableNames.DIM_STATUS, dimStatus.size());
        return counts;
    }
}

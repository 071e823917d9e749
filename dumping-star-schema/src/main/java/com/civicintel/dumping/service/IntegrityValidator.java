package com.civicintel.dumping.service;

import com.civicintel.dumping.model.DimCategory;
import com.civicintel.dumping.model.DimLocation;
import com.civicintel.dumping.model.FactIllegalDumping;
import com.civicintel.dumping.model.StarSchema;
import com.civicintel.dumping.model.TableNames;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Gates run in order, the first failure throws:
 *  1. fact grain: ServiceRequestNumber is unique (nulls count as equal)
 *  2. join keys: LocationKey and CategoryKey are set on every fact row
 *  3. dimension keys: unique in dim_location and dim_category
 */
@Component
@Slf4j
public class IntegrityValidator {

    public void validate(StarSchema schema) {
        List<FactIllegalDumping> fact = schema.getFact();

        long duplicateRequests = countDuplicates(fact, FactIllegalDumping::getServiceRequestNumber);
        if (duplicateRequests > 0) {
            throw new FactGrainViolationException(duplicateRequests);
        }

        requireJoinKey(fact, "LocationKey", FactIllegalDumping::getLocationKey);
        requireJoinKey(fact, "CategoryKey", FactIllegalDumping::getCategoryKey);

        long duplicateLocations = countDuplicates(schema.getDimLocation(), DimLocation::getLocationKey);
        if (duplicateLocations > 0) {
            throw new DuplicateDimensionKeyException(TableNames.DIM_LOCATION, "LocationKey", duplicateLocations);
        }
        long duplicateCategories = countDuplicates(schema.getDimCategory(), DimCategory::getCategoryKey);
        if (duplicateCategories > 0) {
            throw new DuplicateDimensionKeyException(TableNames.DIM_CATEGORY, "CategoryKey", duplicateCategories);
        }

        log.info("Integrity checks passed: {} fact rows, grain and join keys OK", fact.size());
    }

    private static void requireJoinKey(List<FactIllegalDumping> fact, String column,
                                       Function<FactIllegalDumping, String> key) {
        long nulls = fact.stream().map(key).filter(Objects::isNull).count();
        if (nulls > 0) {
            throw new MissingJoinKeyException(column, nulls);
        }
    }

    /** Rows whose key already appeared on an earlier row. */
    static <T> long countDuplicates(List<T> rows, Function<T, String> key) {
        Set<String> seen = new HashSet<>();
        long duplicates = 0;
        for (T row : rows) {
            if (!seen.add(key.apply(row))) duplicates++;
        }
        return duplicates;
    }
}

package com.civicintel.dumping.service;

import com.civicintel.dumping.model.CleanRecord;
import com.civicintel.dumping.model.DimCategory;
import com.civicintel.dumping.model.DimDate;
import com.civicintel.dumping.model.DimIntake;
import com.civicintel.dumping.model.DimLocation;
import com.civicintel.dumping.model.DimStatus;
import com.civicintel.dumping.model.FactIllegalDumping;
import com.civicintel.dumping.model.StarSchema;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.TextStyle;
import java.time.temporal.IsoFields;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Splits the cleaned record set into the fact table and five dimensions.
 *
 * Design notes:
 *  - grain is one fact row per input record, in input order
 *  - dimensions join on natural keys, no surrogate ids
 *  - dim_location keeps the first record seen for each key; no attempt is
 *    made to pick a "better" address variant
 *  - the category key is built by {@link #categoryKey(String, String)} for
 *    both the fact and dim_category, so the two always agree
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DimensionalModeler {

    static final String CATEGORY_KEY_SEPARATOR = "|";

    private final LocationKeyResolver locationKeyResolver;

    public StarSchema build(List<CleanRecord> records) {
        List<FactIllegalDumping> fact = buildFact(records);

        StarSchema schema = StarSchema.builder()
                .fact(List.copyOf(fact))
                .dimDate(buildDimDate(fact))
                .dimLocation(buildDimLocation(records, fact))
                .dimCategory(buildDimCategory(fact))
                .dimIntake(distinctSorted(fact, FactIllegalDumping::getMethodReceived).stream()
                        .map(DimIntake::new)
                        .toList())
                .dimStatus(distinctSorted(fact, FactIllegalDumping::getStatus).stream()
                        .map(DimStatus::new)
                        .toList())
                .build();

        log.info("Modeled star schema: {}", schema.rowCounts());
        return schema;
    }

    /**
     * Composite category key. Null when either part is absent, which the
     * integrity check then reports as a missing join key.
     */
    public static String categoryKey(String violationLocatedAt, String dumpingDescription) {
        String left = FieldNormalizer.normalizeKeyText(violationLocatedAt);
        String right = FieldNormalizer.normalizeKeyText(dumpingDescription);
        if (left == null || right == null) return null;
        return left + CATEGORY_KEY_SEPARATOR + right;
    }

    // ── Fact ─────────────────────────────────────────────────────────────────

    private List<FactIllegalDumping> buildFact(List<CleanRecord> records) {
        List<FactIllegalDumping> fact = new ArrayList<>(records.size());

        for (CleanRecord r : records) {
            String violation = FieldNormalizer.normalizeText(r.getViolationLocatedAt());
            String description = FieldNormalizer.normalizeText(r.getDumpingDescription());

            fact.add(FactIllegalDumping.builder()
                    .serviceRequestNumber(FieldNormalizer.normalizeText(r.getServiceRequestNumber()))
                    .createdDateTime(r.getCreatedDate())
                    .createdDate(r.getCreatedDate() != null ? r.getCreatedDate().toLocalDate() : null)
                    .methodReceived(FieldNormalizer.normalizeText(r.getMethodReceived()))
                    .status(FieldNormalizer.normalizeText(r.getStatus()))
                    .policePrecinct(FieldNormalizer.normalizeText(r.getPolicePrecinct()))
                    .councilDistrict(r.getCouncilDistrict())
                    .zipCode(r.getZipCode())
                    .violationLocatedAt(violation)
                    .dumpingDescription(description)
                    .locationKey(locationKeyResolver.resolve(r.getLocation(), r.getLatitude(), r.getLongitude()))
                    .categoryKey(categoryKey(violation, description))
                    .build());
        }
        return fact;
    }

    // ── Dimensions ───────────────────────────────────────────────────────────

    private List<DimDate> buildDimDate(List<FactIllegalDumping> fact) {
        Set<LocalDate> dates = new TreeSet<>();
        for (FactIllegalDumping f : fact) {
            if (f.getCreatedDate() != null) dates.add(f.getCreatedDate());
        }

        return dates.stream()
                .map(DimensionalModeler::toDimDate)
                .toList();
    }

    static DimDate toDimDate(LocalDate date) {
        return DimDate.builder()
                .date(date)
                .year(date.getYear())
                .monthNumber(date.getMonthValue())
                .monthName(date.getMonth().getDisplayName(TextStyle.FULL, Locale.ENGLISH))
                .dayOfWeekNumber(date.getDayOfWeek().getValue() - 1)
                .dayOfWeekName(date.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH))
                .weekOfYear(date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR))
                .build();
    }

    /** Fact and records are parallel lists; the fact row supplies the key. */
    private List<DimLocation> buildDimLocation(List<CleanRecord> records, List<FactIllegalDumping> fact) {
        Map<String, DimLocation> byKey = new LinkedHashMap<>();

        for (int i = 0; i < records.size(); i++) {
            String key = fact.get(i).getLocationKey();
            if (key == null || byKey.containsKey(key)) continue;

            CleanRecord r = records.get(i);
            byKey.put(key, DimLocation.builder()
                    .locationKey(key)
                    .location(FieldNormalizer.normalizeText(r.getLocation()))
                    .latitude(r.getLatitude())
                    .longitude(r.getLongitude())
                    .zipCode(r.getZipCode())
                    .policePrecinct(FieldNormalizer.normalizeText(r.getPolicePrecinct()))
                    .councilDistrict(r.getCouncilDistrict())
                    .build());
        }
        return List.copyOf(byKey.values());
    }

    /** Distinct (violation, description) pairs in first-seen order. */
    private List<DimCategory> buildDimCategory(List<FactIllegalDumping> fact) {
        Set<List<String>> pairs = new LinkedHashSet<>();
        for (FactIllegalDumping f : fact) {
            pairs.add(Arrays.asList(f.getViolationLocatedAt(), f.getDumpingDescription()));
        }

        return pairs.stream()
                .map(pair -> DimCategory.builder()
                        .violationLocatedAt(pair.get(0))
                        .dumpingDescription(pair.get(1))
                        .categoryKey(categoryKey(pair.get(0), pair.get(1)))
                        .build())
                .toList();
    }

    private static List<String> distinctSorted(List<FactIllegalDumping> fact,
                                               Function<FactIllegalDumping, String> column) {
        return fact.stream()
                .map(column)
                .filter(Objects::nonNull)
                .distinct()
                .sorted()
                .toList();
    }
}

package com.civicintel.dumping.service;

import com.civicintel.dumping.model.CleanRecord;
import com.civicintel.dumping.model.RawRecord;
import com.civicintel.dumping.model.SourceColumns;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw extract rows into {@link CleanRecord}s.
 *
 * Cleaning is field-level only: a row is never dropped, a bad field just
 * becomes null. The steps run in a fixed order because the Unknown fill and
 * the derived date parts depend on the earlier conversions.
 */
@Component
@Slf4j
public class RecordCleaner {

    private static final Pattern ZIP_PATTERN = Pattern.compile("(\\d{5})");

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            pattern("uuuu-MM-dd HH:mm[:ss][.SSS]"),
            pattern("MM/dd/uuuu hh:mm[:ss] a"),
            pattern("M/d/uuuu h:mm[:ss] a"),
            pattern("MM/dd/uuuu HH:mm[:ss]")
    );

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            pattern("MM/dd/uuuu"),
            pattern("M/d/uuuu")
    );

    public List<CleanRecord> clean(List<RawRecord> rows) {
        List<CleanRecord> cleaned = new ArrayList<>(rows.size());
        int badDates = 0;

        for (RawRecord row : rows) {
            CleanRecord record = clean(row);
            if (record.getCreatedDate() == null && FieldNormalizer.normalizeText(row.get(SourceColumns.CREATED_DATE)) != null) {
                badDates++;
            }
            cleaned.add(record);
        }

        log.info("Cleaned {} records ({} unparsable created dates set to null)", cleaned.size(), badDates);
        return cleaned;
    }

    public CleanRecord clean(RawRecord row) {
        // 1. Timestamp
        LocalDateTime created = parseTimestamp(row.get(SourceColumns.CREATED_DATE));

        // 2-4. Geography
        String zip = extractZip(row.get(SourceColumns.ZIP_CODE));
        Integer district = parseInteger(row.get(SourceColumns.COUNCIL_DISTRICT));
        Double lat = LocationKeyResolver.parseCoordinate(row.get(SourceColumns.LATITUDE));
        Double lon = LocationKeyResolver.parseCoordinate(row.get(SourceColumns.LONGITUDE));
        if (LocationKeyResolver.isNullIsland(lat, lon)) {
            lat = null;
            lon = null;
        }

        // 5-7. Text, dropped column, Unknown fill
        CleanRecord.CleanRecordBuilder builder = CleanRecord.builder()
                .serviceRequestNumber(FieldNormalizer.normalizeText(row.get(SourceColumns.SERVICE_REQUEST_NUMBER)))
                .createdDate(created)
                .methodReceived(textOrUnknown(row, SourceColumns.METHOD_RECEIVED))
                .status(textOrUnknown(row, SourceColumns.STATUS))
                .location(textOrUnknown(row, SourceColumns.LOCATION))
                .latitude(lat)
                .longitude(lon)
                .zipCode(zip)
                .councilDistrict(district)
                .policePrecinct(textOrUnknown(row, SourceColumns.POLICE_PRECINCT))
                .violationLocatedAt(textOrUnknown(row, SourceColumns.VIOLATION_LOCATED_AT))
                .dumpingDescription(textOrUnknown(row, SourceColumns.DUMPING_DESCRIPTION));

        for (Map.Entry<String, String> col : row.values().entrySet()) {
            String name = col.getKey();
            if (SourceColumns.TYPED.contains(name)) {
                builder.presentColumn(name);
                continue;
            }
            if (SourceColumns.COMMUNITY_REPORTING_AREA.equals(name)) {
                continue;
            }
            builder.otherField(name, FieldNormalizer.normalizeText(col.getValue()));
        }

        // 8. Date parts
        if (created != null) {
            builder.year(created.getYear())
                    .month(created.getMonthValue())
                    .day(created.getDayOfMonth())
                    .weekday(created.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH))
                    .hour(created.getHour());
        }

        return builder.build();
    }

    // ── Field conversions (null on failure, never throw) ─────────────────────

    static LocalDateTime parseTimestamp(String value) {
        String text = FieldNormalizer.normalizeText(value);
        if (text == null) return null;

        for (DateTimeFormatter format : DATE_TIME_FORMATS) {
            LocalDateTime parsed = tryParse(text, format);
            if (parsed != null) return parsed;
        }
        try {
            return OffsetDateTime.parse(text).toLocalDateTime();
        } catch (DateTimeParseException e) {
            log.trace("Not an offset date-time: {}", text);
        }
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return LocalDate.parse(text, format).atStartOfDay();
            } catch (DateTimeParseException e) {
                log.trace("Not a {} date: {}", format, text);
            }
        }

        log.debug("Could not parse created date: {}", text);
        return null;
    }

    private static LocalDateTime tryParse(String text, DateTimeFormatter format) {
        try {
            return LocalDateTime.parse(text, format);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    static String extractZip(String value) {
        String text = FieldNormalizer.normalizeText(value);
        if (text == null) return null;
        Matcher m = ZIP_PATTERN.matcher(text);
        return m.find() ? m.group(1) : null;
    }

    /** "7" and "7.0" are district 7; "7.5", "", "N/A" are absent. */
    static Integer parseInteger(String value) {
        String text = FieldNormalizer.normalizeText(value);
        if (text == null) return null;
        try {
            BigDecimal number = new BigDecimal(text);
            if (number.stripTrailingZeros().scale() > 0) return null;
            return number.intValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            return null;
        }
    }

    private static String textOrUnknown(RawRecord row, String column) {
        String text = FieldNormalizer.normalizeText(row.get(column));
        return text != null ? text : SourceColumns.UNKNOWN;
    }

    /** Strict: 02/30 is rejected rather than clamped to the month end. */
    private static DateTimeFormatter pattern(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.US)
                .withResolverStyle(ResolverStyle.STRICT);
    }
}

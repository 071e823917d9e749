package com.civicintel.dumping.output;

import com.civicintel.dumping.config.StarSchemaProperties;
import com.civicintel.dumping.model.DimCategory;
import com.civicintel.dumping.model.DimDate;
import com.civicintel.dumping.model.DimLocation;
import com.civicintel.dumping.model.FactIllegalDumping;
import com.civicintel.dumping.model.StarSchema;
import com.civicintel.dumping.model.TableNames;
import com.civicintel.dumping.service.StarSchemaIoException;
import com.opencsv.CSVWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.function.Function;

/**
 * Writes each star schema table to its own CSV file.
 *
 * Output path pattern: {exportDir}/{table}.csv
 * e.g. exports/fact_illegal_dumping.csv, exports/dim_location.csv
 *
 * Null cells are written empty. Output is fully determined by the tables,
 * so identical input gives byte-identical files.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class StarSchemaCsvWriter {

    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    static final String[] FACT_HEADERS = {
            "ServiceRequestNumber", "CreatedDateTime", "CreatedDate",
            "MethodReceived", "Status", "PolicePrecinct", "CouncilDistrict", "ZIPCode",
            "ViolationLocatedAt", "DumpingDescription",
            "LocationKey", "CategoryKey"
    };
    static final String[] DATE_HEADERS = {
            "Date", "Year", "MonthNumber", "MonthName",
            "DayOfWeekNumber", "DayOfWeekName", "WeekOfYear"
    };
    static final String[] LOCATION_HEADERS = {
            "LocationKey", "Location", "Latitude", "Longitude",
            "ZIPCode", "PolicePrecinct", "CouncilDistrict"
    };
    static final String[] CATEGORY_HEADERS = {"ViolationLocatedAt", "DumpingDescription", "CategoryKey"};
    static final String[] INTAKE_HEADERS = {"MethodReceived"};
    static final String[] STATUS_HEADERS = {"Status"};

    private final StarSchemaProperties properties;

    /** Writes all six tables into exportDir, creating it if needed. */
    public void write(StarSchema schema, Path exportDir) {
        ensureDirectory(exportDir);

        writeTable(exportDir, TableNames.FACT_TABLE, FACT_HEADERS, schema.getFact(), this::toRow);
        writeTable(exportDir, TableNames.DIM_DATE, DATE_HEADERS, schema.getDimDate(), this::toRow);
        writeTable(exportDir, TableNames.DIM_LOCATION, LOCATION_HEADERS, schema.getDimLocation(), this::toRow);
        writeTable(exportDir, TableNames.DIM_CATEGORY, CATEGORY_HEADERS, schema.getDimCategory(), this::toRow);
        writeTable(exportDir, TableNames.DIM_INTAKE, INTAKE_HEADERS, schema.getDimIntake(),
                d -> new String[]{str(d.getMethodReceived())});
        writeTable(exportDir, TableNames.DIM_STATUS, STATUS_HEADERS, schema.getDimStatus(),
                d -> new String[]{str(d.getStatus())});
    }

    public static Path tablePath(Path exportDir, String table) {
        return exportDir.resolve(table + ".csv");
    }

    private <T> void writeTable(Path exportDir, String table, String[] headers,
                                List<T> rows, Function<T, String[]> toRow) {
        Path outputPath = tablePath(exportDir, table);

        try (CSVWriter writer = new CSVWriter(
                Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8),
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END)) {

            if (properties.getOutput().isIncludeHeader()) {
                writer.writeNext(headers);
            }

            for (T row : rows) {
                writer.writeNext(toRow.apply(row));
            }

            log.info("Written {} rows to CSV: {}", rows.size(), outputPath);

        } catch (IOException e) {
            log.error("Failed to write CSV file {}: {}", outputPath, e.getMessage(), e);
            throw new StarSchemaIoException("CSV write failed: " + outputPath, e);
        }
    }

    private String[] toRow(FactIllegalDumping f) {
        return new String[]{
                str(f.getServiceRequestNumber()),
                f.getCreatedDateTime() != null ? f.getCreatedDateTime().format(DATE_TIME) : "",
                str(f.getCreatedDate()),
                str(f.getMethodReceived()),
                str(f.getStatus()),
                str(f.getPolicePrecinct()),
                str(f.getCouncilDistrict()),
                str(f.getZipCode()),
                str(f.getViolationLocatedAt()),
                str(f.getDumpingDescription()),
                str(f.getLocationKey()),
                str(f.getCategoryKey())
        };
    }

    private String[] toRow(DimDate d) {
        return new String[]{
                str(d.getDate()),
                str(d.getYear()),
                str(d.getMonthNumber()),
                str(d.getMonthName()),
                str(d.getDayOfWeekNumber()),
                str(d.getDayOfWeekName()),
                str(d.getWeekOfYear())
        };
    }

    private String[] toRow(DimLocation d) {
        return new String[]{
                str(d.getLocationKey()),
                str(d.getLocation()),
                str(d.getLatitude()),
                str(d.getLongitude()),
                str(d.getZipCode()),
                str(d.getPolicePrecinct()),
                str(d.getCouncilDistrict())
        };
    }

    private String[] toRow(DimCategory d) {
        return new String[]{
                str(d.getViolationLocatedAt()),
                str(d.getDumpingDescription()),
                str(d.getCategoryKey())
        };
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StarSchemaIoException("Cannot create output directory: " + dir, e);
        }
    }
}

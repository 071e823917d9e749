package com.civicintel.dumping.service;

import com.civicintel.dumping.model.RawRecord;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.RFC4180ParserBuilder;
import com.opencsv.exceptions.CsvValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the whole illegal dumping extract into memory.
 *
 * Columns are addressed by header name. A row shorter than the header leaves
 * its trailing columns null; a row longer than the header has the extra cells
 * ignored. Blank lines are skipped. Quoting follows RFC 4180, so a backslash
 * is an ordinary character.
 */
@Component
@Slf4j
public class RawCsvReader {

    private static final char BOM = '\uFEFF';

    public List<RawRecord> read(Path input) {
        log.info("Reading {}", input.toAbsolutePath());

        try (Reader reader = Files.newBufferedReader(input, StandardCharsets.UTF_8);
             CSVReader csv = new CSVReaderBuilder(reader)
                     .withCSVParser(new RFC4180ParserBuilder().build())
                     .build()) {
            return read(csv);
        } catch (IOException | CsvValidationException e) {
            log.error("Failed to read input CSV {}: {}", input, e.getMessage(), e);
            throw new StarSchemaIoException("Cannot read input CSV: " + input, e);
        }
    }

    List<RawRecord> read(CSVReader csv) throws IOException, CsvValidationException {
        String[] header = csv.readNext();
        if (header == null) {
            log.warn("Input has no header row, nothing to read");
            return List.of();
        }
        header = cleanHeader(header);

        List<RawRecord> records = new ArrayList<>();
        int shortRows = 0;
        String[] cols;
        while ((cols = csv.readNext()) != null) {
            if (isBlank(cols)) continue;
            if (cols.length < header.length) shortRows++;

            Map<String, String> values = new LinkedHashMap<>();
            for (int i = 0; i < header.length; i++) {
                values.put(header[i], i < cols.length ? cols[i] : null);
            }
            records.add(RawRecord.of(values));
        }

        log.info("Read {} rows, {} columns ({} short rows padded with nulls)",
                records.size(), header.length, shortRows);
        return records;
    }

    private static String[] cleanHeader(String[] header) {
        String[] cleaned = new String[header.length];
        for (int i = 0; i < header.length; i++) {
            String name = header[i] == null ? "" : header[i];
            if (i == 0 && !name.isEmpty() && name.charAt(0) == BOM) {
                name = name.substring(1);
            }
            cleaned[i] = name.strip();
        }
        return cleaned;
    }

    private static boolean isBlank(String[] cols) {
        for (String col : cols) {
            if (col != null && !col.isBlank()) return false;
        }
        return true;
    }
}

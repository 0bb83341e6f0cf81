package com.microservices.processor.service;

import com.microservices.processor.model.HousingPriceRow;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses the housing price index dataset.
 *
 * Header-driven; the four columns below must be present in any order, extra columns
 * are ignored. A single bad row fails the whole file. Surrounding spaces are tolerated
 * around the date and the index value only.
 *
 *   tarih                    ISO date, e.g. 2010-01-01
 *   istanbul_turkiye         region label, e.g. İstanbul / Türkiye
 *   yeni_yeni_olmayan_konut  housing category, e.g. Yeni Konut
 *   fiyat_endeksi            index value, e.g. 35.9
 */
@Component
public class HousingCsvParser {

    static final String COL_DATE = "tarih";
    static final String COL_LOCATION = "istanbul_turkiye";
    static final String COL_TYPE = "yeni_yeni_olmayan_konut";
    static final String COL_INDEX = "fiyat_endeksi";

    private static final List<String> REQUIRED_COLUMNS = List.of(COL_DATE, COL_LOCATION, COL_TYPE, COL_INDEX);

    private static final char BOM = '\uFEFF';

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreEmptyLines(true)
            .setAllowMissingColumnNames(true)
            .build();

    public List<HousingPriceRow> parse(Reader reader) {
        try (CSVParser parser = FORMAT.parse(reader)) {
            List<String> headers = parser.getHeaderNames();
            if (headers.isEmpty()) {
                return List.of();
            }

            Map<String, String> columns = resolveColumns(headers);
            List<HousingPriceRow> rows = new ArrayList<>();
            for (CSVRecord record : parser) {
                rows.add(toRow(record, columns));
            }
            return rows;
        } catch (IOException | UncheckedIOException e) {
            throw new HousingImportException("could not read CSV: " + e.getMessage(), e);
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new HousingImportException("malformed CSV: " + e.getMessage(), e);
        }
    }

    /**
     * Maps each required column to the header name as it appears in the file, which may
     * carry a byte order mark on the first column.
     */
    private Map<String, String> resolveColumns(List<String> headers) {
        Map<String, String> byName = new LinkedHashMap<>();
        for (String header : headers) {
            String normalised = header.isEmpty() || header.charAt(0) != BOM ? header : header.substring(1);
            byName.put(normalised.trim(), header);
        }

        List<String> missing = REQUIRED_COLUMNS.stream()
                .filter(column -> !byName.containsKey(column))
                .toList();
        if (!missing.isEmpty()) {
            throw new HousingImportException("missing required column(s): " + String.join(", ", missing));
        }

        Map<String, String> columns = new LinkedHashMap<>();
        REQUIRED_COLUMNS.forEach(column -> columns.put(column, byName.get(column)));
        return columns;
    }

    private HousingPriceRow toRow(CSVRecord record, Map<String, String> columns) {
        // labels are part of the natural key and are stored as given
        String date = field(record, columns, COL_DATE).strip();
        String location = field(record, columns, COL_LOCATION);
        String type = field(record, columns, COL_TYPE);
        String index = field(record, columns, COL_INDEX).strip();

        return new HousingPriceRow(parseDate(date, record), location, type, parseIndex(index, record));
    }

    private String field(CSVRecord record, Map<String, String> columns, String column) {
        String header = columns.get(column);
        if (!record.isSet(header)) {
            throw new HousingImportException(
                    "record %d: missing value for %s".formatted(record.getRecordNumber(), column));
        }
        return record.get(header);
    }

    private LocalDate parseDate(String value, CSVRecord record) {
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new HousingImportException(
                    "record %d: invalid date '%s'".formatted(record.getRecordNumber(), value), e);
        }
    }

    private double parseIndex(String value, CSVRecord record) {
        try {
            double parsed = Double.parseDouble(value);
            if (Double.isFinite(parsed)) {
                return parsed;
            }
        } catch (NumberFormatException e) {
            throw new HousingImportException(
                    "record %d: could not convert string to float: '%s'".formatted(record.getRecordNumber(), value), e);
        }
        throw new HousingImportException(
                "record %d: index value must be finite: '%s'".formatted(record.getRecordNumber(), value));
    }
}

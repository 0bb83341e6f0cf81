package com.microservices.processor.service;

import com.microservices.processor.model.HousingPriceRow;
import com.microservices.processor.model.ImportResult;
import com.microservices.processor.repository.HousingPriceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Imports the housing price index CSV, either from request text or from a file.
 * <p>
 * The file is parsed completely before anything is written, then all rows are upserted
 * inside a single transaction. Any failure leaves the table as it was.
 */
@Service
public class HousingImportService {

    private static final Logger log = LoggerFactory.getLogger(HousingImportService.class);

    private final HousingPriceRepository housingPriceRepository;
    private final HousingCsvParser parser;
    private final TransactionTemplate transactionTemplate;
    private final JobMetrics jobMetrics;
    private final int batchSize;

    public HousingImportService(HousingPriceRepository housingPriceRepository,
                                HousingCsvParser parser,
                                TransactionTemplate transactionTemplate,
                                JobMetrics jobMetrics,
                                @Value("${processor.housing.batch-size:1000}") int batchSize) {
        this.housingPriceRepository = housingPriceRepository;
        this.parser = parser;
        this.transactionTemplate = transactionTemplate;
        this.jobMetrics = jobMetrics;
        this.batchSize = batchSize;
    }

    public ImportResult importCsv(String csvData) {
        if (csvData == null || csvData.isBlank()) {
            housingPriceRepository.ensureSchema();
            return ImportResult.empty();
        }
        return importFrom(new StringReader(csvData.strip()), "request body");
    }

    public ImportResult importFile(Path path) {
        log.info("Importing housing data from {}", path);
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return importFrom(reader, path.toString());
        } catch (IOException e) {
            throw new HousingImportException("could not read " + path + ": " + e.getMessage(), e);
        }
    }

    private ImportResult importFrom(Reader reader, String source) {
        housingPriceRepository.ensureSchema();

        List<HousingPriceRow> rows = parser.parse(reader);
        if (rows.isEmpty()) {
            log.info("No housing rows found in {}", source);
            return ImportResult.empty();
        }

        Integer affected = transactionTemplate.execute(status ->
                housingPriceRepository.upsertAll(rows, batchSize));
        int rowsAffected = affected == null ? 0 : affected;

        log.info("Successfully imported {} rows from {}, {} affected", rows.size(), source, rowsAffected);
        jobMetrics.housingRowsCounter("read").increment(rows.size());
        jobMetrics.housingRowsCounter("affected").increment(rowsAffected);

        return new ImportResult(rows.size(), rowsAffected);
    }
}

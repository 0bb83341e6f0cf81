package com.microservices.processor.service;

import com.microservices.processor.model.ImportResult;
import com.microservices.processor.repository.HousingPriceRepository;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Startup hook for the housing table.
 *
 *  1. Always ensures the schema exists.
 *  2. Imports {@code processor.housing.import-file} only when
 *     {@code processor.housing.import-on-startup=true}.
 *
 * Neither step stops the service when it fails.
 */
@Component
public class HousingStartupImporter {

    private static final Logger log = LoggerFactory.getLogger(HousingStartupImporter.class);

    private final HousingPriceRepository housingPriceRepository;
    private final HousingImportService housingImportService;
    private final boolean importOnStartup;
    private final Path importFile;

    public HousingStartupImporter(HousingPriceRepository housingPriceRepository,
                                  HousingImportService housingImportService,
                                  @Value("${processor.housing.import-on-startup:false}") boolean importOnStartup,
                                  @Value("${processor.housing.import-file:data/housing_price_index.csv}") Path importFile) {
        this.housingPriceRepository = housingPriceRepository;
        this.housingImportService = housingImportService;
        this.importOnStartup = importOnStartup;
        this.importFile = importFile;
    }

    @PostConstruct
    public void onStartup() {
        try {
            housingPriceRepository.ensureSchema();
        } catch (DataAccessException e) {
            log.warn("Could not initialise housing schema, will retry on first import: {}", e.getMessage());
        }

        if (!importOnStartup) {
            log.info("Housing startup import disabled");
            return;
        }
        if (!Files.isReadable(importFile)) {
            log.warn("Housing startup import enabled but {} is not readable", importFile);
            return;
        }

        try {
            ImportResult result = housingImportService.importFile(importFile);
            log.info("Startup import of {} finished: {} rows read, {} affected",
                    importFile, result.rowsRead(), result.rowsAffected());
        } catch (RuntimeException e) {
            log.error("Startup import of {} failed: {}", importFile, e.getMessage(), e);
        }
    }
}

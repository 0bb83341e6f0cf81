package com.microservices.processor.controller;

import com.microservices.processor.dto.HousingDataResponse;
import com.microservices.processor.dto.HousingImportRequest;
import com.microservices.processor.dto.HousingImportResponse;
import com.microservices.processor.dto.HousingStatsResponse;
import com.microservices.processor.model.HousingFilter;
import com.microservices.processor.service.HousingImportException;
import com.microservices.processor.service.HousingImportService;
import com.microservices.processor.service.HousingQueryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.time.LocalDate;
import java.util.Optional;

@RestController
@RequestMapping("/api/housing")
public class HousingController {

    private static final Logger log = LoggerFactory.getLogger(HousingController.class);

    private final HousingImportService housingImportService;
    private final HousingQueryService housingQueryService;

    public HousingController(HousingImportService housingImportService,
                             HousingQueryService housingQueryService) {
        this.housingImportService = housingImportService;
        this.housingQueryService = housingQueryService;
    }

    @PostMapping("/import")
    public HousingImportResponse importData(@RequestBody(required = false) HousingImportRequest request) {
        if (request == null || request.csvData() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "missing csv_data field");
        }

        try {
            return HousingImportResponse.from(housingImportService.importCsv(request.csvData()));
        } catch (HousingImportException e) {
            log.error("Error importing housing data: {}", e.getMessage());
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "failed to import data: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Error importing housing data: {}", e.getMessage(), e);
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR,
                    "failed to import data: " + NestedExceptionUtils.getMostSpecificCause(e).getMessage());
        }
    }

    @GetMapping("/data")
    public HousingDataResponse data(
            @RequestParam(required = false) String location,
            @RequestParam(required = false) String type,
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        var filter = new HousingFilter(blankToNull(location), blankToNull(type), startDate, endDate);
        try {
            return HousingDataResponse.of(housingQueryService.find(filter));
        } catch (RuntimeException e) {
            log.error("Error fetching housing data: {}", e.getMessage(), e);
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "failed to fetch data");
        }
    }

    @GetMapping("/stats")
    public HousingStatsResponse stats(@RequestParam(required = false) String location,
                                      @RequestParam(required = false) String type) {
        if (blankToNull(location) == null || blankToNull(type) == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "location and type parameters are required for stats");
        }

        Optional<HousingStatsResponse> stats;
        try {
            stats = housingQueryService.stats(location, type);
        } catch (RuntimeException e) {
            log.error("Error computing housing stats for {} / {}: {}", location, type, e.getMessage(), e);
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "failed to fetch statistics");
        }

        return stats.orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "no data found"));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}

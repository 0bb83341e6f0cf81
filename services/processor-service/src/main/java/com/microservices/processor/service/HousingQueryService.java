package com.microservices.processor.service;

import com.microservices.processor.dto.HousingStatsResponse;
import com.microservices.processor.model.HousingFilter;
import com.microservices.processor.model.HousingPriceRecord;
import com.microservices.processor.repository.HousingPriceRepository;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
public class HousingQueryService {

    private final HousingPriceRepository housingPriceRepository;

    public HousingQueryService(HousingPriceRepository housingPriceRepository) {
        this.housingPriceRepository = housingPriceRepository;
    }

    public List<HousingPriceRecord> find(HousingFilter filter) {
        return housingPriceRepository.findAll(filter);
    }

    /**
     * KPIs for one (location, type) series, or empty when the series has no rows.
     * <p>
     * The yearly change compares the latest value with the latest value dated at least
     * one year earlier, falling back to the first value of the series.
     */
    public Optional<HousingStatsResponse> stats(String location, String housingType) {
        Optional<HousingPriceRecord> latest = housingPriceRepository.findLatest(location, housingType);
        if (latest.isEmpty()) {
            return Optional.empty();
        }

        HousingPriceRecord last = latest.get();
        HousingPriceRecord first = housingPriceRepository.findEarliest(location, housingType).orElse(last);
        HousingPriceRecord yearAgo = housingPriceRepository
                .findLatestOnOrBefore(location, housingType, last.date().minusYears(1))
                .orElse(first);
        double[] minMax = housingPriceRepository.findMinMax(location, housingType)
                .orElse(new double[]{last.priceIndex(), last.priceIndex()});

        return Optional.of(new HousingStatsResponse(
                last.priceIndex(),
                percentageChange(first.priceIndex(), last.priceIndex()),
                percentageChange(yearAgo.priceIndex(), last.priceIndex()),
                minMax[1],
                minMax[0],
                last.date()
        ));
    }

    static double percentageChange(double from, double to) {
        return from > 0 ? (to - from) / from * 100 : 0;
    }
}

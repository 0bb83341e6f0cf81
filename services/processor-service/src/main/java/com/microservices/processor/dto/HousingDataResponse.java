package com.microservices.processor.dto;

import com.microservices.processor.model.HousingPriceRecord;

import java.util.List;

public record HousingDataResponse(int count, List<HousingPriceRecord> data) {

    public static HousingDataResponse of(List<HousingPriceRecord> records) {
        return new HousingDataResponse(records.size(), records);
    }
}

package com.microservices.processor.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * One row of {@code housing_price_index}. JSON names follow the column names of the
 * published dataset.
 */
public record HousingPriceRecord(
        Long id,
        @JsonProperty("tarih") LocalDate date,
        @JsonProperty("istanbul_turkiye") String location,
        @JsonProperty("yeni_yeni_olmayan_konut") String housingType,
        @JsonProperty("fiyat_endeksi") double priceIndex,
        @JsonProperty("created_at") LocalDateTime createdAt,
        @JsonProperty("updated_at") LocalDateTime updatedAt
) {
}

package com.microservices.processor.model;

import java.time.LocalDate;

/**
 * A parsed CSV row, keyed by (date, location, housingType).
 */
public record HousingPriceRow(LocalDate date, String location, String housingType, double priceIndex) {
}

package com.microservices.processor.model;

import java.time.LocalDate;

/**
 * Optional read filters; a null component imposes no constraint.
 */
public record HousingFilter(String location, String housingType, LocalDate startDate, LocalDate endDate) {

    public static HousingFilter none() {
        return new HousingFilter(null, null, null, null);
    }
}

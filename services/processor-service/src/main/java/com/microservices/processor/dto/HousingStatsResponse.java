package com.microservices.processor.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

public record HousingStatsResponse(
        @JsonProperty("last_month_index") double lastMonthIndex,
        @JsonProperty("change_from_start_percentage") double changeFromStart,
        @JsonProperty("last_year_increase_percentage") double lastYearIncrease,
        @JsonProperty("max_value") double maxValue,
        @JsonProperty("min_value") double minValue,
        @JsonProperty("last_month_date") LocalDate lastMonthDate
) {
}

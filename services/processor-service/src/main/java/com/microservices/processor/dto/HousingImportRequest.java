package com.microservices.processor.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record HousingImportRequest(@JsonProperty("csv_data") String csvData) {
}

package com.microservices.processor.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.microservices.processor.model.ImportResult;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record HousingImportResponse(String message, int rowsImported, int rowsAffected) {

    public static HousingImportResponse from(ImportResult result) {
        return new HousingImportResponse("data imported successfully", result.rowsRead(), result.rowsAffected());
    }
}

package com.microservices.processor.model;

public record ImportResult(int rowsRead, int rowsAffected) {

    public static ImportResult empty() {
        return new ImportResult(0, 0);
    }
}

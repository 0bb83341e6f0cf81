package com.microservices.processor.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.LocalDateTime;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StatsResponse(long totalJobs, long completedJobs, long failedJobs, LocalDateTime timestamp) {
}

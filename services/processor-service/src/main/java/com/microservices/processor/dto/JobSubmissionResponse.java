package com.microservices.processor.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.microservices.processor.model.JobStatus;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobSubmissionResponse(String message, String jobId, JobStatus status) {

    public static JobSubmissionResponse queued(String jobId) {
        return new JobSubmissionResponse("job queued successfully", jobId, JobStatus.QUEUED);
    }
}

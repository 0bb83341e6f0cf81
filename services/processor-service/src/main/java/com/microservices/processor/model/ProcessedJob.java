package com.microservices.processor.model;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;

/**
 * Append-only audit row written once per completed job execution.
 */
@Entity
@Table(name = "processing_jobs")
public class ProcessedJob {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_id", nullable = false, unique = true)
    private String jobId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "input_data", nullable = false)
    private JsonNode inputData;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "output_data")
    private JsonNode outputData;

    @Column(nullable = false, length = 50)
    private JobStatus status;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    public ProcessedJob() {}

    public ProcessedJob(String jobId, JsonNode inputData, JsonNode outputData,
                        JobStatus status, LocalDateTime createdAt) {
        this.jobId = jobId;
        this.inputData = inputData;
        this.outputData = outputData;
        this.status = status;
        this.createdAt = createdAt;
    }

    public Long getId() { return id; }
    public String getJobId() { return jobId; }
    public JsonNode getInputData() { return inputData; }
    public JsonNode getOutputData() { return outputData; }
    public JobStatus getStatus() { return status; }
    public LocalDateTime getCreatedAt() { return createdAt; }
    public LocalDateTime getCompletedAt() { return completedAt; }
    public String getErrorMessage() { return errorMessage; }

    public void setId(Long id) { this.id = id; }
    public void setJobId(String jobId) { this.jobId = jobId; }
    public void setInputData(JsonNode inputData) { this.inputData = inputData; }
    public void setOutputData(JsonNode outputData) { this.outputData = outputData; }
    public void setStatus(JobStatus status) { this.status = status; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }
    public void setCompletedAt(LocalDateTime completedAt) { this.completedAt = completedAt; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }
}

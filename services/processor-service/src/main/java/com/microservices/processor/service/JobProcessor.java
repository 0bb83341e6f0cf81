package com.microservices.processor.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.microservices.processor.model.JobStatus;
import com.microservices.processor.model.ProcessedJob;
import com.microservices.processor.repository.ProcessedJobRepository;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Runs one job on a worker thread: {@code processing}, the fixed-latency transform,
 * the audit row, then {@code completed}. Any exception moves the job to {@code failed}
 * instead. The job record is scheduled for expiry in both cases.
 */
@Service
public class JobProcessor {

    private static final Logger log = LoggerFactory.getLogger(JobProcessor.class);

    private final JobStatusStore jobStatusStore;
    private final PayloadTransformer payloadTransformer;
    private final ProcessedJobRepository processedJobRepository;
    private final JobMetrics jobMetrics;
    private final Duration processingDelay;

    public JobProcessor(JobStatusStore jobStatusStore,
                        PayloadTransformer payloadTransformer,
                        ProcessedJobRepository processedJobRepository,
                        JobMetrics jobMetrics,
                        @Value("${processor.jobs.processing-delay:3s}") Duration processingDelay) {
        this.jobStatusStore = jobStatusStore;
        this.payloadTransformer = payloadTransformer;
        this.processedJobRepository = processedJobRepository;
        this.jobMetrics = jobMetrics;
        this.processingDelay = processingDelay;
    }

    public void process(String jobId, JsonNode data) {
        Timer.Sample sample = Timer.start();
        JobStatus outcome;

        try {
            log.info("Starting job {}", jobId);
            jobStatusStore.markProcessing(jobId);

            simulateWork();
            ObjectNode result = payloadTransformer.transform(data);

            recordAudit(jobId, data, result);
            jobStatusStore.markCompleted(jobId, result);

            outcome = JobStatus.COMPLETED;
            log.info("Job {} completed successfully", jobId);
        } catch (Exception e) {
            outcome = JobStatus.FAILED;
            log.error("Job {} failed: {}", jobId, e.getMessage(), e);
            recordFailure(jobId, e);
        }

        expire(jobId);
        sample.stop(jobMetrics.jobProcessingTimer());
        jobMetrics.jobsFinishedCounter(outcome).increment();
    }

    private void simulateWork() throws InterruptedException {
        if (!processingDelay.isZero() && !processingDelay.isNegative()) {
            Thread.sleep(processingDelay.toMillis());
        }
    }

    private void recordAudit(String jobId, JsonNode data, ObjectNode result) {
        ObjectNode input = JsonNodeFactory.instance.objectNode();
        input.set("data", data);

        try {
            processedJobRepository.save(new ProcessedJob(
                    jobId, input, result, JobStatus.COMPLETED, LocalDateTime.now()));
        } catch (DataAccessException e) {
            // The audit row is best effort; the job itself still completes.
            log.error("Database error while recording job {}: {}", jobId, e.getMessage(), e);
        }
    }

    private void recordFailure(String jobId, Exception cause) {
        if (cause instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
        try {
            jobStatusStore.markFailed(jobId, message);
        } catch (RuntimeException e) {
            log.error("Could not record failure of job {}: {}", jobId, e.getMessage(), e);
        }
    }

    private void expire(String jobId) {
        try {
            jobStatusStore.expire(jobId);
        } catch (RuntimeException e) {
            log.error("Could not set expiry on job {}: {}", jobId, e.getMessage(), e);
        }
    }
}

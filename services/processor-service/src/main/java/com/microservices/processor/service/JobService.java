package com.microservices.processor.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.microservices.processor.config.AsyncConfig;
import com.microservices.processor.dto.JobResponse;
import com.microservices.processor.dto.StatsResponse;
import com.microservices.processor.model.JobStatus;
import com.microservices.processor.repository.ProcessedJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

@Service
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    private final JobStatusStore jobStatusStore;
    private final JobProcessor jobProcessor;
    private final ProcessedJobRepository processedJobRepository;
    private final TaskExecutor jobExecutor;
    private final JobMetrics jobMetrics;

    public JobService(JobStatusStore jobStatusStore,
                      JobProcessor jobProcessor,
                      ProcessedJobRepository processedJobRepository,
                      @Qualifier(AsyncConfig.JOB_EXECUTOR) TaskExecutor jobExecutor,
                      JobMetrics jobMetrics) {
        this.jobStatusStore = jobStatusStore;
        this.jobProcessor = jobProcessor;
        this.processedJobRepository = processedJobRepository;
        this.jobExecutor = jobExecutor;
        this.jobMetrics = jobMetrics;
    }

    /**
     * Records the job as {@code queued} and hands it to the worker pool. Returns as soon
     * as the job is enqueued.
     *
     * @throws JobRejectedException if the pool cannot take the job; the job is then
     *                              stored as {@code failed}
     */
    public String submit(JsonNode data) {
        String jobId = UUID.randomUUID().toString();
        jobStatusStore.create(jobId, data);

        try {
            jobExecutor.execute(() -> jobProcessor.process(jobId, data));
        } catch (TaskRejectedException e) {
            log.warn("Worker pool is full, rejecting job {}", jobId);
            jobStatusStore.markFailed(jobId, "job queue is full");
            jobStatusStore.expire(jobId);
            jobMetrics.jobsRejectedCounter().increment();
            throw new JobRejectedException(e);
        }

        jobMetrics.jobsSubmittedCounter().increment();
        log.debug("Queued job {}", jobId);
        return jobId;
    }

    public Optional<JobResponse> getStatus(String jobId) {
        return jobStatusStore.find(jobId);
    }

    public StatsResponse stats() {
        return new StatsResponse(
                processedJobRepository.count(),
                processedJobRepository.countByStatus(JobStatus.COMPLETED),
                processedJobRepository.countByStatus(JobStatus.FAILED),
                LocalDateTime.now()
        );
    }
}

package com.microservices.processor.controller;

import com.microservices.processor.dto.JobResponse;
import com.microservices.processor.dto.JobSubmissionResponse;
import com.microservices.processor.dto.ProcessRequest;
import com.microservices.processor.dto.StatsResponse;
import com.microservices.processor.service.JobRejectedException;
import com.microservices.processor.service.JobService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/api")
public class JobController {

    private static final Logger log = LoggerFactory.getLogger(JobController.class);

    private final JobService jobService;

    public JobController(JobService jobService) {
        this.jobService = jobService;
    }

    @PostMapping("/process")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public JobSubmissionResponse process(@RequestBody(required = false) ProcessRequest request) {
        if (request == null || request.data() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "missing data field");
        }

        try {
            return JobSubmissionResponse.queued(jobService.submit(request.data()));
        } catch (JobRejectedException e) {
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Error queueing job: {}", e.getMessage(), e);
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "failed to queue job");
        }
    }

    @GetMapping("/jobs/{id}")
    public JobResponse getJob(@PathVariable String id) {
        JobResponse job;
        try {
            job = jobService.getStatus(id).orElse(null);
        } catch (RuntimeException e) {
            log.error("Error fetching job {}: {}", id, e.getMessage(), e);
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "failed to fetch job status");
        }

        if (job == null) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "job not found");
        }
        return job;
    }

    @GetMapping("/stats")
    public StatsResponse stats() {
        try {
            return jobService.stats();
        } catch (RuntimeException e) {
            log.error("Error fetching stats: {}", e.getMessage(), e);
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "failed to fetch statistics");
        }
    }
}

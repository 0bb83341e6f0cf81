package com.microservices.processor.service;

import com.microservices.processor.model.JobStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

@Component
public class JobMetrics {

    private final MeterRegistry registry;

    public JobMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public Counter jobsSubmittedCounter() {
        return Counter.builder("jobs.submitted.total")
                .description("Total jobs accepted for processing")
                .register(registry);
    }

    public Counter jobsRejectedCounter() {
        return Counter.builder("jobs.rejected.total")
                .description("Jobs rejected because the worker pool was full")
                .register(registry);
    }

    public Counter jobsFinishedCounter(JobStatus outcome) {
        return Counter.builder("jobs.finished.total")
                .tag("outcome", outcome.value())
                .description("Jobs that reached a terminal state, by outcome")
                .register(registry);
    }

    public Timer jobProcessingTimer() {
        return Timer.builder("jobs.processing.seconds")
                .description("Time from job start to terminal state")
                .publishPercentileHistogram(true)
                .register(registry);
    }

    public Counter housingRowsCounter(String kind) {
        return Counter.builder("housing.import.rows.total")
                .tag("kind", kind)
                .description("Housing price rows read from CSV and affected in the database")
                .register(registry);
    }
}

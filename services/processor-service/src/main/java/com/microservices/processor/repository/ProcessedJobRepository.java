package com.microservices.processor.repository;

import com.microservices.processor.model.JobStatus;
import com.microservices.processor.model.ProcessedJob;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ProcessedJobRepository extends JpaRepository<ProcessedJob, Long> {

    long countByStatus(JobStatus status);
}

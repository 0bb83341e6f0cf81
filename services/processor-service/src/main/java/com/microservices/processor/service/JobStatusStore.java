package com.microservices.processor.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.microservices.processor.dto.JobResponse;
import com.microservices.processor.model.JobStatus;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Job records in Redis, one hash per job under {@code job:{id}}.
 * <p>
 * Every field is a string: timestamps are ISO-8601 local date-times, payloads and
 * results are JSON text. Records only expire once {@link #expire(String)} is called,
 * which happens after the job reaches a terminal state.
 */
@Service
public class JobStatusStore {

    static final String KEY_PREFIX = "job:";

    static final String STATUS = "status";
    static final String CREATED_AT = "created_at";
    static final String STARTED_AT = "started_at";
    static final String COMPLETED_AT = "completed_at";
    static final String FAILED_AT = "failed_at";
    static final String INPUT_DATA = "input_data";
    static final String RESULT = "result";
    static final String ERROR = "error";

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final Duration retention;

    public JobStatusStore(RedisTemplate<String, String> redisTemplate,
                          ObjectMapper objectMapper,
                          @Value("${processor.jobs.retention:24h}") Duration retention) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.retention = retention;
    }

    public void create(String jobId, JsonNode inputData) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(STATUS, JobStatus.QUEUED.value());
        fields.put(CREATED_AT, now());
        fields.put(INPUT_DATA, toJson(inputData));
        hash().putAll(key(jobId), fields);
    }

    public void markProcessing(String jobId) {
        hash().putAll(key(jobId), Map.of(
                STATUS, JobStatus.PROCESSING.value(),
                STARTED_AT, now()
        ));
    }

    public void markCompleted(String jobId, JsonNode result) {
        hash().putAll(key(jobId), Map.of(
                STATUS, JobStatus.COMPLETED.value(),
                COMPLETED_AT, now(),
                RESULT, toJson(result)
        ));
    }

    public void markFailed(String jobId, String error) {
        hash().putAll(key(jobId), Map.of(
                STATUS, JobStatus.FAILED.value(),
                ERROR, error,
                FAILED_AT, now()
        ));
    }

    public void expire(String jobId) {
        redisTemplate.expire(key(jobId), retention);
    }

    public Optional<JobResponse> find(String jobId) {
        Map<String, String> fields = hash().entries(key(jobId));
        if (fields == null || fields.isEmpty()) {
            return Optional.empty();
        }

        String result = fields.get(RESULT);
        return Optional.of(new JobResponse(
                jobId,
                JobStatus.fromValue(fields.get(STATUS)),
                fields.get(CREATED_AT),
                result != null ? fromJson(result) : null,
                fields.get(ERROR)
        ));
    }

    private HashOperations<String, String, String> hash() {
        return redisTemplate.opsForHash();
    }

    private static String key(String jobId) {
        return KEY_PREFIX + jobId;
    }

    private static String now() {
        return LocalDateTime.now().toString();
    }

    private String toJson(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Job payload is not serializable", e);
        }
    }

    private JsonNode fromJson(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored job result is not valid JSON", e);
        }
    }
}

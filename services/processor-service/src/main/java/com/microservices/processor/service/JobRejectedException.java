package com.microservices.processor.service;

/**
 * Raised when the worker pool and its queue are both full.
 */
public class JobRejectedException extends RuntimeException {

    public JobRejectedException(Throwable cause) {
        super("job queue is full", cause);
    }
}

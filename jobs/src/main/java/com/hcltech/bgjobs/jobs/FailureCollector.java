package com.hcltech.bgjobs.jobs;

import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;

/** Failure channel shared by the job threads (writers) and the barrier (reader at drain time). */
final class FailureCollector {
    private final ConcurrentLinkedQueue<JobFailure> failures = new ConcurrentLinkedQueue<>();

    void record(JobFailure failure) {
        failures.add(failure);
    }

    boolean isEmpty() {
        return failures.isEmpty();
    }

    List<JobFailure> snapshot() {
        return List.copyOf(failures);
    }

    BackgroundJobsFailedException toException() {
        return new BackgroundJobsFailedException(snapshot());
    }
}

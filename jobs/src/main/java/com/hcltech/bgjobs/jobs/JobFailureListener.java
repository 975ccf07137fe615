package com.hcltech.bgjobs.jobs;

/**
 * Told about each failed job as soon as it fails, on that job's thread. Called once per failure.
 * Must be thread-safe; anything it throws is added to the failure as suppressed.
 */
@FunctionalInterface
public interface JobFailureListener {
    void onFailure(JobFailure failure);

    JobFailureListener none = failure -> {
    };
}

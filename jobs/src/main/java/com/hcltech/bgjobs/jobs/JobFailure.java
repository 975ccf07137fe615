package com.hcltech.bgjobs.jobs;

import java.util.Objects;

/**
 * One failed background job.
 *
 * @param jobName name of the job (also its thread name)
 * @param error   what the job threw
 */
public record JobFailure(String jobName, Throwable error) {
    public JobFailure {
        Objects.requireNonNull(jobName, "jobName");
        Objects.requireNonNull(error, "error");
    }
}

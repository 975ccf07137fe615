package com.hcltech.bgjobs.jobs;

import java.util.List;

/**
 * Reports the failed jobs of one barrier. The cause is the first failure; the others are
 * attached as suppressed exceptions so they show up in stack traces.
 */
public class BackgroundJobsFailedException extends RuntimeException {
    private final List<JobFailure> failures;

    public BackgroundJobsFailedException(List<JobFailure> failures) {
        super(message(failures), failures.isEmpty() ? null : failures.get(0).error());
        this.failures = List.copyOf(failures);
        for (int i = 1; i < this.failures.size(); i++) {
            addSuppressed(this.failures.get(i).error());
        }
    }

    /** Exactly one entry per failed job, in the order the failures were recorded. */
    public List<JobFailure> failures() {
        return failures;
    }

    private static String message(List<JobFailure> failures) {
        if (failures.isEmpty()) throw new IllegalArgumentException("failures must not be empty");
        if (failures.size() == 1) {
            JobFailure only = failures.get(0);
            return "Background job " + only.jobName() + " failed: " + only.error();
        }
        return failures.size() + " background jobs failed, first was " + failures.get(0).jobName() + ": " + failures.get(0).error();
    }
}

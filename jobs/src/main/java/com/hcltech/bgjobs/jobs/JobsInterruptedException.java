package com.hcltech.bgjobs.jobs;

/**
 * Unchecked wrapper for an {@link InterruptedException} caught while waiting for a slot or a result.
 * The interrupt flag has already been restored on the thread when this is thrown.
 */
public class JobsInterruptedException extends RuntimeException {
    public JobsInterruptedException(String message, InterruptedException cause) {
        super(message, cause);
    }
}

package com.hcltech.bgjobs.jobs;

/** Thrown by {@link BgResult#get()} when the job behind the result failed. The cause is the job's own failure. */
public class JobFailedException extends RuntimeException {
    private final String jobName;

    public JobFailedException(String jobName, Throwable cause) {
        super("Background job " + jobName + " failed: " + cause, cause);
        this.jobName = jobName;
    }

    public String jobName() {
        return jobName;
    }
}

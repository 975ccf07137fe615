package com.hcltech.bgjobs.jobs;

/** What the barrier does with launches after a job has failed. Running jobs are never cancelled. */
public enum FailurePolicy {
    /** Keep launching; report every failure once the barrier has drained. */
    COLLECT,
    /** The next {@link BgJobManager#background} call throws the failures recorded so far instead of launching. */
    FAIL_FAST
}

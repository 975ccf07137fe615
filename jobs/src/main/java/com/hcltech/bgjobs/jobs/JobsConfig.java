package com.hcltech.bgjobs.jobs;

import com.hcltech.bgjobs.common.IEnvGetter;
import com.hcltech.bgjobs.common.errorsor.ErrorsOr;
import com.hcltech.bgjobs.jobs.threads.JobThreadFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration record for a {@link Jobs} barrier.
 *
 * @param limit            maximum number of jobs in flight at once (>0)
 * @param fairSlots        hand free slots to blocked launchers in FIFO order
 * @param threadNamePrefix job threads are named {@code <prefix>-<n>} (non-blank)
 * @param virtualThreads   use virtual threads when the JDK has them
 * @param failurePolicy    what happens to launches after a job failed (non-null)
 */
public record JobsConfig(
        int limit,
        boolean fairSlots,
        String threadNamePrefix,
        boolean virtualThreads,
        FailurePolicy failurePolicy
) {
    public static final String LIMIT_ENV = "BGJOBS_LIMIT";
    public static final String FAIR_SLOTS_ENV = "BGJOBS_FAIR_SLOTS";
    public static final String THREAD_PREFIX_ENV = "BGJOBS_THREAD_PREFIX";
    public static final String VIRTUAL_THREADS_ENV = "BGJOBS_VIRTUAL_THREADS";
    public static final String FAILURE_POLICY_ENV = "BGJOBS_FAILURE_POLICY";

    public static final String DEFAULT_THREAD_PREFIX = "bg-job";

    public JobsConfig {
        List<String> errors = new ArrayList<>();
        if (limit <= 0) {
            errors.add("expected limit to be > 0 but was " + limit);
        }
        if (threadNamePrefix == null || threadNamePrefix.isBlank()) {
            errors.add("threadNamePrefix must not be blank");
        }
        if (failurePolicy == null) {
            errors.add("failurePolicy must not be null");
        }
        if (!errors.isEmpty()) {
            throw new JobsConfigurationException(errors);
        }
    }

    /** Non-fair slots, platform threads named {@code bg-job-<n>}, {@link FailurePolicy#COLLECT}. */
    public static JobsConfig of(int limit) {
        return new JobsConfig(limit, false, DEFAULT_THREAD_PREFIX, false, FailurePolicy.COLLECT);
    }

    public JobsConfig withFairSlots(boolean fair) {
        return new JobsConfig(limit, fair, threadNamePrefix, virtualThreads, failurePolicy);
    }

    public JobsConfig withThreadNamePrefix(String prefix) {
        return new JobsConfig(limit, fairSlots, prefix, virtualThreads, failurePolicy);
    }

    public JobsConfig withVirtualThreads(boolean virtual) {
        return new JobsConfig(limit, fairSlots, threadNamePrefix, virtual, failurePolicy);
    }

    public JobsConfig withFailurePolicy(FailurePolicy policy) {
        return new JobsConfig(limit, fairSlots, threadNamePrefix, virtualThreads, policy);
    }

    JobThreadFactory threadFactory() {
        return virtualThreads ? JobThreadFactory.virtualOrPlatform() : JobThreadFactory.platform();
    }

    /**
     * Reads {@value #LIMIT_ENV} (required) and the optional {@code BGJOBS_*} variables.
     * All problems are collected rather than stopping at the first.
     */
    public static ErrorsOr<JobsConfig> parse(IEnvGetter env) {
        ErrorsOr<Integer> limit = IEnvGetter.intValue(env, LIMIT_ENV);
        ErrorsOr<Boolean> fair = IEnvGetter.booleanOr(env, FAIR_SLOTS_ENV, false);
        ErrorsOr<String> prefix = IEnvGetter.stringOr(env, THREAD_PREFIX_ENV, DEFAULT_THREAD_PREFIX);
        ErrorsOr<Boolean> virtual = IEnvGetter.booleanOr(env, VIRTUAL_THREADS_ENV, false);
        ErrorsOr<FailurePolicy> policy = IEnvGetter.enumOr(env, FAILURE_POLICY_ENV, FailurePolicy.class, FailurePolicy.COLLECT);

        List<ErrorsOr<?>> parts = List.of(limit, fair, prefix, virtual, policy);
        List<String> errors = new ArrayList<>();
        for (ErrorsOr<?> part : parts) {
            part.ifError(errors::addAll);
        }
        limit.ifValue(l -> {
            if (l <= 0) errors.add(LIMIT_ENV + ": expected limit to be > 0 but was " + l);
        });
        if (!errors.isEmpty()) {
            return ErrorsOr.errors(errors);
        }
        return ErrorsOr.lift(new JobsConfig(
                limit.valueOrThrow(), fair.valueOrThrow(), prefix.valueOrThrow(), virtual.valueOrThrow(), policy.valueOrThrow()));
    }

    /** Like {@link #parse(IEnvGetter)} but throws {@link JobsConfigurationException} listing every problem. */
    public static JobsConfig fromEnv(IEnvGetter env) {
        return parse(env).fold(config -> config, errors -> {
            throw new JobsConfigurationException(errors);
        });
    }
}

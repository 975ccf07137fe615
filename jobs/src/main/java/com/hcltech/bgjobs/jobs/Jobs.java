package com.hcltech.bgjobs.jobs;

import com.hcltech.bgjobs.common.ITimeService;
import com.hcltech.bgjobs.common.metrics.Metrics;
import com.hcltech.bgjobs.jobs.context.ContextPropagator;
import com.hcltech.bgjobs.jobs.slots.BlockingSlotSemaphore;
import com.hcltech.bgjobs.jobs.slots.SlotSemaphore;
import com.hcltech.bgjobs.jobs.threads.JobThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Completion barrier for background jobs.
 * <p>
 * Runs the caller's logic with a {@link BgJobManager} that allows at most {@code limit} jobs
 * in flight, and does not return until every job launched through it has finished:
 * <pre>{@code
 * String both = Jobs.jobs(2, jobs -> {
 *     BgResult<String> a = jobs.background(() -> slowStep("a"));
 *     BgResult<String> b = jobs.background(() -> slowStep("b"));
 *     return a.get() + b.get();
 * });
 * }</pre>
 * Job failures are collected while the logic runs and thrown as one
 * {@link BackgroundJobsFailedException} after the drain, so no failure is lost and the
 * caller's thread is never interrupted mid-operation.
 * <p>
 * A barrier instance runs once: {@code CREATED -> OPEN -> DRAINING -> CLOSED}.
 */
public final class Jobs {
    private static final Logger log = LoggerFactory.getLogger(Jobs.class);

    private final JobsConfig config;
    private final JobThreadFactory threads;
    private final List<ContextPropagator<?>> propagators;
    private final JobFailureListener failureListener;
    private final Metrics metrics;
    private final ITimeService time;
    private final AtomicReference<BarrierState> state = new AtomicReference<>(BarrierState.CREATED);

    private Jobs(Builder builder) {
        this.config = builder.config;
        this.threads = builder.threads != null ? builder.threads : builder.config.threadFactory();
        this.propagators = List.copyOf(builder.propagators);
        this.failureListener = builder.failureListener;
        this.metrics = builder.metrics;
        this.time = builder.time;
    }

    /**
     * Runs {@code logic} with at most {@code limit} background jobs in flight and waits for all of them.
     *
     * @throws JobsConfigurationException    if {@code limit <= 0}; {@code logic} is not run
     * @throws BackgroundJobsFailedException if any job failed and the logic itself completed normally
     */
    public static <R, E extends Exception> R jobs(int limit, JobsLogic<R, E> logic) throws E {
        return builder(JobsConfig.of(limit)).run(logic);
    }

    public static <R, E extends Exception> R jobs(JobsConfig config, JobsLogic<R, E> logic) throws E {
        return builder(config).run(logic);
    }

    public static Builder builder(JobsConfig config) {
        return new Builder(config);
    }

    public static Builder builder(int limit) {
        return new Builder(JobsConfig.of(limit));
    }

    /**
     * Opens the barrier, runs {@code logic}, then drains. The drain happens even if
     * {@code logic} throws; the logic's exception is rethrown afterwards with the job
     * failures it does not already report attached as suppressed.
     *
     * @throws IllegalStateException if this barrier has already been run
     */
    public <R, E extends Exception> R run(JobsLogic<R, E> logic) throws E {
        Objects.requireNonNull(logic, "logic");
        if (!state.compareAndSet(BarrierState.CREATED, BarrierState.OPEN)) {
            throw new IllegalStateException("A jobs barrier runs once; this one is " + state.get());
        }
        SlotSemaphore slots = new BlockingSlotSemaphore(config.limit(), config.fairSlots());
        FailureCollector failures = new FailureCollector();
        BgJobManager manager = new BgJobManager(slots, threads, config.threadNamePrefix(), propagators,
                failures, failureListener, config.failurePolicy(), metrics, time);
        log.debug("Opened jobs barrier: limit={}, threads={}, policy={}", config.limit(), threads.name(), config.failurePolicy());

        R result;
        try {
            result = logic.run(manager);
        } catch (Throwable t) {
            drain(slots, manager);
            attachUnreported(t, failures.snapshot());
            throw t;
        }
        drain(slots, manager);
        if (!failures.isEmpty()) {
            throw failures.toException();
        }
        return result;
    }

    private void drain(SlotSemaphore slots, BgJobManager manager) {
        state.set(BarrierState.DRAINING);
        long start = time.currentTimeNanos();
        log.debug("Draining jobs barrier: {} job(s) still running", manager.inFlight());
        slots.closeWhenDrained();
        state.set(BarrierState.CLOSED);
        try {
            metrics.histogram("bgjobs.drain.nanos", time.currentTimeNanos() - start);
        } catch (RuntimeException e) {
            log.warn("Metrics failed while closing jobs barrier", e);
        }
        log.debug("Closed jobs barrier after {} job(s)", manager.launched());
    }

    private static void attachUnreported(Throwable thrown, List<JobFailure> failures) {
        List<JobFailure> reported = thrown instanceof BackgroundJobsFailedException b ? b.failures() : List.of();
        for (JobFailure failure : failures) {
            if (!reported.contains(failure) && failure.error() != thrown) {
                thrown.addSuppressed(failure.error());
            }
        }
    }

    public BarrierState state() {
        return state.get();
    }

    public JobsConfig config() {
        return config;
    }

    public static final class Builder {
        private final JobsConfig config;
        private JobThreadFactory threads;
        private final List<ContextPropagator<?>> propagators = new ArrayList<>(List.of(ContextPropagator.mdc()));
        private JobFailureListener failureListener = JobFailureListener.none;
        private Metrics metrics = Metrics.nullMetrics;
        private ITimeService time = ITimeService.real;

        private Builder(JobsConfig config) {
            this.config = Objects.requireNonNull(config, "config");
        }

        /** Overrides the thread factory the config would pick. */
        public Builder threadFactory(JobThreadFactory threads) {
            this.threads = Objects.requireNonNull(threads, "threads");
            return this;
        }

        /** Adds a propagator; the SLF4J MDC is propagated by default. */
        public Builder propagate(ContextPropagator<?> propagator) {
            propagators.add(Objects.requireNonNull(propagator, "propagator"));
            return this;
        }

        /** Drops every propagator, including the default MDC one. */
        public Builder noPropagation() {
            propagators.clear();
            return this;
        }

        public Builder failureListener(JobFailureListener listener) {
            this.failureListener = Objects.requireNonNull(listener, "listener");
            return this;
        }

        public Builder metrics(Metrics metrics) {
            this.metrics = metrics == null ? Metrics.nullMetrics : metrics;
            return this;
        }

        public Builder timeService(ITimeService time) {
            this.time = Objects.requireNonNull(time, "time");
            return this;
        }

        public Jobs build() {
            return new Jobs(this);
        }

        public <R, E extends Exception> R run(JobsLogic<R, E> logic) throws E {
            return build().run(logic);
        }
    }
}

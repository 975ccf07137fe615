package com.hcltech.bgjobs.jobs;

import com.hcltech.bgjobs.common.ITimeService;
import com.hcltech.bgjobs.common.function.ThrowingFunction;
import com.hcltech.bgjobs.common.function.ThrowingRunnable;
import com.hcltech.bgjobs.common.function.ThrowingSupplier;
import com.hcltech.bgjobs.common.metrics.Metrics;
import com.hcltech.bgjobs.jobs.context.ContextPropagator;
import com.hcltech.bgjobs.jobs.context.ExecutionContext;
import com.hcltech.bgjobs.jobs.slots.SlotSemaphore;
import com.hcltech.bgjobs.jobs.threads.JobThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Launches background jobs for one {@link Jobs} barrier. Handed to the barrier's logic; jobs
 * may use it to launch further jobs, which then share the same limit.
 * <p>
 * A slot is taken on the calling thread before the job thread exists, so a caller that
 * launches faster than jobs finish is throttled right here, and the barrier can never see
 * zero outstanding work while a launch is still waiting. The job thread gives the slot back
 * in a {@code finally}, after its result has been written.
 */
public final class BgJobManager {
    private static final Logger log = LoggerFactory.getLogger(BgJobManager.class);

    private final SlotSemaphore slots;
    private final JobThreadFactory threads;
    private final String threadNamePrefix;
    private final List<ContextPropagator<?>> propagators;
    private final FailureCollector failures;
    private final JobFailureListener failureListener;
    private final FailurePolicy failurePolicy;
    private final Metrics metrics;
    private final ITimeService time;

    private final AtomicLong launched = new AtomicLong();

    BgJobManager(SlotSemaphore slots,
                 JobThreadFactory threads,
                 String threadNamePrefix,
                 List<ContextPropagator<?>> propagators,
                 FailureCollector failures,
                 JobFailureListener failureListener,
                 FailurePolicy failurePolicy,
                 Metrics metrics,
                 ITimeService time) {
        this.slots = Objects.requireNonNull(slots, "slots");
        this.threads = Objects.requireNonNull(threads, "threads");
        this.threadNamePrefix = Objects.requireNonNull(threadNamePrefix, "threadNamePrefix");
        this.propagators = List.copyOf(propagators);
        this.failures = Objects.requireNonNull(failures, "failures");
        this.failureListener = Objects.requireNonNull(failureListener, "failureListener");
        this.failurePolicy = Objects.requireNonNull(failurePolicy, "failurePolicy");
        this.metrics = metrics == null ? Metrics.nullMetrics : metrics;
        this.time = Objects.requireNonNull(time, "time");
    }

    /**
     * Runs {@code work} on a new thread and returns its promised result at once. Blocks only
     * while every slot is taken.
     *
     * @throws BackgroundJobsFailedException under {@link FailurePolicy#FAIL_FAST} once a job has failed
     * @throws JobsInterruptedException      if interrupted while waiting for a slot
     * @throws IllegalStateException         if the barrier has already closed
     */
    public <T> BgResult<T> background(ThrowingSupplier<T> work) {
        Objects.requireNonNull(work, "work");
        ExecutionContext context = ExecutionContext.capture(propagators);
        return launch(() -> context.call(work));
    }

    /** As {@link #background(ThrowingSupplier)} for work that produces nothing; the result holds {@code null}. */
    public BgResult<Void> backgroundRun(ThrowingRunnable work) {
        Objects.requireNonNull(work, "work");
        return background(work.asSupplier());
    }

    /**
     * As {@link #background(ThrowingSupplier)}, handing the job an explicit context value
     * instead of having it reach for shared state. The value should be immutable.
     */
    public <C, T> BgResult<T> background(C context, ThrowingFunction<C, T> work) {
        Objects.requireNonNull(work, "work");
        ExecutionContext ambient = ExecutionContext.capture(propagators);
        return launch(() -> ambient.call(() -> work.apply(context)));
    }

    private <T> BgResult<T> launch(ThrowingSupplier<T> body) {
        if (slots.isClosed()) {
            throw closedBarrier(null);
        }
        if (failurePolicy == FailurePolicy.FAIL_FAST && !failures.isEmpty()) {
            throw failures.toException();
        }

        long waitStart = time.currentTimeNanos();
        try {
            slots.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JobsInterruptedException("Interrupted while waiting for a background job slot", e);
        } catch (IllegalStateException e) {
            // lost the race with the drain
            throw closedBarrier(e);
        }
        String name = threadNamePrefix + "-" + launched.incrementAndGet();
        report(name, () -> metrics.histogram("bgjobs.slot.wait.nanos", time.currentTimeNanos() - waitStart));

        BgResult<T> result = new BgResult<>(name);
        try {
            threads.newThread(name, () -> runJob(name, body, result)).start();
        } catch (RuntimeException | Error e) {
            slots.release();
            throw e;
        }
        report(name, () -> metrics.increment("bgjobs.launched"));
        log.debug("Launched {} ({} of {} slots in use)", name, inFlight(), slots.capacity());
        return result;
    }

    private <T> void runJob(String name, ThrowingSupplier<T> body, BgResult<T> result) {
        long start = time.currentTimeNanos();
        try {
            T value;
            try {
                value = body.get();
            } catch (Throwable t) {
                recordFailure(new JobFailure(name, t), result);
                return;
            }
            result.complete(value);
            report(name, () -> metrics.increment("bgjobs.succeeded"));
            log.debug("{} finished", name);
        } finally {
            report(name, () -> metrics.histogram("bgjobs.duration.nanos", time.currentTimeNanos() - start));
            slots.release();
        }
    }

    private void recordFailure(JobFailure failure, BgResult<?> result) {
        if (!result.fail(failure.error())) {
            log.warn("{} failed after its result was written; ignoring", failure.jobName(), failure.error());
            return;
        }
        failures.record(failure);
        report(failure.jobName(), () -> metrics.increment("bgjobs.failed"));
        log.warn("Background job {} failed", failure.jobName(), failure.error());
        try {
            failureListener.onFailure(failure);
        } catch (RuntimeException e) {
            log.warn("Failure listener threw while handling {}", failure.jobName(), e);
            failure.error().addSuppressed(e);
        }
    }

    /** Metrics are bookkeeping: a broken backend is logged and never changes a job's outcome. */
    private static void report(String jobName, Runnable emit) {
        try {
            emit.run();
        } catch (RuntimeException e) {
            log.warn("Metrics failed for {}", jobName, e);
        }
    }

    private static IllegalStateException closedBarrier(Throwable cause) {
        return new IllegalStateException("Cannot launch a background job: its jobs barrier has already closed", cause);
    }

    /** Jobs currently holding a slot. Stale as soon as it is read. */
    public int inFlight() {
        return slots.capacity() - slots.availableSlots();
    }

    /** Jobs launched so far through this manager. */
    public long launched() {
        return launched.get();
    }

    public int limit() {
        return slots.capacity();
    }

    /** Failures recorded so far, one per failed job. */
    public List<JobFailure> failures() {
        return failures.snapshot();
    }

    @Override
    public String toString() {
        return "BgJobManager{limit=" + slots.capacity() + ", inFlight=" + inFlight() + ", launched=" + launched.get() + "}";
    }
}

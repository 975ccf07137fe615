package com.hcltech.bgjobs.jobs;

import com.hcltech.bgjobs.common.errorsor.ErrorsOr;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

/**
 * The promised result of a background job. Written once by the job thread, read by anyone.
 * <p>
 * A failed job completes its result with the failure, so {@link #get()} throws
 * {@link JobFailedException} instead of waiting for a value that will never come.
 *
 * @param <T> type produced by the job
 */
public final class BgResult<T> {
    private final String jobName;
    private final CompletableFuture<T> future = new CompletableFuture<>();

    BgResult(String jobName) {
        this.jobName = jobName;
    }

    /** A result that is already written; handy for mixing synchronous values with background ones. */
    public static <T> BgResult<T> completed(T value) {
        BgResult<T> result = new BgResult<>("completed");
        result.complete(value);
        return result;
    }

    void complete(T value) {
        if (!future.complete(value)) {
            throw new IllegalStateException("BgResult for " + jobName + " written twice");
        }
    }

    /** Returns false if the result had already been written. */
    boolean fail(Throwable error) {
        return future.completeExceptionally(error);
    }

    /**
     * Blocks until the job has finished and returns its value. Repeated calls return the same value.
     *
     * @throws JobFailedException       if the job failed
     * @throws JobsInterruptedException if the waiting thread is interrupted
     */
    public T get() {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JobsInterruptedException("Interrupted waiting for background job " + jobName, e);
        } catch (ExecutionException e) {
            throw new JobFailedException(jobName, e.getCause());
        }
    }

    /**
     * Blocks like {@link #get()} but reports failure as an error instead of throwing.
     * A {@code null} value is reported as an error too, as {@link ErrorsOr} holds no nulls.
     */
    public ErrorsOr<T> result() {
        try {
            T value = get();
            return value == null
                    ? ErrorsOr.error("Background job " + jobName + " produced no value")
                    : ErrorsOr.lift(value);
        } catch (JobFailedException e) {
            return ErrorsOr.<T>error("{0}: {1}", e.getCause()).addPrefixIfError("Background job " + jobName + " failed: ");
        }
    }

    /**
     * Non-blocking: the value if the job has succeeded, {@code fallback} while it is still running.
     *
     * @throws JobFailedException if the job has already failed
     */
    public T getNow(T fallback) {
        if (!future.isDone()) return fallback;
        return get();
    }

    public boolean isDone() {
        return future.isDone();
    }

    public boolean isFailed() {
        return future.isCompletedExceptionally();
    }

    /** Read-only view for composing with other asynchronous code. */
    public CompletionStage<T> toCompletionStage() {
        return future.minimalCompletionStage();
    }

    public String jobName() {
        return jobName;
    }

    @Override
    public String toString() {
        String status = !future.isDone() ? "running" : future.isCompletedExceptionally() ? "failed" : "done";
        return "BgResult{" + jobName + ", " + status + "}";
    }
}

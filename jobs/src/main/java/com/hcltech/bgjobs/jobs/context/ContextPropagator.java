package com.hcltech.bgjobs.jobs.context;

import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Carries one piece of thread-bound state from the launching thread into a background job.
 * <p>
 * {@link #capture()} runs on the launching thread and must return a snapshot by value, so
 * later changes on either side stay on that side. {@link #restore(Object)} runs on the job
 * thread; closing what it returns puts back whatever the job thread had before.
 *
 * @param <S> snapshot type
 */
public interface ContextPropagator<S> {

    S capture();

    Restored restore(S snapshot);

    /** Undo handle returned by {@link #restore(Object)}. */
    @FunctionalInterface
    interface Restored extends AutoCloseable {
        @Override
        void close();
    }

    /** Copies the SLF4J MDC so job log lines carry the launcher's correlation keys. */
    static ContextPropagator<Map<String, String>> mdc() {
        return MdcPropagator.INSTANCE;
    }

    /**
     * Copies a thread local. {@code copier} is applied to the launcher's value at capture time
     * and must return an independent copy (it may receive {@code null}).
     */
    static <T> ContextPropagator<T> threadLocal(ThreadLocal<T> local, UnaryOperator<T> copier) {
        return new ThreadLocalPropagator<>(local, copier);
    }
}

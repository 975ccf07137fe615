package com.hcltech.bgjobs.jobs.context;

import com.hcltech.bgjobs.common.function.ThrowingSupplier;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Immutable snapshot of the launching thread's state, taken once per job and applied on the
 * job thread around the job body.
 */
public final class ExecutionContext {
    private static final ExecutionContext EMPTY = new ExecutionContext(List.of());

    private final List<Captured<?>> captured;

    private ExecutionContext(List<Captured<?>> captured) {
        this.captured = captured;
    }

    public static ExecutionContext empty() {
        return EMPTY;
    }

    /** Runs every propagator's capture on the calling thread. */
    public static ExecutionContext capture(List<? extends ContextPropagator<?>> propagators) {
        if (propagators.isEmpty()) return EMPTY;
        List<Captured<?>> captured = new ArrayList<>(propagators.size());
        for (ContextPropagator<?> propagator : propagators) {
            captured.add(captureOne(propagator));
        }
        return new ExecutionContext(List.copyOf(captured));
    }

    private static <S> Captured<S> captureOne(ContextPropagator<S> propagator) {
        return new Captured<>(propagator, propagator.capture());
    }

    /**
     * Restores the snapshot on the current thread, runs {@code body}, then undoes the
     * restores in reverse order, whether or not {@code body} threw.
     */
    public <T> T call(ThrowingSupplier<T> body) throws Exception {
        Deque<ContextPropagator.Restored> restored = new ArrayDeque<>(captured.size());
        try {
            for (Captured<?> c : captured) {
                restored.push(c.restore());
            }
            return body.get();
        } finally {
            while (!restored.isEmpty()) {
                restored.pop().close();
            }
        }
    }

    public int size() {
        return captured.size();
    }

    private record Captured<S>(ContextPropagator<S> propagator, S snapshot) {
        ContextPropagator.Restored restore() {
            return propagator.restore(snapshot);
        }
    }
}

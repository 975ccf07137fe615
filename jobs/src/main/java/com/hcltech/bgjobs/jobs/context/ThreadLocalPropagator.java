package com.hcltech.bgjobs.jobs.context;

import java.util.Objects;
import java.util.function.UnaryOperator;

final class ThreadLocalPropagator<T> implements ContextPropagator<T> {
    private final ThreadLocal<T> local;
    private final UnaryOperator<T> copier;

    ThreadLocalPropagator(ThreadLocal<T> local, UnaryOperator<T> copier) {
        this.local = Objects.requireNonNull(local, "local");
        this.copier = Objects.requireNonNull(copier, "copier");
    }

    @Override
    public T capture() {
        return copier.apply(local.get());
    }

    @Override
    public Restored restore(T snapshot) {
        final T previous = local.get();
        local.set(snapshot);
        return () -> {
            if (previous == null) {
                local.remove();
            } else {
                local.set(previous);
            }
        };
    }
}

package com.hcltech.bgjobs.common.function;

@FunctionalInterface
public interface ThrowingRunnable {
    void run() throws Exception;

    /** Adapts to a supplier of {@code null} so runnables can go wherever suppliers do. */
    default ThrowingSupplier<Void> asSupplier() {
        return () -> {
            run();
            return null;
        };
    }
}

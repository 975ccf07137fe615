package com.hcltech.bgjobs.jobs;

/**
 * The caller's code that runs inside a {@link Jobs} barrier and launches jobs through the manager.
 *
 * @param <R> what the logic returns; handed back by the barrier after the drain
 * @param <E> checked exception the logic may throw, inferred as {@link RuntimeException} for lambdas that throw none
 */
@FunctionalInterface
public interface JobsLogic<R, E extends Exception> {
    R run(BgJobManager jobs) throws E;
}

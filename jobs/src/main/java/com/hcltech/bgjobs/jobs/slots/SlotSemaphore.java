package com.hcltech.bgjobs.jobs.slots;

/**
 * Bounds how many background jobs may be in flight at once. One slot is taken on the
 * launching thread before a job is spawned and given back by the job thread when it ends.
 */
public interface SlotSemaphore {

    /**
     * Blocks until a slot is free, then takes it. No slot is held if this throws.
     *
     * @throws IllegalStateException if the semaphore was closed by {@link #closeWhenDrained()}
     */
    void acquire() throws InterruptedException;

    /**
     * Takes a slot if one is free right now. Returns true on success.
     *
     * @throws IllegalStateException if the semaphore was closed by {@link #closeWhenDrained()}
     */
    boolean tryAcquire();

    /**
     * Gives back one previously acquired slot. May be called from any thread.
     *
     * @throws IllegalStateException if no slot is currently held
     */
    void release();

    /** Current number of free slots. Stale as soon as it is read; for diagnostics only. */
    int availableSlots();

    /** Fixed number of slots. */
    int capacity();

    /**
     * Blocks until no slot is held and no acquire is pending. Not interruptible: an interrupt
     * arriving while waiting is kept and is still set on the thread when this returns.
     */
    void awaitAllReleased();

    /**
     * As {@link #awaitAllReleased()}, then closes the semaphore in the same step: no acquire
     * can slip in between the last release and the close. Later acquires throw
     * {@link IllegalStateException}.
     */
    void closeWhenDrained();

    boolean isClosed();
}

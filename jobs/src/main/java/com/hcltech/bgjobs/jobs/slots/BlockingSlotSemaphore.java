package com.hcltech.bgjobs.jobs.slots;

import com.hcltech.bgjobs.jobs.JobsConfigurationException;

import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link Semaphore}-backed {@link SlotSemaphore}.
 * <p>
 * Two counters sit beside the semaphore:
 * <ul>
 *   <li>{@code granted}: slots actually held, guards against over-release.</li>
 *   <li>{@code outstanding}: slots held plus acquires still waiting. The drain waits for this to
 *       reach zero, so a launcher blocked in {@link #acquire()} keeps the barrier closed.</li>
 * </ul>
 * The last release signals a condition instead of having the drainer poll the semaphore.
 * Acquires register under the drain lock, so {@link #closeWhenDrained()} sees either the
 * registration or a closed gate, never neither.
 */
public final class BlockingSlotSemaphore implements SlotSemaphore {
    private final Semaphore sem;
    private final int capacity;
    private final AtomicInteger granted = new AtomicInteger();
    private final AtomicInteger outstanding = new AtomicInteger();
    private final ReentrantLock drainLock = new ReentrantLock();
    private final Condition allReleased = drainLock.newCondition();
    private boolean closed; // guarded by drainLock

    /**
     * @param capacity maximum number of jobs in flight. Must be > 0.
     * @param fair     if true, blocked launchers get slots in FIFO order.
     */
    public BlockingSlotSemaphore(int capacity, boolean fair) {
        if (capacity <= 0) {
            throw new JobsConfigurationException("expected limit to be > 0 but was " + capacity);
        }
        this.sem = new Semaphore(capacity, fair);
        this.capacity = capacity;
    }

    /** Convenience: non-fair (higher throughput). */
    public BlockingSlotSemaphore(int capacity) {
        this(capacity, false);
    }

    @Override
    public void acquire() throws InterruptedException {
        register();
        try {
            sem.acquire();
        } catch (InterruptedException e) {
            finishOne();
            throw e;
        }
        granted.incrementAndGet();
    }

    @Override
    public boolean tryAcquire() {
        register();
        if (sem.tryAcquire()) {
            granted.incrementAndGet();
            return true;
        }
        finishOne();
        return false;
    }

    @Override
    public void release() {
        int cur;
        do {
            cur = granted.get();
            if (cur == 0) {
                throw new IllegalStateException("SlotSemaphore.release without a held slot (capacity " + capacity + ")");
            }
        } while (!granted.compareAndSet(cur, cur - 1));
        sem.release();
        finishOne();
    }

    @Override
    public int availableSlots() {
        return sem.availablePermits();
    }

    @Override
    public int capacity() {
        return capacity;
    }

    @Override
    public void awaitAllReleased() {
        drainLock.lock();
        try {
            while (outstanding.get() > 0) {
                allReleased.awaitUninterruptibly();
            }
        } finally {
            drainLock.unlock();
        }
    }

    @Override
    public void closeWhenDrained() {
        drainLock.lock();
        try {
            while (outstanding.get() > 0) {
                allReleased.awaitUninterruptibly();
            }
            closed = true;
        } finally {
            drainLock.unlock();
        }
    }

    @Override
    public boolean isClosed() {
        drainLock.lock();
        try {
            return closed;
        } finally {
            drainLock.unlock();
        }
    }

    private void register() {
        drainLock.lock();
        try {
            if (closed) {
                throw new IllegalStateException("SlotSemaphore is closed: its jobs barrier has drained");
            }
            outstanding.incrementAndGet();
        } finally {
            drainLock.unlock();
        }
    }

    private void finishOne() {
        if (outstanding.decrementAndGet() == 0) {
            drainLock.lock();
            try {
                allReleased.signalAll();
            } finally {
                drainLock.unlock();
            }
        }
    }

    @Override
    public String toString() {
        return "BlockingSlotSemaphore{available=" + sem.availablePermits() + ", capacity=" + capacity + "}";
    }
}

package com.hcltech.bgjobs.jobs.threads;

/**
 * Creates the (unstarted) thread that runs one background job.
 *
 * Use the static helpers:
 *   - JobThreadFactory.platform()            // daemon platform threads
 *   - JobThreadFactory.virtualOrPlatform()   // virtual threads on JDK 21+, else platform
 */
@FunctionalInterface
public interface JobThreadFactory {

    /**
     * @param name thread name, also used as the job name in logs and failures
     * @param body what the thread runs
     */
    Thread newThread(String name, Runnable body);

    /** True if the threads are virtual. */
    default boolean isVirtual() {
        return false;
    }

    /** Human-friendly name, e.g. "platform" or "virtual". */
    default String name() {
        return getClass().getSimpleName();
    }

    // ---------- Static helpers ----------

    static JobThreadFactory platform() {
        return PlatformImpl.INSTANCE;
    }

    /** Probes for virtual threads once per call; falls back to {@link #platform()} on JDK 17. */
    static JobThreadFactory virtualOrPlatform() {
        JobThreadFactory virtual = LoomUtil.tryVirtualThreadFactory();
        return virtual != null ? virtual : platform();
    }

    final class PlatformImpl implements JobThreadFactory {
        static final PlatformImpl INSTANCE = new PlatformImpl();

        private PlatformImpl() {
        }

        @Override
        public Thread newThread(String name, Runnable body) {
            Thread t = new Thread(body, name);
            t.setDaemon(true);
            return t;
        }

        @Override
        public String name() {
            return "platform";
        }
    }
}

package com.hcltech.bgjobs.jobs.threads;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Method;
import java.util.concurrent.ThreadFactory;

final class LoomUtil {
    private static final Logger log = LoggerFactory.getLogger(LoomUtil.class);

    private LoomUtil() {
    }

    /** Returns a virtual-thread job factory if running on JDK >= 21; otherwise null. */
    static JobThreadFactory tryVirtualThreadFactory() {
        try {
            // Thread.ofVirtual().factory()
            Method ofVirtual = Thread.class.getMethod("ofVirtual");
            Object builder = ofVirtual.invoke(null);
            Method factory = Class.forName("java.lang.Thread$Builder").getMethod("factory");
            ThreadFactory threads = (ThreadFactory) factory.invoke(builder);
            return new VirtualImpl(threads);
        } catch (ReflectiveOperationException | RuntimeException e) {
            log.debug("Virtual threads not available, background jobs use platform threads: {}", e.toString());
            return null;
        }
    }

    static final class VirtualImpl implements JobThreadFactory {
        private final ThreadFactory threads;

        VirtualImpl(ThreadFactory threads) {
            this.threads = threads;
        }

        @Override
        public Thread newThread(String name, Runnable body) {
            Thread t = threads.newThread(body);
            t.setName(name);
            return t;
        }

        @Override
        public boolean isVirtual() {
            return true;
        }

        @Override
        public String name() {
            return "virtual";
        }
    }
}

package com.hcltech.bgjobs.jobs;

import com.hcltech.bgjobs.common.errorsor.ErrorsOr;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(10)
class BgResultTest {

    @Nested
    class Reading {
        @Test
        void getReturnsTheWrittenValueOnEveryRead() {
            BgResult<String> r = new BgResult<>("job-1");
            r.complete("v");
            assertEquals("v", r.get());
            assertEquals("v", r.get());
            assertTrue(r.isDone());
            assertFalse(r.isFailed());
        }

        @Test
        void nullIsAValidValueForGet() {
            BgResult<Void> r = new BgResult<>("job-1");
            r.complete(null);
            assertNull(r.get());
        }

        @Test
        void getBlocksUntilWritten() throws Exception {
            BgResult<Integer> r = new BgResult<>("job-1");
            AtomicReference<Integer> seen = new AtomicReference<>();
            CountDownLatch read = new CountDownLatch(1);
            Thread reader = new Thread(() -> {
                seen.set(r.get());
                read.countDown();
            });
            reader.start();

            assertFalse(read.await(100, TimeUnit.MILLISECONDS), "get must block before the write");
            r.complete(42);
            assertTrue(read.await(2, TimeUnit.SECONDS));
            assertEquals(42, seen.get());
        }

        @Test
        void getNowReturnsFallbackWhileRunning() {
            BgResult<String> r = new BgResult<>("job-1");
            assertEquals("pending", r.getNow("pending"));
            r.complete("done");
            assertEquals("done", r.getNow("pending"));
        }

        @Test
        void completedFactoryIsAlreadyDone() {
            BgResult<String> r = BgResult.completed("x");
            assertTrue(r.isDone());
            assertEquals("x", r.get());
        }

        @Test
        void completionStageSeesTheValue() throws Exception {
            BgResult<String> r = new BgResult<>("job-1");
            var upper = r.toCompletionStage().thenApply(String::toUpperCase).toCompletableFuture();
            r.complete("abc");
            assertEquals("ABC", upper.get(1, TimeUnit.SECONDS));
        }

        @Test
        void interruptedReaderGetsJobsInterruptedExceptionWithFlagSet() throws Exception {
            BgResult<String> r = new BgResult<>("job-1");
            AtomicReference<Throwable> thrown = new AtomicReference<>();
            AtomicBoolean flag = new AtomicBoolean();
            Thread reader = new Thread(() -> {
                try {
                    r.get();
                } catch (JobsInterruptedException e) {
                    thrown.set(e);
                    flag.set(Thread.currentThread().isInterrupted());
                }
            });
            reader.start();
            while (reader.getState() != Thread.State.WAITING) Thread.sleep(5);
            reader.interrupt();
            reader.join(2000);

            assertInstanceOf(JobsInterruptedException.class, thrown.get());
            assertTrue(flag.get());
        }
    }

    @Nested
    class Writing {
        @Test
        void secondWriteIsAProgrammingError() {
            BgResult<String> r = new BgResult<>("job-7");
            r.complete("first");
            var ex = assertThrows(IllegalStateException.class, () -> r.complete("second"));
            assertTrue(ex.getMessage().contains("job-7"));
            assertEquals("first", r.get());
        }

        @Test
        void failAfterWriteIsIgnored() {
            BgResult<String> r = new BgResult<>("job-1");
            r.complete("v");
            assertFalse(r.fail(new RuntimeException("late")));
            assertEquals("v", r.get());
        }
    }

    @Nested
    class Failure {
        @Test
        void getThrowsJobFailedExceptionCarryingTheCause() {
            BgResult<String> r = new BgResult<>("job-3");
            IOException boom = new IOException("boom");
            assertTrue(r.fail(boom));

            var ex = assertThrows(JobFailedException.class, r::get);
            assertSame(boom, ex.getCause());
            assertEquals("job-3", ex.jobName());
            assertTrue(r.isFailed());
            assertTrue(r.isDone());
        }

        @Test
        void getNowOnAFailedResultThrowsInsteadOfReturningTheFallback() {
            BgResult<String> r = new BgResult<>("job-x");
            RuntimeException boom = new RuntimeException("boom");
            r.fail(boom);

            var ex = assertThrows(JobFailedException.class, () -> r.getNow("fallback"));
            assertSame(boom, ex.getCause());
            assertEquals("job-x", ex.jobName());
        }

        @Test
        void everyReadOfAFailedResultThrows() {
            BgResult<String> r = new BgResult<>("job-3");
            r.fail(new IllegalStateException("bad"));
            assertThrows(JobFailedException.class, r::get);
            assertThrows(JobFailedException.class, () -> r.getNow("fallback"));
        }
    }

    @Nested
    class AsErrorsOr {
        @Test
        void valueBecomesValue() {
            BgResult<String> r = new BgResult<>("job-1");
            r.complete("ok");
            assertEquals(ErrorsOr.lift("ok"), r.result());
        }

        @Test
        void failureBecomesErrorMessage() {
            BgResult<String> r = new BgResult<>("job-2");
            r.fail(new IOException("disk full"));
            assertEquals(List.of("Background job job-2 failed: IOException: disk full"), r.result().getErrors());
        }

        @Test
        void nullBecomesError() {
            BgResult<String> r = new BgResult<>("job-4");
            r.complete(null);
            assertEquals(List.of("Background job job-4 produced no value"), r.result().getErrors());
        }
    }
}

package com.hcltech.bgjobs.jobs.context;

import com.hcltech.bgjobs.jobs.Jobs;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ContextPropagationThroughJobsTest {

    @Mock
    ContextPropagator<String> propagator;

    @Mock
    ContextPropagator.Restored undo;

    @AfterEach
    void cleanUp() {
        MDC.clear();
    }

    @Test
    void captureOnLauncherRestoreAndUndoOnJobThread() {
        AtomicReference<String> captureThread = new AtomicReference<>();
        AtomicReference<String> restoreThread = new AtomicReference<>();
        when(propagator.capture()).thenAnswer(inv -> {
            captureThread.set(Thread.currentThread().getName());
            return "snapshot";
        });
        when(propagator.restore("snapshot")).thenAnswer(inv -> {
            restoreThread.set(Thread.currentThread().getName());
            return undo;
        });

        String jobThread = Jobs.builder(1).noPropagation().propagate(propagator).run(jobs ->
                jobs.background(() -> Thread.currentThread().getName()).get());

        assertEquals(Thread.currentThread().getName(), captureThread.get());
        assertEquals(jobThread, restoreThread.get());
        InOrder order = inOrder(propagator, undo);
        order.verify(propagator).capture();
        order.verify(propagator).restore("snapshot");
        order.verify(undo).close();
        verifyNoMoreInteractions(propagator, undo);
    }

    @Test
    void capturesOncePerLaunch() {
        when(propagator.capture()).thenReturn("s");
        when(propagator.restore("s")).thenReturn(undo);

        Jobs.builder(2).noPropagation().propagate(propagator).run(jobs -> {
            jobs.background(() -> 1);
            jobs.background(() -> 2);
            jobs.background(() -> 3);
            return null;
        });

        verify(propagator, times(3)).capture();
        verify(undo, times(3)).close();
    }

    @Test
    void mdcIsPropagatedByDefault() {
        MDC.put("script", "nightly-build");
        String seen = Jobs.jobs(1, jobs -> jobs.background(() -> MDC.get("script")).get());
        assertEquals("nightly-build", seen);
    }

    @Test
    void noPropagationLeavesTheJobMdcEmpty() {
        MDC.put("script", "nightly-build");
        String seen = Jobs.builder(1).noPropagation().run(jobs -> jobs.background(() -> MDC.get("script")).get());
        assertNull(seen);
    }
}

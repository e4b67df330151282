package com.manifold.core.dispatch;

import com.manifold.core.events.EventBus;
import com.manifold.core.events.ResearchEvent;
import com.manifold.core.model.TerminalStatus;
import com.manifold.core.model.ThreadSpec;
import com.manifold.core.store.RunStoreFixtures;
import com.manifold.core.store.StorageException;
import com.manifold.core.worker.ResearchWorker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class ResearchDispatcherTest {

    private ResearchWorker worker;
    private EventBus eventBus;
    private List<ResearchEvent> events;

    @BeforeEach
    void setUp() throws Exception {
        worker = mock(ResearchWorker.class);
        eventBus = new EventBus();
        events = new CopyOnWriteArrayList<>();
        eventBus.subscribe("R-1", events::add);
    }

    private ResearchDispatcher dispatcher(long deadlineMs) {
        return new ResearchDispatcher(worker, deadlineMs, eventBus, null);
    }

    private void whenThread(String threadId, org.mockito.stubbing.Answer<Object> answer) throws Exception {
        doAnswer(inv -> {
            ThreadSpec thread = inv.getArgument(1);
            return thread.id().equals(threadId) ? answer.answer(inv) : null;
        }).when(worker).research(anyString(), any(ThreadSpec.class));
    }

    @Test
    @DisplayName("every thread gets exactly one worker and a terminal status, in plan order")
    void allDone() throws Exception {
        var plan = RunStoreFixtures.plan("R-1", 4);

        Map<String, TerminalStatus> statuses = dispatcher(5_000).dispatch("R-1", plan);

        assertEquals(plan.threadIds(), List.copyOf(statuses.keySet()));
        assertTrue(statuses.values().stream().allMatch(TerminalStatus::isDone));
        verify(worker, times(4)).research(anyString(), any(ThreadSpec.class));
        assertEquals(4, events.stream().filter(e -> ResearchEvent.WORKER_STARTED.equals(e.eventType())).count());
        assertEquals(4, events.stream().filter(e -> ResearchEvent.WORKER_TERMINAL.equals(e.eventType())).count());
    }

    @Test
    @DisplayName("a crashing worker is FAILED and its siblings are unaffected")
    void failureIsIsolated() throws Exception {
        whenThread("t2-angle", inv -> {
            throw new IllegalStateException("parser blew up");
        });
        var plan = RunStoreFixtures.plan("R-1", 3);

        Map<String, TerminalStatus> statuses = dispatcher(5_000).dispatch("R-1", plan);

        assertEquals(TerminalStatus.Kind.FAILED, statuses.get("t2-angle").kind());
        assertEquals("parser blew up", statuses.get("t2-angle").reason());
        assertTrue(statuses.get("t1-angle").isDone());
        assertTrue(statuses.get("t3-angle").isDone());
    }

    @Test
    @DisplayName("a worker still running at the deadline is cancelled and TIMED_OUT")
    void deadlineTimesOut() throws Exception {
        whenThread("t1-angle", inv -> {
            Thread.sleep(10_000);
            return null;
        });
        var plan = RunStoreFixtures.plan("R-1", 2);

        long start = System.currentTimeMillis();
        Map<String, TerminalStatus> statuses = dispatcher(300).dispatch("R-1", plan);

        assertTrue(System.currentTimeMillis() - start < 5_000);
        assertEquals(TerminalStatus.Kind.TIMED_OUT, statuses.get("t1-angle").kind());
        assertTrue(statuses.get("t2-angle").isDone());
        assertTrue(events.stream().anyMatch(e -> ResearchEvent.WORKER_TERMINAL.equals(e.eventType())
                && "t1-angle".equals(e.threadId())
                && "TIMED_OUT".equals(e.payload().get("status"))));
    }

    @Test
    @DisplayName("a worker cancelled from within reports TIMED_OUT rather than FAILED")
    void interruptedWorkerTimesOut() throws Exception {
        whenThread("t1-angle", inv -> {
            throw new InterruptedException("cancelled");
        });

        Map<String, TerminalStatus> statuses = dispatcher(5_000).dispatch("R-1", RunStoreFixtures.plan("R-1", 2));

        assertEquals(TerminalStatus.timedOut("interrupted"), statuses.get("t1-angle"));
    }

    @Test
    @DisplayName("a storage failure aborts the dispatch")
    void storageFailureIsRethrown() throws Exception {
        whenThread("t2-angle", inv -> {
            throw new StorageException("disk full");
        });

        var dispatcher = dispatcher(5_000);
        var plan = RunStoreFixtures.plan("R-1", 3);
        assertThrows(StorageException.class, () -> dispatcher.dispatch("R-1", plan));
    }

    @Test
    @DisplayName("all workers of a full plan run at the same time")
    void everyWorkerStartsImmediately() throws Exception {
        var started = new CountDownLatch(6);
        var allRunning = new AtomicInteger();
        doAnswer(inv -> {
            started.countDown();
            if (started.await(2, TimeUnit.SECONDS)) {
                allRunning.incrementAndGet();
            }
            return null;
        }).when(worker).research(anyString(), any(ThreadSpec.class));
        var plan = RunStoreFixtures.plan("R-1", 6);

        Map<String, TerminalStatus> statuses = dispatcher(5_000).dispatch("R-1", plan);

        assertEquals(6, allRunning.get());
        assertTrue(statuses.values().stream().allMatch(TerminalStatus::isDone));
    }

    @Test
    @DisplayName("workers that each fit the deadline are never timed out by queueing")
    void noQueueingTimeouts() throws Exception {
        doAnswer(inv -> {
            Thread.sleep(300);
            return null;
        }).when(worker).research(anyString(), any(ThreadSpec.class));
        var plan = RunStoreFixtures.plan("R-1", 6);

        Map<String, TerminalStatus> statuses = dispatcher(1_500).dispatch("R-1", plan);

        assertTrue(statuses.values().stream().allMatch(TerminalStatus::isDone), statuses.toString());
    }

    @Nested
    @DisplayName("settling workers after the deadline")
    class SettleAfterDeadline {

        @Test
        @DisplayName("a worker that finished after the last poll keeps DONE")
        void lateFinisherIsDone() {
            var future = CompletableFuture.completedFuture("t1-angle");

            assertEquals(TerminalStatus.done(), ResearchDispatcher.settleAfterDeadline(future, "t1-angle", 500));
        }

        @Test
        @DisplayName("a worker that failed after the last poll keeps FAILED")
        void lateFailureIsFailed() {
            var future = new CompletableFuture<String>();
            future.completeExceptionally(new IllegalStateException("boom"));

            assertEquals(TerminalStatus.failed("boom"), ResearchDispatcher.settleAfterDeadline(future, "t1-angle", 500));
        }

        @Test
        @DisplayName("a worker still running is cancelled and TIMED_OUT")
        void runningWorkerIsCancelled() {
            var future = new CompletableFuture<String>();

            TerminalStatus status = ResearchDispatcher.settleAfterDeadline(future, "t1-angle", 500);

            assertEquals(TerminalStatus.timedOut("deadline of 500 ms elapsed"), status);
            assertTrue(future.isCancelled());
        }
    }
}

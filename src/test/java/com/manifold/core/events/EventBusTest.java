package com.manifold.core.events;

import com.manifold.core.store.RunStoreFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBus}.
 */
class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    @Test
    @DisplayName("ResearchEvent.of stamps a timestamp and keeps a null thread id")
    void eventFactory() {
        var event = ResearchEvent.of(ResearchEvent.PLAN_WRITTEN, "R-1", null, Map.of("threads", 2));

        assertEquals("plan.written", event.eventType());
        assertEquals("R-1", event.runId());
        assertNull(event.threadId());
        assertNotNull(event.timestamp());
    }

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("delivers event to run subscriber")
        void deliversEventToRunSubscriber() {
            List<ResearchEvent> received = new ArrayList<>();
            eventBus.subscribe("R-1", received::add);

            var event = ResearchEvent.of(ResearchEvent.WORKER_STARTED, "R-1", "t1-core", Map.of());
            eventBus.publish(event);

            assertEquals(List.of(event), received);
        }

        @Test
        @DisplayName("does not deliver event to subscribers of a different run")
        void doesNotDeliverToDifferentRun() {
            List<ResearchEvent> received = new ArrayList<>();
            eventBus.subscribe("R-2", received::add);

            eventBus.publish(ResearchEvent.of(ResearchEvent.WORKER_STARTED, "R-1", "t1-core", Map.of()));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("delivers events in publish order")
        void deliversEventsInOrder() {
            List<ResearchEvent> received = new ArrayList<>();
            eventBus.subscribe("R-1", received::add);

            eventBus.publish(ResearchEvent.of(ResearchEvent.PLAN_WRITTEN, "R-1", null, Map.of()));
            eventBus.publish(ResearchEvent.of(ResearchEvent.FINDING_WRITTEN, "R-1", "t1", Map.of()));
            eventBus.publish(ResearchEvent.of(ResearchEvent.OUTPUT_WRITTEN, "R-1", null, Map.of()));

            assertEquals(List.of("plan.written", "finding.written", "output.written"),
                    received.stream().map(ResearchEvent::eventType).toList());
        }

        @Test
        @DisplayName("global and run subscribers both receive the event")
        void globalAndRunBothReceive() {
            List<ResearchEvent> global = new ArrayList<>();
            List<ResearchEvent> run = new ArrayList<>();
            eventBus.subscribeAll(global::add);
            eventBus.subscribe("R-1", run::add);

            eventBus.publish(ResearchEvent.of(ResearchEvent.RUN_CREATED, "R-1", null, Map.of()));
            eventBus.publish(ResearchEvent.of(ResearchEvent.RUN_CREATED, "R-2", null, Map.of()));

            assertEquals(2, global.size());
            assertEquals(1, run.size());
        }
    }

    @Nested
    @DisplayName("unsubscribe")
    class UnsubscribeTests {

        @Test
        @DisplayName("unsubscribing stops delivery of future events")
        void unsubscribeStopsDelivery() {
            List<ResearchEvent> received = new ArrayList<>();
            EventBus.Subscription subscription = eventBus.subscribe("R-1", received::add);

            eventBus.publish(ResearchEvent.of(ResearchEvent.WORKER_STATE, "R-1", "t1", Map.of()));
            subscription.unsubscribe();
            eventBus.publish(ResearchEvent.of(ResearchEvent.WORKER_STATE, "R-1", "t1", Map.of()));

            assertEquals(1, received.size());
        }

        @Test
        @DisplayName("unsubscribing global subscription stops delivery")
        void unsubscribeGlobal() {
            List<ResearchEvent> received = new ArrayList<>();
            EventBus.Subscription subscription = eventBus.subscribeAll(received::add);

            subscription.unsubscribe();
            eventBus.publish(ResearchEvent.of(ResearchEvent.RUN_CREATED, "R-1", null, Map.of()));

            assertTrue(received.isEmpty());
        }
    }

    @Test
    @DisplayName("concurrent publishes from worker threads are all delivered")
    void handlesConcurrentPublishes() throws InterruptedException {
        CopyOnWriteArrayList<ResearchEvent> received = new CopyOnWriteArrayList<>();
        eventBus.subscribe("R-1", received::add);

        int threadCount = 6;
        int eventsPerThread = 100;
        CountDownLatch latch = new CountDownLatch(threadCount);
        for (int t = 0; t < threadCount; t++) {
            final String threadId = "t" + t;
            new Thread(() -> {
                for (int i = 0; i < eventsPerThread; i++) {
                    eventBus.publish(ResearchEvent.of(ResearchEvent.WORKER_STATE, "R-1", threadId, Map.of()));
                }
                latch.countDown();
            }).start();
        }

        assertTrue(latch.await(10, TimeUnit.SECONDS));
        assertEquals(threadCount * eventsPerThread, received.size());
    }

    @Test
    @DisplayName("subscriber exception does not prevent delivery to other subscribers")
    void subscriberExceptionDoesNotPreventOthers() {
        List<ResearchEvent> received = new ArrayList<>();
        eventBus.subscribe("R-1", e -> {
            throw new RuntimeException("boom");
        });
        eventBus.subscribe("R-1", received::add);

        eventBus.publish(ResearchEvent.of(ResearchEvent.WORKER_STARTED, "R-1", "t1", Map.of()));

        assertEquals(1, received.size());
    }

    @Nested
    @DisplayName("run lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("run watchers receive the terminal event and are then released")
        void releasedAfterCompletion() {
            List<ResearchEvent> received = new ArrayList<>();
            eventBus.subscribe("R-1", received::add);
            assertEquals(Set.of("R-1"), eventBus.watchedRuns());

            eventBus.publish(ResearchEvent.of(ResearchEvent.RUN_COMPLETED, "R-1", null, Map.of()));
            eventBus.publish(ResearchEvent.of(ResearchEvent.WORKER_STATE, "R-1", "t1", Map.of()));

            assertEquals(List.of("run.completed"), received.stream().map(ResearchEvent::eventType).toList());
            assertTrue(eventBus.watchedRuns().isEmpty());
        }

        @Test
        @DisplayName("a failed run releases its watchers but not those of other runs")
        void failureReleasesOnlyThatRun() {
            eventBus.subscribe("R-1", e -> { });
            eventBus.subscribe("R-2", e -> { });

            eventBus.publish(ResearchEvent.of(ResearchEvent.RUN_FAILED, "R-1", null, Map.of("error", "boom")));

            assertEquals(Set.of("R-2"), eventBus.watchedRuns());
        }

        @Test
        @DisplayName("global subscribers outlive individual runs")
        void globalSurvivesTerminal() {
            List<ResearchEvent> global = new ArrayList<>();
            eventBus.subscribeAll(global::add);

            eventBus.publish(ResearchEvent.of(ResearchEvent.RUN_COMPLETED, "R-1", null, Map.of()));
            eventBus.publish(ResearchEvent.of(ResearchEvent.RUN_CREATED, "R-2", null, Map.of()));

            assertEquals(2, global.size());
        }

        @Test
        @DisplayName("the last unsubscribe closes the run channel")
        void lastUnsubscribeCloses() {
            EventBus.Subscription a = eventBus.subscribe("R-1", e -> { });
            EventBus.Subscription b = eventBus.subscribe("R-1", e -> { });

            a.unsubscribe();
            assertEquals(Set.of("R-1"), eventBus.watchedRuns());
            b.unsubscribe();
            assertTrue(eventBus.watchedRuns().isEmpty());
        }
    }

    @Nested
    @DisplayName("artifact write events")
    class WriteEventTests {

        @Test
        @DisplayName("a filtered watcher sees only plan, finding and output writes")
        void filteredSubscription() {
            List<ResearchEvent> writes = new ArrayList<>();
            eventBus.subscribe("R-1", ResearchEvent.WRITE_EVENTS, writes::add);

            eventBus.publish(ResearchEvent.of(ResearchEvent.RUN_CREATED, "R-1", null, Map.of()));
            eventBus.publish(ResearchEvent.planWritten(RunStoreFixtures.plan("R-1", 2)));
            eventBus.publish(ResearchEvent.of(ResearchEvent.WORKER_STATE, "R-1", "t1-angle", Map.of()));
            eventBus.publish(ResearchEvent.findingWritten("R-1", RunStoreFixtures.finding("t1-angle")));
            eventBus.publish(ResearchEvent.outputWritten(RunStoreFixtures.output("R-1")));

            assertEquals(List.of("plan.written", "finding.written", "output.written"),
                    writes.stream().map(ResearchEvent::eventType).toList());
            assertTrue(writes.stream().allMatch(ResearchEvent::isWrite));
        }

        @Test
        @DisplayName("typed factories carry the artifact's identity")
        void typedFactories() {
            var plan = ResearchEvent.planWritten(RunStoreFixtures.plan("R-1", 2));
            var finding = ResearchEvent.findingWritten("R-1", RunStoreFixtures.finding("t1-angle"));

            assertEquals("R-1", plan.runId());
            assertEquals(List.of("t1-angle", "t2-angle"), plan.payload().get("threads"));
            assertEquals("t1-angle", finding.threadId());
            assertFalse(finding.isTerminal());
        }
    }
}

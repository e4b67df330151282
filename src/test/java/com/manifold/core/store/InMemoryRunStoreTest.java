package com.manifold.core.store;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static com.manifold.core.store.RunStoreFixtures.finding;
import static com.manifold.core.store.RunStoreFixtures.output;
import static com.manifold.core.store.RunStoreFixtures.plan;
import static org.junit.jupiter.api.Assertions.*;

class InMemoryRunStoreTest {

    private final InMemoryRunStore store = new InMemoryRunStore();

    @Test
    @DisplayName("stores and reads back plan, findings and output")
    void roundTrip() {
        var plan = plan("R-1", 2);
        store.writePlan(plan);
        store.putFinding("R-1", finding("t2-angle"));
        store.writeFinalOutput(output("R-1"));

        assertEquals(plan, store.readPlan("R-1").orElseThrow());
        assertEquals(List.of("t2-angle"), List.copyOf(store.readFindings("R-1", plan.threadIds()).keySet()));
        assertTrue(store.readFinalOutput("R-1").isPresent());
        assertEquals(List.of("R-1"), store.listRunIds());
    }

    @Test
    @DisplayName("finding keys are write-once")
    void writeOnce() {
        store.putFinding("R-1", finding("t1-angle"));
        assertThrows(IllegalStateException.class, () -> store.putFinding("R-1", finding("t1-angle")));
    }

    @Test
    @DisplayName("the same thread id in two runs does not collide")
    void runsAreSeparateNamespaces() {
        store.putFinding("R-1", finding("t1-angle"));
        assertDoesNotThrow(() -> store.putFinding("R-2", finding("t1-angle")));
        assertFalse(store.exists("R-3"));
    }

    @Test
    @DisplayName("only one of many racing writers to one key wins")
    void racingWritersOneWins() throws Exception {
        var executor = Executors.newFixedThreadPool(4);
        int wins = 0;
        try {
            var futures = new ArrayList<Future<Boolean>>();
            for (int i = 0; i < 4; i++) {
                futures.add(executor.submit((Callable<Boolean>) () -> {
                    try {
                        store.putFinding("R-1", finding("t1-angle"));
                        return true;
                    } catch (IllegalStateException e) {
                        return false;
                    }
                }));
            }
            for (Future<Boolean> f : futures) {
                if (f.get()) {
                    wins++;
                }
            }
        } finally {
            executor.shutdownNow();
        }
        assertEquals(1, wins);
    }
}

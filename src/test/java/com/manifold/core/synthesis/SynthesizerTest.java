package com.manifold.core.synthesis;

import com.manifold.core.model.Claim;
import com.manifold.core.model.FinalOutput;
import com.manifold.core.model.Finding;
import com.manifold.core.model.OutputFormat;
import com.manifold.core.model.ResearchPlan;
import com.manifold.core.model.SourceRef;
import com.manifold.core.model.SourceType;
import com.manifold.core.model.Stance;
import com.manifold.core.model.TerminalStatus;
import com.manifold.core.store.InMemoryRunStore;
import com.manifold.core.store.RunStore;
import com.manifold.core.store.RunStoreFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SynthesizerTest {

    private RunStore store;
    private Synthesizer synthesizer;

    @BeforeEach
    void setUp() {
        store = new InMemoryRunStore();
        synthesizer = new Synthesizer(store, null);
    }

    private static Map<String, TerminalStatus> allDone(ResearchPlan plan) {
        var statuses = new LinkedHashMap<String, TerminalStatus>();
        plan.threadIds().forEach(id -> statuses.put(id, TerminalStatus.done()));
        return statuses;
    }

    private static Finding findingWith(String threadId, Claim claim, List<String> gaps, boolean partial) {
        return new Finding(threadId, "focus of " + threadId, "summary of " + threadId, List.of(claim),
                List.of(claim.source()), gaps, List.of(), 1, partial);
    }

    @Test
    @DisplayName("simple query with every thread and no conflict yields a brief")
    void simpleQueryYieldsBrief() {
        ResearchPlan plan = RunStoreFixtures.plan("R-A", 2);
        plan.threadIds().forEach(id -> store.putFinding("R-A", RunStoreFixtures.finding(id)));

        FinalOutput output = synthesizer.synthesize(plan, allDone(plan));

        assertEquals(OutputFormat.BRIEF, output.format());
        assertFalse(output.lowConfidence());
        assertEquals(0, output.conflictCount());
        assertTrue(output.missingThreadIds().isEmpty());
        assertTrue(output.body().contains("## Bottom line"));
        assertTrue(output.body().contains("## Key sources"));
    }

    @Test
    @DisplayName("complex query with opposing claims yields a report flagging the conflict")
    void conflictYieldsReport() {
        ResearchPlan plan = RunStoreFixtures.plan("R-B", 6);
        var docs = new SourceRef("Vendor docs", "https://docs.vendor.example/guide/semantics", SourceType.PRIMARY_DOCS);
        var forum = new SourceRef("Forum thread", "https://forum.example/t/42", SourceType.FORUM);
        for (String id : plan.threadIds()) {
            Claim claim = switch (id) {
                case "t1-angle" -> new Claim("Exactly-once delivery", "Exactly-once is supported", Stance.AFFIRMS, docs);
                case "t4-angle" -> new Claim("exactly once delivery", "Exactly-once is not guaranteed", Stance.DENIES, forum);
                default -> new Claim("topic " + id, "Neutral note on " + id, Stance.NEUTRAL, docs);
            };
            store.putFinding("R-B", findingWith(id, claim, List.of(), false));
        }

        FinalOutput output = synthesizer.synthesize(plan, allDone(plan));

        assertEquals(OutputFormat.REPORT, output.format());
        assertEquals(1, output.conflictCount());
        String body = output.body();
        assertTrue(body.contains("**CONFLICTING claims on: Exactly-once delivery**"));
        assertTrue(body.contains("Exactly-once is supported"));
        assertTrue(body.contains("Exactly-once is not guaranteed"));
        assertTrue(body.contains("leans towards the affirms side"));
        for (String id : plan.threadIds()) {
            assertTrue(body.contains("(" + id + ")"), "section for " + id);
        }
    }

    @Test
    @DisplayName("a partial finding's gaps surface in the output")
    void partialFindingGapsSurface() {
        ResearchPlan plan = RunStoreFixtures.plan("R-C", 3);
        store.putFinding("R-C", RunStoreFixtures.finding("t1-angle"));
        store.putFinding("R-C", RunStoreFixtures.finding("t2-angle"));
        var claim = new Claim("topic", "Some partial evidence", Stance.NEUTRAL,
                new SourceRef("Blog", "https://blog.example/a/b", SourceType.COMMUNITY_BLOG));
        store.putFinding("R-C", findingWith("t3-angle", claim,
                List.of("Capability 'transcript' failed after 3 attempts for query 'x': timeout"), true));

        FinalOutput output = synthesizer.synthesize(plan, allDone(plan));

        assertEquals(OutputFormat.REPORT, output.format());
        assertTrue(output.body().contains("t3-angle: Capability 'transcript' failed after 3 attempts"));
    }

    @Test
    @DisplayName("a missing thread is named and forces a report")
    void missingThreadIsNamed() {
        ResearchPlan plan = RunStoreFixtures.plan("R-M", 2);
        store.putFinding("R-M", RunStoreFixtures.finding("t1-angle"));
        var statuses = new LinkedHashMap<String, TerminalStatus>();
        statuses.put("t1-angle", TerminalStatus.done());
        statuses.put("t2-angle", TerminalStatus.timedOut("deadline of 100 ms elapsed"));

        FinalOutput output = synthesizer.synthesize(plan, statuses);

        assertEquals(OutputFormat.REPORT, output.format());
        assertEquals(List.of("t2-angle"), output.missingThreadIds());
        assertTrue(output.body().contains("Missing finding for thread `t2-angle` (TIMED_OUT(deadline of 100 ms elapsed))"));
        assertTrue(output.body().contains("_No finding: TIMED_OUT"));
    }

    @Test
    @DisplayName("no findings at all yields a gaps-only, low-confidence output")
    void noFindingsYieldsGapsOnly() {
        ResearchPlan plan = RunStoreFixtures.plan("R-D", 3);
        var statuses = new LinkedHashMap<String, TerminalStatus>();
        plan.threadIds().forEach(id -> statuses.put(id, TerminalStatus.failed("boom")));

        FinalOutput output = synthesizer.synthesize(plan, statuses);

        assertTrue(output.lowConfidence());
        assertEquals(OutputFormat.REPORT, output.format());
        assertEquals(plan.threadIds(), output.missingThreadIds());
        assertTrue(output.body().startsWith("## Gaps"));
        assertFalse(output.body().contains("## Findings"));
        for (String id : plan.threadIds()) {
            assertTrue(output.body().contains("- `" + id + "`"));
        }
    }

    @Test
    @DisplayName("synthesis does not persist the output")
    void doesNotWrite() {
        ResearchPlan plan = RunStoreFixtures.plan("R-W", 2);
        plan.threadIds().forEach(id -> store.putFinding("R-W", RunStoreFixtures.finding(id)));

        synthesizer.synthesize(plan, allDone(plan));

        assertTrue(store.readFinalOutput("R-W").isEmpty());
    }

    @Test
    @DisplayName("synthesizing the same findings twice gives the same format and body")
    void synthesisIsIdempotent() {
        ResearchPlan plan = RunStoreFixtures.plan("R-I", 4);
        var docs = new SourceRef("Vendor docs", "https://docs.vendor.example/guide/limits", SourceType.PRIMARY_DOCS);
        var blog = new SourceRef("Blog post", "https://blog.example/limits", SourceType.COMMUNITY_BLOG);
        store.putFinding("R-I", findingWith("t1-angle",
                new Claim("Rate limits", "Rate limits are per tenant", Stance.AFFIRMS, docs), List.of(), false));
        store.putFinding("R-I", findingWith("t2-angle",
                new Claim("rate limits", "Rate limits are not per tenant", Stance.DENIES, blog), List.of("thin"), true));
        store.putFinding("R-I", findingWith("t3-angle",
                new Claim("Pricing", "Pricing is usage based", Stance.NEUTRAL, docs), List.of(), false));
        var statuses = allDone(plan);
        statuses.put("t4-angle", TerminalStatus.failed("boom"));

        FinalOutput first = synthesizer.synthesize(plan, statuses);
        FinalOutput second = synthesizer.synthesize(plan, statuses);

        assertEquals(first.format(), second.format());
        assertEquals(first.body(), second.body());
        assertEquals(first, second);
        assertEquals(List.of("t4-angle"), first.missingThreadIds());
    }
}

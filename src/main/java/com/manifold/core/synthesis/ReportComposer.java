package com.manifold.core.synthesis;

import com.manifold.core.model.Claim;
import com.manifold.core.model.Finding;
import com.manifold.core.model.ResearchPlan;
import com.manifold.core.model.SourceRef;
import com.manifold.core.model.TerminalStatus;
import com.manifold.core.model.ThreadSpec;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Renders the markdown body of a final output. Every section is derived from findings only;
 * nothing is written for a thread that produced no finding except its entry under gaps.
 */
public class ReportComposer {

    private static final int BRIEF_POINTS_PER_THREAD = 2;
    private static final int BRIEF_SOURCES = 5;

    /**
     * Brief: bottom line, key points, recommendations, limitations, key sources.
     */
    public String composeBrief(ResearchPlan plan, List<Finding> findings, List<String> missingThreadIds,
                               Map<String, TerminalStatus> statuses) {
        var sb = new StringBuilder();
        sb.append("# ").append(plan.query()).append("\n\n");

        sb.append("## Bottom line\n\n");
        sb.append(findings.isEmpty() ? "No findings available." : findings.get(0).summary()).append("\n\n");

        sb.append("## Key points\n\n");
        for (Finding finding : findings) {
            finding.findings().stream().limit(BRIEF_POINTS_PER_THREAD)
                    .forEach(c -> sb.append("- ").append(c.statement()).append(cite(c.source())).append('\n'));
        }
        sb.append('\n');

        appendRecommendations(sb, findings);
        appendLimitations(sb, "## Limitations", plan, findings, missingThreadIds, statuses);

        sb.append("## Key sources\n\n");
        List<SourceRef> sources = consolidatedSources(findings);
        if (sources.isEmpty()) {
            sb.append("None.\n");
        }
        sources.stream().limit(BRIEF_SOURCES).forEach(s -> sb.append("- ").append(formatSource(s)).append('\n'));
        return sb.toString();
    }

    /**
     * Report: executive summary, background, per-thread findings in plan order, analysis with
     * conflicts flagged, recommendations, limitations and gaps, consolidated sources.
     */
    public String composeReport(ResearchPlan plan, List<Finding> findings, List<Conflict> conflicts,
                                List<String> missingThreadIds, Map<String, TerminalStatus> statuses) {
        Map<String, Finding> byThread = new LinkedHashMap<>();
        findings.forEach(f -> byThread.put(f.threadId(), f));
        var sb = new StringBuilder();
        sb.append("# Research report: ").append(plan.query()).append("\n\n");

        sb.append("## Executive summary\n\n");
        sb.append(findings.size()).append(" of ").append(plan.threads().size())
                .append(" research threads reported");
        if (!conflicts.isEmpty()) {
            sb.append("; ").append(conflicts.size()).append(" topic(s) have conflicting evidence");
        }
        sb.append(".\n\n");
        for (Finding finding : findings) {
            sb.append("- **").append(finding.focus()).append("**: ").append(finding.summary()).append('\n');
        }
        sb.append('\n');

        var classification = plan.classification();
        sb.append("## Background\n\n");
        sb.append("Query classified as ").append(classification.queryType())
                .append(" / ").append(classification.complexity())
                .append(", researched by ").append(plan.threads().size()).append(" independent threads.\n\n");

        sb.append("## Findings\n\n");
        for (ThreadSpec thread : plan.threads()) {
            sb.append("### ").append(thread.focus()).append(" (").append(thread.id()).append(")\n\n");
            Finding finding = byThread.get(thread.id());
            if (finding == null) {
                sb.append("_No finding: ").append(statusOf(statuses, thread.id())).append("._\n\n");
                continue;
            }
            sb.append(finding.summary()).append("\n\n");
            for (Claim claim : finding.findings()) {
                sb.append("- ").append(claim.statement()).append(cite(claim.source())).append('\n');
            }
            if (!finding.findings().isEmpty()) {
                sb.append('\n');
            }
        }

        sb.append("## Analysis\n\n");
        if (conflicts.isEmpty()) {
            sb.append("No conflicting claims were found across threads.\n\n");
        }
        for (Conflict conflict : conflicts) {
            sb.append("**CONFLICTING claims on: ").append(conflict.topic()).append("**\n\n");
            for (ClaimIndex.Entry entry : conflict.affirms()) {
                sb.append("- Affirms (").append(entry.threadId()).append("): ")
                        .append(entry.claim().statement()).append(cite(entry.claim().source())).append('\n');
            }
            for (ClaimIndex.Entry entry : conflict.denies()) {
                sb.append("- Denies (").append(entry.threadId()).append("): ")
                        .append(entry.claim().statement()).append(cite(entry.claim().source())).append('\n');
            }
            sb.append(conflict.undecided()
                    ? "- Sources are of comparable authority; the question remains open.\n\n"
                    : "- Evidence leans towards the " + conflict.leaning().name().toLowerCase(Locale.ROOT)
                        + " side on source authority; both claims are kept.\n\n");
        }

        appendRecommendations(sb, findings);
        appendLimitations(sb, "## Limitations and gaps", plan, findings, missingThreadIds, statuses);

        sb.append("## Sources\n\n");
        List<SourceRef> sources = consolidatedSources(findings);
        if (sources.isEmpty()) {
            sb.append("None.\n");
        }
        for (int i = 0; i < sources.size(); i++) {
            sb.append(i + 1).append(". ").append(formatSource(sources.get(i))).append('\n');
        }
        return sb.toString();
    }

    /**
     * Body used when no thread produced a finding: only the gaps, one line per thread.
     */
    public String composeGapsOnly(ResearchPlan plan, Map<String, TerminalStatus> statuses) {
        var sb = new StringBuilder();
        sb.append("## Gaps\n\n");
        sb.append("No research thread produced a finding; no conclusions can be drawn.\n\n");
        for (ThreadSpec thread : plan.threads()) {
            sb.append("- `").append(thread.id()).append("` (").append(thread.focus()).append("): ")
                    .append(statusOf(statuses, thread.id())).append('\n');
        }
        return sb.toString();
    }

    private static void appendRecommendations(StringBuilder sb, List<Finding> findings) {
        sb.append("## Recommendations\n\n");
        Set<String> followUps = new LinkedHashSet<>();
        findings.forEach(f -> followUps.addAll(f.suggestedFollowUps()));
        if (followUps.isEmpty()) {
            sb.append("No follow-up research suggested.\n\n");
            return;
        }
        followUps.forEach(f -> sb.append("- ").append(f).append('\n'));
        sb.append('\n');
    }

    private static void appendLimitations(StringBuilder sb, String heading, ResearchPlan plan,
                                          List<Finding> findings, List<String> missingThreadIds,
                                          Map<String, TerminalStatus> statuses) {
        sb.append(heading).append("\n\n");
        boolean any = false;
        for (String threadId : missingThreadIds) {
            sb.append("- Missing finding for thread `").append(threadId).append("` (")
                    .append(statusOf(statuses, threadId)).append(")\n");
            any = true;
        }
        for (Finding finding : findings) {
            for (String gap : finding.gaps()) {
                sb.append("- ").append(finding.threadId()).append(": ").append(gap).append('\n');
                any = true;
            }
        }
        if (plan.overflowMerged()) {
            sb.append("- More subjects than threads: some subjects were merged into other threads\n");
            any = true;
        }
        if (!any) {
            sb.append("None identified.\n");
        }
        sb.append('\n');
    }

    static List<SourceRef> consolidatedSources(List<Finding> findings) {
        Map<String, SourceRef> byUrl = new LinkedHashMap<>();
        for (Finding finding : findings) {
            for (SourceRef source : finding.sourcesConsulted()) {
                String key = source.url() != null ? source.url() : source.title();
                if (key != null) {
                    byUrl.putIfAbsent(key, source);
                }
            }
        }
        return List.copyOf(byUrl.values());
    }

    private static String statusOf(Map<String, TerminalStatus> statuses, String threadId) {
        TerminalStatus status = statuses.get(threadId);
        return status == null ? "NOT RUN" : status.toString();
    }

    private static String cite(SourceRef source) {
        if (source == null || (source.title() == null && source.url() == null)) {
            return "";
        }
        return " [" + (source.title() != null ? source.title() : source.url()) + "]";
    }

    private static String formatSource(SourceRef source) {
        String title = source.title() != null ? source.title() : source.url();
        return source.url() != null && !source.url().equals(title)
                ? title + " <" + source.url() + "> (" + source.sourceType() + ")"
                : title + " (" + source.sourceType() + ")";
    }
}

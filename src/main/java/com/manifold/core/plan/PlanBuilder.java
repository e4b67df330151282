package com.manifold.core.plan;

import com.manifold.core.classify.QueryText;
import com.manifold.core.model.Classification;
import com.manifold.core.model.QueryType;
import com.manifold.core.model.ResearchPlan;
import com.manifold.core.model.ThreadSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Decomposes a classified query into exactly {@code workerCount} independent threads.
 * <p>
 * Candidates come first from explicitly compared subjects, then from a fixed angle table
 * for the query type. No thread refers to another. When there are more subjects than
 * workers the surplus subjects' questions are merged round-robin into the kept threads.
 */
@Component
public class PlanBuilder {

    private static final Logger log = LoggerFactory.getLogger(PlanBuilder.class);
    private static final int MAX_SLUG_LENGTH = 40;

    record Angle(String focus, List<String> questionTemplates) {}

    static final List<Angle> TECHNICAL_ANGLES = List.of(
            new Angle("core concepts and API surface", List.of(
                    "What is %s and what problem does it solve?",
                    "What are the main APIs or building blocks involved in %s?")),
            new Angle("implementation patterns and code examples", List.of(
                    "How is %s implemented in practice, with representative code?",
                    "What are common implementation pitfalls with %s?")),
            new Angle("architecture and integration", List.of(
                    "How does %s fit into a larger system architecture?",
                    "How does %s integrate with adjacent tools and libraries?")),
            new Angle("performance and limitations", List.of(
                    "What are the performance characteristics of %s?",
                    "What are the known limitations and failure modes of %s?")),
            new Angle("ecosystem and alternatives", List.of(
                    "What alternatives to %s exist and how do they differ?",
                    "How mature is the ecosystem and community around %s?")),
            new Angle("recent changes and release news", List.of(
                    "What changed in the latest releases relevant to %s?",
                    "What recent announcements affect %s?")));

    static final List<Angle> DOMAIN_ANGLES = List.of(
            new Angle("definitions and background", List.of(
                    "What is %s and how did it emerge?",
                    "What are the key concepts needed to understand %s?")),
            new Angle("current state and trends", List.of(
                    "What is the current state of %s?",
                    "Which trends are shaping %s?")),
            new Angle("key players and comparisons", List.of(
                    "Who are the main players or options in %s?",
                    "How do the main options in %s compare?")),
            new Angle("benefits, risks and trade-offs", List.of(
                    "What are the main benefits of %s?",
                    "What are the main risks and trade-offs of %s?")),
            new Angle("case studies and adoption", List.of(
                    "Where has %s been adopted and with what results?",
                    "What lessons do real-world cases of %s teach?")),
            new Angle("outlook and latest developments", List.of(
                    "What are the latest developments in %s?",
                    "What is the outlook for %s?")));

    static final List<String> SUBJECT_TEMPLATES = List.of(
            "What is %s and what is it best suited for?",
            "What are the strengths and weaknesses of %s?");

    private final CapabilitySelector capabilitySelector;

    public PlanBuilder(CapabilitySelector capabilitySelector) {
        this.capabilitySelector = capabilitySelector;
    }

    /**
     * Builds the plan for a run.
     *
     * @param runId          run identifier recorded on the plan
     * @param query          the original query
     * @param classification classification that sizes the plan
     * @return a plan with exactly {@code classification.workerCount()} threads
     */
    public ResearchPlan build(String runId, String query, Classification classification) {
        int n = classification.workerCount();
        QueryText text = QueryText.of(query);
        String subject = text.subject();

        var subjectDrafts = new ArrayList<Draft>();
        for (String s : text.comparisonSubjects()) {
            var questions = new ArrayList<String>();
            for (String template : SUBJECT_TEMPLATES) {
                questions.add(String.format(template, s));
            }
            questions.add("How does " + s + " compare with the alternatives in: " + subject + "?");
            subjectDrafts.add(new Draft(s, s + " " + String.join(" ", SUBJECT_TEMPLATES), questions));
        }

        var drafts = new ArrayList<Draft>();
        boolean overflow = false;
        if (subjectDrafts.size() > n) {
            drafts.addAll(subjectDrafts.subList(0, n));
            var surplus = subjectDrafts.subList(n, subjectDrafts.size());
            for (int i = 0; i < surplus.size(); i++) {
                drafts.get(i % n).questions.addAll(surplus.get(i).questions);
            }
            overflow = true;
            log.warn("Plan overflow for run {}: {} subjects for {} threads, merged {} into kept threads",
                    runId, subjectDrafts.size(), n, surplus.size());
        } else {
            drafts.addAll(subjectDrafts);
            var angles = anglesFor(classification.queryType());
            for (int i = 0; drafts.size() < n && i < angles.size(); i++) {
                Angle angle = angles.get(i);
                var questions = new ArrayList<String>();
                for (String template : angle.questionTemplates()) {
                    questions.add(String.format(template, subject));
                }
                drafts.add(new Draft(angle.focus(), angle.focus() + " " + String.join(" ", angle.questionTemplates()),
                        questions));
            }
        }

        var threads = new ArrayList<ThreadSpec>();
        for (int i = 0; i < drafts.size(); i++) {
            Draft d = drafts.get(i);
            // only the lead thread inherits query-level routing signals such as a known URL
            String routingText = i == 0 ? d.routingText + " " + query : d.routingText;
            String capability = capabilitySelector.select(routingText, i == 0);
            String id = "t" + (i + 1) + "-" + slug(d.focus);
            threads.add(new ThreadSpec(id, d.focus, capability, d.questions));
        }

        log.info("Built plan for run {}: {} threads ({} {}){}", runId, threads.size(),
                classification.complexity(), classification.queryType(), overflow ? " [overflow merged]" : "");
        return new ResearchPlan(runId, query, classification, threads, overflow);
    }

    static List<Angle> anglesFor(QueryType type) {
        return switch (type) {
            case TECHNICAL -> TECHNICAL_ANGLES;
            case DOMAIN -> DOMAIN_ANGLES;
            case HYBRID -> {
                var interleaved = new ArrayList<Angle>();
                for (int i = 0; i < TECHNICAL_ANGLES.size(); i++) {
                    interleaved.add(TECHNICAL_ANGLES.get(i));
                    interleaved.add(DOMAIN_ANGLES.get(i));
                }
                yield interleaved;
            }
        };
    }

    static String slug(String focus) {
        String s = focus.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("(^-+|-+$)", "");
        if (s.length() > MAX_SLUG_LENGTH) {
            s = s.substring(0, MAX_SLUG_LENGTH).replaceAll("-+$", "");
        }
        return s.isEmpty() ? "thread" : s;
    }

    private static final class Draft {
        final String focus;
        final String routingText;
        final List<String> questions;

        Draft(String focus, String routingText, List<String> questions) {
            this.focus = focus;
            this.routingText = routingText;
            this.questions = new ArrayList<>(questions);
        }
    }
}

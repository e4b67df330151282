package com.manifold.core.classify;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QueryTextTest {

    @Test
    @DisplayName("terms match on token boundaries only")
    void tokenBoundaries() {
        var text = QueryText.of("Is the rest of the API stable?");
        assertTrue(text.contains("api"));
        assertTrue(text.contains("rest"));
        assertFalse(text.contains("stab"));
        assertEquals(List.of("api"), text.matching(List.of("sdk", "api")));
    }

    @Test
    @DisplayName("versus splits subjects and drops trailing context")
    void versusSubjects() {
        assertEquals(List.of("Rust", "Go"), QueryText.of("Rust vs Go for CLI tools?").comparisonSubjects());
        assertEquals(List.of("Postgres", "MySQL"), QueryText.of("Postgres versus MySQL").comparisonSubjects());
    }

    @Test
    @DisplayName("a compare lead splits a comma list")
    void compareList() {
        assertEquals(List.of("Kafka", "Pulsar", "RabbitMQ"),
                QueryText.of("Compare Kafka, Pulsar and RabbitMQ").comparisonSubjects());
    }

    @Test
    @DisplayName("no comparison yields no subjects")
    void noComparison() {
        assertTrue(QueryText.of("How does Kafka work and scale?").comparisonSubjects().isEmpty());
    }

    @Test
    @DisplayName("subject strips trailing punctuation")
    void subject() {
        assertEquals("What is a monad", QueryText.of("  What is a monad?  ").subject());
        assertEquals(2, QueryText.of("Why? How?").questionMarks());
    }
}

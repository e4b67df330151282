package com.manifold.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.manifold.core.model.SourceType;
import com.manifold.core.model.Stance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.List;

/**
 * Generic HTTP search backend: {@code GET {endpoint}?q={query}} returning JSON hits.
 * <p>
 * Accepts either a bare array of hits or an object with a {@code hits} or {@code results}
 * array. Each hit may carry {@code title}, {@code url}, {@code snippet}, {@code sourceType},
 * {@code topic} and {@code stance}; missing fields are tolerated.
 */
public class HttpSearchSourceTool implements SourceTool {

    private static final Logger log = LoggerFactory.getLogger(HttpSearchSourceTool.class);

    private final String capability;
    private final String endpoint;
    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    public HttpSearchSourceTool(String capability, String endpoint, RestClient restClient, ObjectMapper objectMapper) {
        this.capability = capability;
        this.endpoint = endpoint;
        this.restClient = restClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return capability;
    }

    @Override
    public ResultSet search(String query) throws SourceToolException {
        String separator = endpoint.contains("?") ? "&" : "?";
        String body;
        try {
            body = restClient.get()
                    .uri(endpoint + separator + "q={q}", query)
                    .retrieve()
                    .body(String.class);
        } catch (RestClientException e) {
            throw new SourceToolException(capability,
                    "Search request to " + endpoint + " failed: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new SourceToolException(capability,
                    "Invalid search endpoint " + endpoint + ": " + e.getMessage(), e);
        }
        if (body == null || body.isBlank()) {
            return ResultSet.empty(capability, query);
        }
        try {
            var hits = parseHits(objectMapper.readTree(body));
            log.debug("{} returned {} hits for '{}'", capability, hits.size(), query);
            return new ResultSet(capability, query, hits);
        } catch (JsonProcessingException e) {
            throw new SourceToolException(capability,
                    "Unparseable response from " + endpoint + ": " + e.getOriginalMessage(), e);
        }
    }

    List<SourceHit> parseHits(JsonNode root) {
        JsonNode array = root;
        if (root.isObject()) {
            array = root.has("hits") ? root.get("hits") : root.path("results");
        }
        var hits = new ArrayList<SourceHit>();
        if (!array.isArray()) {
            return hits;
        }
        for (JsonNode node : array) {
            String url = text(node, "url");
            String snippet = text(node, "snippet");
            if (url == null && snippet == null) {
                continue;
            }
            hits.add(new SourceHit(
                    text(node, "title"),
                    url,
                    snippet,
                    SourceType.fromString(text(node, "sourceType")),
                    text(node, "topic"),
                    Stance.fromString(text(node, "stance"))));
        }
        return hits;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String s = value.asText();
        return s.isBlank() ? null : s;
    }
}

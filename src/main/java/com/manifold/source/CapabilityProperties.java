package com.manifold.source;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Capability routing configuration.
 * <p>
 * {@code routing} maps a query signal (URL, RECENT, TUTORIAL, CODE, CONCEPTUAL) to a capability
 * name; {@code fallback} maps a capability to the one a worker tries when it comes up empty;
 * {@code endpoints} binds capability names to HTTP search endpoints.
 */
@Component
@ConfigurationProperties(prefix = "manifold.capabilities")
public class CapabilityProperties {

    public static final String SEMANTIC_SEARCH = "semantic-search";
    public static final String CODE_CONTEXT = "code-context";
    public static final String TRANSCRIPT = "transcript";
    public static final String WEB_SEARCH = "web-search";
    public static final String FETCH = "fetch";

    private Map<String, String> routing = defaultRouting();
    private Map<String, String> fallback = defaultFallback();
    private Map<String, String> endpoints = new LinkedHashMap<>();
    private int connectTimeoutSeconds = 10;
    private int readTimeoutSeconds = 30;
    private boolean fetchEnabled = true;

    public Map<String, String> getRouting() { return routing; }
    public void setRouting(Map<String, String> routing) { this.routing = routing; }
    public Map<String, String> getFallback() { return fallback; }
    public void setFallback(Map<String, String> fallback) { this.fallback = fallback; }
    public Map<String, String> getEndpoints() { return endpoints; }
    public void setEndpoints(Map<String, String> endpoints) { this.endpoints = endpoints; }
    public int getConnectTimeoutSeconds() { return connectTimeoutSeconds; }
    public void setConnectTimeoutSeconds(int connectTimeoutSeconds) { this.connectTimeoutSeconds = connectTimeoutSeconds; }
    public int getReadTimeoutSeconds() { return readTimeoutSeconds; }
    public void setReadTimeoutSeconds(int readTimeoutSeconds) { this.readTimeoutSeconds = readTimeoutSeconds; }
    public boolean isFetchEnabled() { return fetchEnabled; }
    public void setFetchEnabled(boolean fetchEnabled) { this.fetchEnabled = fetchEnabled; }

    private static Map<String, String> defaultRouting() {
        var map = new LinkedHashMap<String, String>();
        map.put("URL", FETCH);
        map.put("RECENT", WEB_SEARCH);
        map.put("TUTORIAL", TRANSCRIPT);
        map.put("CODE", CODE_CONTEXT);
        map.put("CONCEPTUAL", SEMANTIC_SEARCH);
        return map;
    }

    private static Map<String, String> defaultFallback() {
        var map = new LinkedHashMap<String, String>();
        map.put(SEMANTIC_SEARCH, TRANSCRIPT);
        map.put(TRANSCRIPT, WEB_SEARCH);
        map.put(CODE_CONTEXT, SEMANTIC_SEARCH);
        map.put(FETCH, WEB_SEARCH);
        return map;
    }
}

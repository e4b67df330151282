package com.manifold.source;

import com.manifold.core.model.SourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Direct fetch backend for queries that name a known URL. Returns at most one hit built
 * from the page title and its leading text.
 */
public class UrlFetchSourceTool implements SourceTool {

    private static final Logger log = LoggerFactory.getLogger(UrlFetchSourceTool.class);

    static final Pattern URL_PATTERN = Pattern.compile("https?://[^\\s)\\]>\"']+");
    private static final Pattern TITLE_PATTERN = Pattern.compile("(?is)<title[^>]*>(.*?)</title>");
    private static final Pattern SCRIPT_PATTERN = Pattern.compile("(?is)<(script|style)[^>]*>.*?</\\1>");
    private static final Pattern TAG_PATTERN = Pattern.compile("(?s)<[^>]+>");
    private static final int SNIPPET_LENGTH = 600;

    private final RestClient restClient;

    public UrlFetchSourceTool(RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public String name() {
        return CapabilityProperties.FETCH;
    }

    @Override
    public ResultSet search(String query) throws SourceToolException {
        Matcher m = URL_PATTERN.matcher(query == null ? "" : query);
        if (!m.find()) {
            return ResultSet.empty(name(), query);
        }
        String url = m.group();
        String html;
        try {
            html = restClient.get().uri(url).retrieve().body(String.class);
        } catch (RestClientException | IllegalArgumentException e) {
            throw new SourceToolException(name(), "Fetch of " + url + " failed: " + e.getMessage(), e);
        }
        if (html == null || html.isBlank()) {
            return ResultSet.empty(name(), query);
        }
        log.debug("Fetched {} ({} chars)", url, html.length());
        return new ResultSet(name(), query, List.of(
                new SourceHit(extractTitle(html, url), url, extractText(html), SourceType.PRIMARY_DOCS)));
    }

    static String extractTitle(String html, String fallback) {
        Matcher m = TITLE_PATTERN.matcher(html);
        if (m.find()) {
            String title = m.group(1).replaceAll("\\s+", " ").trim();
            if (!title.isEmpty()) {
                return title;
            }
        }
        return fallback;
    }

    static String extractText(String html) {
        String text = SCRIPT_PATTERN.matcher(html).replaceAll(" ");
        text = TAG_PATTERN.matcher(text).replaceAll(" ").replaceAll("\\s+", " ").trim();
        return text.length() <= SNIPPET_LENGTH ? text : text.substring(0, SNIPPET_LENGTH);
    }
}

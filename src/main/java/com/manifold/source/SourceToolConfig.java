package com.manifold.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Map;

/**
 * Wires the capability registry from configured HTTP endpoints, the optional URL fetcher,
 * and any other {@link SourceTool} beans in the context.
 */
@Configuration
public class SourceToolConfig {

    private static final Logger log = LoggerFactory.getLogger(SourceToolConfig.class);

    @Bean
    public RestClient sourceToolRestClient(CapabilityProperties properties) {
        var factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(Duration.ofSeconds(properties.getConnectTimeoutSeconds()));
        factory.setReadTimeout(Duration.ofSeconds(properties.getReadTimeoutSeconds()));
        return RestClient.builder().requestFactory(factory).build();
    }

    @Bean
    public SourceToolRegistry sourceToolRegistry(CapabilityProperties properties,
                                                 RestClient sourceToolRestClient,
                                                 ObjectMapper objectMapper,
                                                 ObjectProvider<SourceTool> additionalTools) {
        var tools = new ArrayList<SourceTool>();
        if (properties.isFetchEnabled()) {
            tools.add(new UrlFetchSourceTool(sourceToolRestClient));
        }
        for (Map.Entry<String, String> entry : properties.getEndpoints().entrySet()) {
            if (entry.getValue() == null || entry.getValue().isBlank()) {
                log.warn("Capability {} has a blank endpoint, skipping", entry.getKey());
                continue;
            }
            tools.add(new HttpSearchSourceTool(entry.getKey(), entry.getValue(), sourceToolRestClient, objectMapper));
        }
        additionalTools.orderedStream().forEach(tools::add);
        return new SourceToolRegistry(tools, properties.getFallback());
    }
}

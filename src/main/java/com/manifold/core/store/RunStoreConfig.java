package com.manifold.core.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.manifold.core.config.ResearchProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
public class RunStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(RunStoreConfig.class);

    @Bean
    @ConditionalOnMissingBean(RunStore.class)
    public RunStore runStore(ResearchProperties properties, ObjectMapper objectMapper) {
        RunStore store = "memory".equalsIgnoreCase(properties.getStoreType())
                ? new InMemoryRunStore()
                : new FileSystemRunStore(Path.of(properties.getStoreRoot()), objectMapper);
        log.info("Run store: {}", store.describe());
        return store;
    }
}

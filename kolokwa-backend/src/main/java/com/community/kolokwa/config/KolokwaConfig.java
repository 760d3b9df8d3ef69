package com.community.kolokwa.config;

import com.community.kolokwa.embedding.DisabledEmbeddingService;
import com.community.kolokwa.embedding.EmbeddingService;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(KolokwaProperties.class)
public class KolokwaConfig {

    // Single time source for timestamps, streak days and challenge dates
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * Semantic search is off by default. A real embedder is plugged in as a {@code @Primary} bean.
     */
    @Bean
    public EmbeddingService disabledEmbeddingService() {
        return new DisabledEmbeddingService();
    }
}

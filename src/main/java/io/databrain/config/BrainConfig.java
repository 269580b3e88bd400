package io.databrain.config;

import io.databrain.similarity.NGramSimilarityScorer;
import io.databrain.similarity.SimilarityScorer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Core brain beans. A {@link SimilarityScorer} bean defined elsewhere (e.g. embedding based)
 * replaces the lexical default.
 */
@Configuration
@EnableConfigurationProperties(BrainProperties.class)
public class BrainConfig {

    @Bean
    @ConditionalOnMissingBean
    public SimilarityScorer similarityScorer() {
        return new NGramSimilarityScorer();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }
}

package org.jstats.tipster_api.modules.prediction.config;

import org.jstats.tipster_api.modules.prediction.registry.ModelRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the compiled-in model registry to the host the model services run on.
 */
@Configuration
public class PredictionConfig {

    private static final Logger log = LoggerFactory.getLogger(PredictionConfig.class);

    @Bean
    ModelRegistry modelRegistry(@Value("${tipster.upstream.models.base-url:http://localhost}") String baseUrl) {
        var registry = ModelRegistry.forHost(baseUrl);
        if (log.isInfoEnabled()) {
            registry.all().forEach(m ->
                    log.info("Model '{}' ({}, {}) -> {}", m.alias(), m.id(), m.tier().wireName(), m.endpoint()));
        }
        return registry;
    }
}

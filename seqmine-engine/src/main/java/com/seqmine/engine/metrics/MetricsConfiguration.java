package com.seqmine.engine.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics configuration for the pipeline.
 * 
 * Configures:
 * - Common tags for all metrics
 * - A simple in-process registry when the application provides none
 */
@Configuration
public class MetricsConfiguration {

    public static final String APPLICATION_TAG = "seqmine";

    @Bean
    public PipelineMetrics pipelineMetrics(ObjectProvider<MeterRegistry> registries) {
        MeterRegistry registry = registries.getIfAvailable(SimpleMeterRegistry::new);
        registry.config().commonTags("application", APPLICATION_TAG);
        PipelineMetrics metrics = new PipelineMetrics();
        metrics.bindTo(registry);
        return metrics;
    }
}

package com.phillippitts.liverelay.config.tools;

import com.phillippitts.liverelay.config.properties.ToolHostProperties;
import com.phillippitts.liverelay.service.health.ToolServerHealthIndicator;
import com.phillippitts.liverelay.service.metrics.ToolCallMetrics;
import com.phillippitts.liverelay.service.tools.DefaultToolProcessFactory;
import com.phillippitts.liverelay.service.tools.ToolClientFactory;
import com.phillippitts.liverelay.service.tools.ToolHostRegistry;
import com.phillippitts.liverelay.service.tools.ToolProcessFactory;
import com.phillippitts.liverelay.service.tools.ToolRpcClient;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the tool server host: process spawning, client creation, registry, metrics and health.
 */
@Configuration
public class ToolHostConfig {

    @Bean
    public ToolProcessFactory toolProcessFactory() {
        return new DefaultToolProcessFactory();
    }

    @Bean
    public ToolClientFactory toolClientFactory(ToolProcessFactory toolProcessFactory,
                                               ToolHostProperties toolHostProperties) {
        return (name, command, args, env) ->
                new ToolRpcClient(name, command, args, env, toolProcessFactory, toolHostProperties);
    }

    @Bean
    public ToolCallMetrics toolCallMetrics(MeterRegistry meterRegistry) {
        return new ToolCallMetrics(meterRegistry);
    }

    /**
     * Registry of connected servers; every child process is terminated on context close.
     */
    @Bean(destroyMethod = "shutdown")
    public ToolHostRegistry toolHostRegistry(ToolClientFactory toolClientFactory, ToolCallMetrics toolCallMetrics) {
        return new ToolHostRegistry(toolClientFactory, toolCallMetrics);
    }

    @Bean
    public ToolServerHealthIndicator toolServerHealthIndicator(ToolHostRegistry toolHostRegistry) {
        return new ToolServerHealthIndicator(toolHostRegistry);
    }
}

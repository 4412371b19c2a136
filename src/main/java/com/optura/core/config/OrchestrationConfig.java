package com.optura.core.config;

import com.optura.core.graph.GraphBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class OrchestrationConfig {

    @Bean
    public GraphBuilder graphBuilder(OrchestrationProperties properties) {
        return new GraphBuilder(properties.getDefaultDurationHours());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}

package com.planner.taskservice.config;

import com.planner.observability.SpanHelper;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Tracer wiring. Uses whatever {@link OpenTelemetry} instance the agent or SDK registered
 * globally, which is a no-op when none is installed.
 */
@Configuration
public class TracingConfig {

    @Bean
    @ConditionalOnMissingBean
    public OpenTelemetry openTelemetry() {
        return GlobalOpenTelemetry.get();
    }

    @Bean
    @ConditionalOnMissingBean
    public SpanHelper spanHelper(OpenTelemetry openTelemetry,
                                 @Value("${spring.application.name:planner-task-service}") String serviceName) {
        return new SpanHelper(openTelemetry.getTracer(serviceName));
    }
}

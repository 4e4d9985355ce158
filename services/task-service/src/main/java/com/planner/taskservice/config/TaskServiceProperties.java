package com.planner.taskservice.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Service identity, bound from {@code planner.service.*}.
 *
 * @param name        service name, used in logs and the info endpoint
 * @param environment deployment environment (default "development")
 * @param description human-readable description
 */
@Validated
@ConfigurationProperties(prefix = "planner.service")
public record TaskServiceProperties(
        @NotBlank String name,
        String environment,
        String description
) {

    public TaskServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
    }
}

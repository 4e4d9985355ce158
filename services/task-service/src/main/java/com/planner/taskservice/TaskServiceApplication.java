package com.planner.taskservice;

import com.planner.taskservice.config.TaskServiceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Planner task service: task and settings endpoints backed by row-level-security tables.
 * <p>
 * The connection pool, context binder and request scopes come from
 * {@code TenantDataAutoConfiguration} in {@code planner-database}.
 */
@SpringBootApplication
@EnableConfigurationProperties(TaskServiceProperties.class)
public class TaskServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(TaskServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(TaskServiceApplication.class, args);
        log.info("Planner task service started");
    }
}

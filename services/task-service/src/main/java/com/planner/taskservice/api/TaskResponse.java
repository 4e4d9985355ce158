package com.planner.taskservice.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.planner.taskservice.domain.Task;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A task as returned by the API, with the derived duration and overdue flag.
 */
public record TaskResponse(
        UUID id,
        @JsonProperty("tenant_id") String tenantId,
        String title,
        String description,
        String color,
        @JsonProperty("date_time") LocalDateTime dateTime,
        @JsonProperty("end_time") LocalDateTime endTime,
        @JsonProperty("duration_minutes") Integer durationMinutes,
        @JsonProperty("effective_duration_minutes") Integer effectiveDurationMinutes,
        boolean completed,
        boolean overdue,
        @JsonProperty("created_at") LocalDateTime createdAt,
        @JsonProperty("updated_at") LocalDateTime updatedAt
) {

    public static TaskResponse from(Task task, LocalDateTime now) {
        return new TaskResponse(
                task.id(),
                task.tenantId(),
                task.title(),
                task.description(),
                task.color().value(),
                task.startsAt(),
                task.endsAt(),
                task.durationMinutes(),
                task.effectiveDurationMinutes(),
                task.completed(),
                task.isOverdue(now),
                task.createdAt(),
                task.updatedAt());
    }
}

package com.planner.taskservice.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.planner.taskservice.domain.TaskColor;
import com.planner.taskservice.domain.TaskDraft;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.LocalDateTime;

/**
 * Body of {@code POST /api/v1/tasks} and {@code PUT /api/v1/tasks/{id}}.
 * Cross-field rules are checked when converting to a {@link TaskDraft}.
 */
public record TaskRequest(
        @NotBlank @Size(max = TaskDraft.MAX_TITLE_LENGTH) String title,
        @NotBlank String description,
        String color,
        @NotNull @JsonProperty("date_time") LocalDateTime dateTime,
        @JsonProperty("end_time") LocalDateTime endTime,
        @Min(TaskDraft.MIN_DURATION_MINUTES) @Max(TaskDraft.MAX_DURATION_MINUTES)
        @JsonProperty("duration_minutes") Integer durationMinutes,
        Boolean completed
) {

    public TaskDraft toDraft() {
        return new TaskDraft(
                title,
                description,
                color == null ? TaskColor.DEFAULT : TaskColor.fromValue(color),
                dateTime,
                endTime,
                durationMinutes,
                Boolean.TRUE.equals(completed));
    }
}

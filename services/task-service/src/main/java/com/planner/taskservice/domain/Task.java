package com.planner.taskservice.domain;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A task as stored. The tenant id is assigned by the database from the session's tenant claim.
 *
 * @param id              primary key
 * @param tenantId        owning tenant
 * @param title           short title
 * @param description     free text
 * @param color           display colour
 * @param startsAt        start of the task
 * @param endsAt          end of the task, null when a duration or nothing is set
 * @param durationMinutes length in minutes, null when an end or nothing is set
 * @param completed       completion flag
 * @param createdAt       insertion time
 * @param updatedAt       last update time, null until updated
 */
public record Task(
        UUID id,
        String tenantId,
        String title,
        String description,
        TaskColor color,
        LocalDateTime startsAt,
        LocalDateTime endsAt,
        Integer durationMinutes,
        boolean completed,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {

    /**
     * Length of the task in minutes: the explicit duration, else the span between start and
     * end, else null.
     */
    public Integer effectiveDurationMinutes() {
        if (durationMinutes != null) {
            return durationMinutes;
        }
        if (endsAt != null) {
            return (int) Duration.between(startsAt, endsAt).toMinutes();
        }
        return null;
    }

    /**
     * Point after which an unfinished task is overdue: the end time, else the start.
     */
    public LocalDateTime deadline() {
        return endsAt != null ? endsAt : startsAt;
    }

    public boolean isOverdue(LocalDateTime now) {
        return !completed && deadline().isBefore(now);
    }
}

package com.planner.taskservice.domain;

import java.time.LocalDateTime;

/**
 * The user-editable fields of a task, as submitted for creation or full replacement.
 * <p>
 * Construction enforces the task rules; a violation is an {@link IllegalArgumentException}.
 */
public record TaskDraft(
        String title,
        String description,
        TaskColor color,
        LocalDateTime startsAt,
        LocalDateTime endsAt,
        Integer durationMinutes,
        boolean completed
) {

    public static final int MAX_TITLE_LENGTH = 150;
    public static final int MIN_DURATION_MINUTES = 5;
    public static final int MAX_DURATION_MINUTES = 1440;

    public TaskDraft {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title must not be blank");
        }
        title = title.strip();
        if (title.length() > MAX_TITLE_LENGTH) {
            throw new IllegalArgumentException("title must be at most " + MAX_TITLE_LENGTH + " characters");
        }
        if (description == null || description.isEmpty()) {
            throw new IllegalArgumentException("description must not be empty");
        }
        if (color == null) {
            color = TaskColor.DEFAULT;
        }
        if (startsAt == null) {
            throw new IllegalArgumentException("date_time is required");
        }
        if (endsAt != null && durationMinutes != null) {
            throw new IllegalArgumentException("set either end_time or duration_minutes, not both");
        }
        if (endsAt != null && !endsAt.isAfter(startsAt)) {
            throw new IllegalArgumentException("end_time must be after date_time");
        }
        if (durationMinutes != null
                && (durationMinutes < MIN_DURATION_MINUTES || durationMinutes > MAX_DURATION_MINUTES)) {
            throw new IllegalArgumentException("duration_minutes must be between "
                    + MIN_DURATION_MINUTES + " and " + MAX_DURATION_MINUTES);
        }
    }

    /**
     * Same draft with another description, validated like any draft.
     */
    public TaskDraft withDescription(String newDescription) {
        return new TaskDraft(title, newDescription, color, startsAt, endsAt, durationMinutes, completed);
    }
}

package com.planner.taskservice.domain;

import java.util.UUID;

/**
 * No task with the id is visible to the calling tenant. Row-level security makes another
 * tenant's task indistinguishable from a missing one.
 */
public class TaskNotFoundException extends RuntimeException {

    private final UUID taskId;

    public TaskNotFoundException(UUID taskId) {
        super("task " + taskId + " not found");
        this.taskId = taskId;
    }

    public UUID taskId() {
        return taskId;
    }
}

package com.planner.taskservice.domain;

import com.planner.database.scope.RequestScope;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Task persistence. Every operation runs on the given scope's connection, and sees and touches
 * only the scope tenant's rows; no operation takes a tenant argument.
 */
public interface TaskRepository {

    Task create(RequestScope scope, TaskDraft draft);

    /**
     * All of the tenant's tasks, latest start first.
     */
    List<Task> list(RequestScope scope);

    Optional<Task> findById(RequestScope scope, UUID id);

    /**
     * Replaces the editable fields of a task.
     *
     * @return the updated task, or empty when no visible task has the id
     */
    Optional<Task> update(RequestScope scope, UUID id, TaskDraft draft);

    /**
     * @return whether a visible task was deleted
     */
    boolean delete(RequestScope scope, UUID id);
}

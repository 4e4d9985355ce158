package com.planner.taskservice.application;

import com.planner.database.scope.RequestScopeManager;
import com.planner.observability.SpanHelper;
import com.planner.taskservice.domain.Task;
import com.planner.taskservice.domain.TaskDraft;
import com.planner.taskservice.domain.TaskNotFoundException;
import com.planner.taskservice.domain.TaskRepository;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Task use cases. Each call authenticates the credential and runs in its own request scope,
 * so it commits or rolls back as one transaction under the caller's tenant.
 */
@Service
public class TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskService.class);

    private final RequestScopeManager scopes;
    private final TaskRepository tasks;
    private final SpanHelper spans;
    private final RichTextSanitizer sanitizer;

    public TaskService(RequestScopeManager scopes, TaskRepository tasks, SpanHelper spans,
                       RichTextSanitizer sanitizer) {
        this.scopes = scopes;
        this.tasks = tasks;
        this.spans = spans;
        this.sanitizer = sanitizer;
    }

    public List<Task> list(String credential) {
        return spans.withSpan("tasks.list", () -> scopes.inScope(credential, tasks::list));
    }

    /**
     * @throws TaskNotFoundException when the tenant has no task with the id
     */
    public Task get(String credential, UUID id) {
        return spans.withSpan("tasks.get", () -> scopes.inScope(credential,
                scope -> tasks.findById(scope, id).orElseThrow(() -> new TaskNotFoundException(id))));
    }

    public Task create(String credential, TaskDraft draft) {
        TaskDraft clean = cleaned(draft);
        return spans.withSpan("tasks.create", () -> scopes.inScope(credential, scope -> {
            Task created = tasks.create(scope, clean);
            log.info("Created task {}", created.id());
            return created;
        }));
    }

    /**
     * @throws TaskNotFoundException when the tenant has no task with the id
     */
    public Task update(String credential, UUID id, TaskDraft draft) {
        TaskDraft clean = cleaned(draft);
        return spans.withSpan("tasks.update", () -> scopes.inScope(credential,
                scope -> tasks.update(scope, id, clean).orElseThrow(() -> new TaskNotFoundException(id))));
    }

    /**
     * @throws TaskNotFoundException when the tenant has no task with the id
     */
    public void delete(String credential, UUID id) {
        spans.run("tasks.delete", () -> scopes.inScope(credential, scope -> {
            if (!tasks.delete(scope, id)) {
                throw new TaskNotFoundException(id);
            }
            log.info("Deleted task {}", id);
            return null;
        }));
    }

    private TaskDraft cleaned(TaskDraft draft) {
        return draft.withDescription(sanitizer.sanitize(draft.description()));
    }
}

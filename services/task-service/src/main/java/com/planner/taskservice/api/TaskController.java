package com.planner.taskservice.api;

import com.planner.security.BearerTokenExtractor;
import com.planner.taskservice.application.TaskService;
import jakarta.validation.Valid;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Task CRUD for the tenant named by the bearer credential.
 */
@RestController
@RequestMapping("/api/v1/tasks")
public class TaskController {

    private final TaskService tasks;
    private final Clock clock;

    public TaskController(TaskService tasks, Clock clock) {
        this.tasks = tasks;
        this.clock = clock;
    }

    @GetMapping
    public List<TaskResponse> list(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        LocalDateTime now = LocalDateTime.now(clock);
        return tasks.list(BearerTokenExtractor.require(authorization)).stream()
                .map(task -> TaskResponse.from(task, now))
                .toList();
    }

    @GetMapping("/{id}")
    public TaskResponse get(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                            @PathVariable UUID id) {
        return TaskResponse.from(tasks.get(BearerTokenExtractor.require(authorization), id), LocalDateTime.now(clock));
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public TaskResponse create(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                               @Valid @RequestBody TaskRequest request) {
        String credential = BearerTokenExtractor.require(authorization);
        return TaskResponse.from(tasks.create(credential, request.toDraft()), LocalDateTime.now(clock));
    }

    @PutMapping("/{id}")
    public TaskResponse update(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                               @PathVariable UUID id,
                               @Valid @RequestBody TaskRequest request) {
        String credential = BearerTokenExtractor.require(authorization);
        return TaskResponse.from(tasks.update(credential, id, request.toDraft()), LocalDateTime.now(clock));
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                       @PathVariable UUID id) {
        tasks.delete(BearerTokenExtractor.require(authorization), id);
    }
}

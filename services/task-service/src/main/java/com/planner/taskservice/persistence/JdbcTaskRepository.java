package com.planner.taskservice.persistence;

import com.planner.database.scope.RequestScope;
import com.planner.database.session.Row;
import com.planner.taskservice.domain.Task;
import com.planner.taskservice.domain.TaskColor;
import com.planner.taskservice.domain.TaskDraft;
import com.planner.taskservice.domain.TaskRepository;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.stereotype.Repository;

/**
 * {@link TaskRepository} over the {@code tasks} table. {@code tenant_id} is filled by the
 * column default from the session's tenant claim and checked by the table's policies.
 */
@Repository
public class JdbcTaskRepository extends PolicyEnforcedRepository implements TaskRepository {

    static final String COLUMNS = "id, tenant_id, title, description, color, date_time, end_time, "
            + "duration_minutes, completed, created_at, updated_at";

    public static final String INSERT = "INSERT INTO tasks "
            + "(title, description, color, date_time, end_time, duration_minutes, completed) "
            + "VALUES (?, ?, ?, ?, ?, ?, ?) RETURNING " + COLUMNS;

    public static final String SELECT_ALL = "SELECT " + COLUMNS + " FROM tasks ORDER BY date_time DESC";

    public static final String SELECT_BY_ID = "SELECT " + COLUMNS + " FROM tasks WHERE id = ?";

    public static final String UPDATE = "UPDATE tasks SET title = ?, description = ?, color = ?, "
            + "date_time = ?, end_time = ?, duration_minutes = ?, completed = ?, updated_at = now() "
            + "WHERE id = ? RETURNING " + COLUMNS;

    public static final String DELETE = "DELETE FROM tasks WHERE id = ?";

    @Override
    public Task create(RequestScope scope, TaskDraft draft) {
        return inScope(scope, "create", session -> session.queryOne(INSERT, JdbcTaskRepository::map,
                        draft.title(), draft.description(), draft.color().value(), draft.startsAt(),
                        draft.endsAt(), draft.durationMinutes(), draft.completed())
                .orElseThrow(() -> new SQLException("INSERT ... RETURNING produced no row")));
    }

    @Override
    public List<Task> list(RequestScope scope) {
        return inScope(scope, "list", session -> session.query(SELECT_ALL, JdbcTaskRepository::map));
    }

    @Override
    public Optional<Task> findById(RequestScope scope, UUID id) {
        return inScope(scope, "findById", session -> session.queryOne(SELECT_BY_ID, JdbcTaskRepository::map, id));
    }

    @Override
    public Optional<Task> update(RequestScope scope, UUID id, TaskDraft draft) {
        return inScope(scope, "update", session -> session.queryOne(UPDATE, JdbcTaskRepository::map,
                draft.title(), draft.description(), draft.color().value(), draft.startsAt(),
                draft.endsAt(), draft.durationMinutes(), draft.completed(), id));
    }

    @Override
    public boolean delete(RequestScope scope, UUID id) {
        return inScope(scope, "delete", session -> session.update(DELETE, id) > 0);
    }

    static Task map(Row row) throws SQLException {
        Boolean completed = row.getBoolean("completed");
        return new Task(
                row.getUuid("id"),
                row.getString("tenant_id"),
                row.getString("title"),
                row.getString("description"),
                TaskColor.fromValue(row.getString("color")),
                row.getTimestamp("date_time"),
                row.getTimestamp("end_time"),
                row.getInteger("duration_minutes"),
                Boolean.TRUE.equals(completed),
                row.getTimestamp("created_at"),
                row.getTimestamp("updated_at"));
    }
}

package com.planner.taskservice.domain;

import com.planner.database.scope.RequestScope;
import java.util.Optional;

/**
 * Settings persistence for the scope's tenant.
 */
public interface UserSettingsRepository {

    Optional<UserSettings> find(RequestScope scope);

    /**
     * Applies the changes to the tenant's row, creating it from the defaults when missing.
     */
    UserSettings upsert(RequestScope scope, SettingsChanges changes);
}

package com.planner.taskservice.application;

import com.planner.database.scope.RequestScopeManager;
import com.planner.observability.SpanHelper;
import com.planner.taskservice.domain.SettingsChanges;
import com.planner.taskservice.domain.UserSettings;
import com.planner.taskservice.domain.UserSettingsRepository;
import org.springframework.stereotype.Service;

/**
 * Settings use cases. A tenant without a settings row gets one created from the defaults on
 * first access.
 */
@Service
public class UserSettingsService {

    private final RequestScopeManager scopes;
    private final UserSettingsRepository settings;
    private final SpanHelper spans;

    public UserSettingsService(RequestScopeManager scopes, UserSettingsRepository settings, SpanHelper spans) {
        this.scopes = scopes;
        this.settings = settings;
        this.spans = spans;
    }

    public UserSettings get(String credential) {
        return spans.withSpan("settings.get", () -> scopes.inScope(credential,
                scope -> settings.find(scope).orElseGet(() -> settings.upsert(scope, SettingsChanges.NONE))));
    }

    public UserSettings update(String credential, SettingsChanges changes) {
        return spans.withSpan("settings.update", () -> scopes.inScope(credential, scope -> {
            if (changes.isEmpty()) {
                return settings.find(scope).orElseGet(() -> settings.upsert(scope, SettingsChanges.NONE));
            }
            return settings.upsert(scope, changes);
        }));
    }
}

package com.planner.taskservice.api;

import com.planner.security.BearerTokenExtractor;
import com.planner.taskservice.application.UserSettingsService;
import jakarta.validation.Valid;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * The calling tenant's settings.
 */
@RestController
@RequestMapping("/api/v1/settings")
public class SettingsController {

    private final UserSettingsService settings;

    public SettingsController(UserSettingsService settings) {
        this.settings = settings;
    }

    @GetMapping
    public SettingsResponse get(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        return SettingsResponse.from(settings.get(BearerTokenExtractor.require(authorization)));
    }

    @PutMapping
    public SettingsResponse update(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                   @Valid @RequestBody SettingsRequest request) {
        String credential = BearerTokenExtractor.require(authorization);
        return SettingsResponse.from(settings.update(credential, request.toChanges()));
    }
}

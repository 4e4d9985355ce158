package com.planner.taskservice.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDateTime;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("TaskDraft")
class TaskDraftTest {

    private static final LocalDateTime START = LocalDateTime.of(2025, 5, 1, 14, 0);

    @Test
    @DisplayName("defaults the colour to green and strips the title")
    void defaults() {
        TaskDraft draft = new TaskDraft("  Call the bank ", "about the loan", null, START, null, null, false);

        assertThat(draft.color()).isEqualTo(TaskColor.GREEN);
        assertThat(draft.title()).isEqualTo("Call the bank");
    }

    @Test
    @DisplayName("rejects a blank title and one longer than 150 characters")
    void title() {
        assertThatThrownBy(() -> new TaskDraft(" ", "d", null, START, null, null, false))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TaskDraft("x".repeat(151), "d", null, START, null, null, false))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("150");
        assertThat(new TaskDraft("x".repeat(150), "d", null, START, null, null, false).title()).hasSize(150);
    }

    @Test
    @DisplayName("requires a description and a start")
    void requiredFields() {
        assertThatThrownBy(() -> new TaskDraft("t", "", null, START, null, null, false))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TaskDraft("t", "d", null, null, null, null, false))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("end time and duration are mutually exclusive")
    void endOrDuration() {
        assertThatThrownBy(() -> new TaskDraft("t", "d", null, START, START.plusHours(1), 30, false))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not both");
    }

    @Test
    @DisplayName("end time must be after the start")
    void endAfterStart() {
        assertThatThrownBy(() -> new TaskDraft("t", "d", null, START, START, null, false))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TaskDraft("t", "d", null, START, START.minusMinutes(1), null, false))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @ParameterizedTest(name = "{0} minutes")
    @ValueSource(ints = {0, 4, 1441})
    @DisplayName("rejects durations outside 5..1440 minutes")
    void durationBounds(int minutes) {
        assertThatThrownBy(() -> new TaskDraft("t", "d", null, START, null, minutes, false))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @ParameterizedTest(name = "{0} minutes")
    @ValueSource(ints = {5, 1440})
    @DisplayName("accepts the duration bounds themselves")
    void durationLimits(int minutes) {
        assertThat(new TaskDraft("t", "d", null, START, null, minutes, false).durationMinutes()).isEqualTo(minutes);
    }
}

package com.example.walmartcrawling.entity;

import org.junit.jupiter.api.Test;

import static com.example.walmartcrawling.entity.ScrapeTaskStatus.*;
import static org.assertj.core.api.Assertions.assertThat;

class ScrapeTaskStatusTest {

    @Test
    void allowedTransitions() {
        assertThat(PENDING.canTransitionTo(RUNNING)).isTrue();
        assertThat(PENDING.canTransitionTo(FAILED)).isTrue();
        assertThat(RUNNING.canTransitionTo(SUSPENDED)).isTrue();
        assertThat(RUNNING.canTransitionTo(COMPLETED)).isTrue();
        assertThat(RUNNING.canTransitionTo(FAILED)).isTrue();
        assertThat(SUSPENDED.canTransitionTo(RUNNING)).isTrue();
        assertThat(SUSPENDED.canTransitionTo(FAILED)).isTrue();
    }

    @Test
    void forbiddenTransitions() {
        assertThat(PENDING.canTransitionTo(COMPLETED)).isFalse();
        assertThat(PENDING.canTransitionTo(SUSPENDED)).isFalse();
        assertThat(SUSPENDED.canTransitionTo(COMPLETED)).isFalse();
        assertThat(RUNNING.canTransitionTo(PENDING)).isFalse();
    }

    @Test
    void terminalStatusesHaveNoExit() {
        for (ScrapeTaskStatus target : values()) {
            assertThat(COMPLETED.canTransitionTo(target)).isFalse();
            assertThat(FAILED.canTransitionTo(target)).isFalse();
        }
        assertThat(COMPLETED.isTerminal()).isTrue();
        assertThat(FAILED.isTerminal()).isTrue();
        assertThat(ACTIVE).containsExactlyInAnyOrder(PENDING, RUNNING, SUSPENDED);
    }
}

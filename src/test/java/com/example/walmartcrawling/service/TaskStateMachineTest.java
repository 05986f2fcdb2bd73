package com.example.walmartcrawling.service;

import com.example.walmartcrawling.entity.ScrapeTask;
import com.example.walmartcrawling.entity.ScrapeTaskStatus;
import com.example.walmartcrawling.repository.ScrapeTaskRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import(TaskStateMachine.class)
class TaskStateMachineTest {

    @Autowired
    private TaskStateMachine stateMachine;

    @Autowired
    private ScrapeTaskRepository taskRepository;

    @Test
    void runsThroughToCompleted() {
        Long id = newTask();

        stateMachine.start(id);
        ScrapeTask running = reload(id);
        assertThat(running.getStatus()).isEqualTo(ScrapeTaskStatus.RUNNING);
        assertThat(running.getStartedAt()).isNotNull();

        stateMachine.complete(id);
        ScrapeTask completed = reload(id);
        assertThat(completed.getStatus()).isEqualTo(ScrapeTaskStatus.COMPLETED);
        assertThat(completed.getError()).isNull();
        assertThat(completed.getFinishedAt()).isNotNull();
        assertThat(completed.getCreatedAt()).isNotNull();
    }

    @Test
    void secondStartLosesRace() {
        Long id = newTask();
        stateMachine.start(id);

        assertThatThrownBy(() -> stateMachine.start(id))
                .isInstanceOf(IllegalTaskTransitionException.class)
                .satisfies(e -> {
                    IllegalTaskTransitionException ex = (IllegalTaskTransitionException) e;
                    assertThat(ex.getCurrent()).isEqualTo(ScrapeTaskStatus.RUNNING);
                    assertThat(ex.getTarget()).isEqualTo(ScrapeTaskStatus.RUNNING);
                });
    }

    @Test
    void cannotCompleteWithoutRunning() {
        Long id = newTask();

        assertThatThrownBy(() -> stateMachine.complete(id)).isInstanceOf(IllegalTaskTransitionException.class);
        assertThat(reload(id).getStatus()).isEqualTo(ScrapeTaskStatus.PENDING);
    }

    @Test
    void suspendAndResume() {
        Long id = newTask();
        stateMachine.start(id);

        stateMachine.suspend(id);
        assertThat(reload(id).getStatus()).isEqualTo(ScrapeTaskStatus.SUSPENDED);

        stateMachine.resume(id);
        assertThat(reload(id).getStatus()).isEqualTo(ScrapeTaskStatus.RUNNING);
    }

    @Test
    void failRecordsErrorOnce() {
        Long id = newTask();
        stateMachine.start(id);
        stateMachine.suspend(id);

        assertThat(stateMachine.fail(id, "CaptchaChallengeException: timed out")).isTrue();
        assertThat(stateMachine.fail(id, "second writer")).isFalse();

        ScrapeTask failed = reload(id);
        assertThat(failed.getStatus()).isEqualTo(ScrapeTaskStatus.FAILED);
        assertThat(failed.getError()).isEqualTo("CaptchaChallengeException: timed out");
    }

    @Test
    void completedTaskCannotFail() {
        Long id = newTask();
        stateMachine.start(id);
        stateMachine.complete(id);

        assertThat(stateMachine.fail(id, "late failure")).isFalse();
        assertThat(reload(id).getStatus()).isEqualTo(ScrapeTaskStatus.COMPLETED);
        assertThat(reload(id).getError()).isNull();
    }

    @Test
    void longErrorIsTruncatedAndBlankErrorGetsPlaceholder() {
        Long longId = newTask();
        Long blankId = newTask();

        stateMachine.fail(longId, "x".repeat(5000));
        stateMachine.fail(blankId, "  ");

        assertThat(reload(longId).getError()).hasSize(ScrapeTask.ERROR_MAX_LENGTH);
        assertThat(reload(blankId).getError()).isEqualTo("Unknown error");
    }

    @Test
    void unknownTaskIsNotFound() {
        assertThatThrownBy(() -> stateMachine.start(9999L)).isInstanceOf(TaskNotFoundException.class);
    }

    private Long newTask() {
        return taskRepository.saveAndFlush(ScrapeTask.builder()
                .clientName("acme")
                .category("tools")
                .url("https://www.walmart.com/ip/1001")
                .status(ScrapeTaskStatus.PENDING)
                .build()).getId();
    }

    private ScrapeTask reload(Long id) {
        return taskRepository.findById(id).orElseThrow();
    }
}

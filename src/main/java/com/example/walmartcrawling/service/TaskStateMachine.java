package com.example.walmartcrawling.service;

import com.example.walmartcrawling.entity.ScrapeTask;
import com.example.walmartcrawling.entity.ScrapeTaskStatus;
import com.example.walmartcrawling.repository.ScrapeTaskRepository;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.EnumSet;

import static com.example.walmartcrawling.entity.ScrapeTaskStatus.*;

/**
 * 스크래핑 작업 상태 머신
 * 
 * PENDING → RUNNING → COMPLETED | FAILED
 * RUNNING ↔ SUSPENDED (CAPTCHA 대기)
 * 
 * 모든 전이는 "현재 상태가 출발 상태일 때만" 적용되는 조건부 UPDATE로 수행되므로,
 * 등록 요청과 워커가 동시에 접근해도 작업은 정확히 한 번만 종료 상태에 도달합니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskStateMachine {

    private final ScrapeTaskRepository taskRepository;

    /**
     * PENDING → RUNNING (시작 시간 기록)
     * 
     * @throws IllegalTaskTransitionException 이미 다른 워커가 시작했거나 종료된 작업
     */
    @Transactional
    public void start(Long taskId) {
        int updated = taskRepository.start(taskId, EnumSet.of(PENDING), RUNNING, LocalDateTime.now());
        requireUpdated(updated, taskId, RUNNING);
    }

    /** RUNNING → SUSPENDED */
    @Transactional
    public void suspend(Long taskId) {
        int updated = taskRepository.transition(taskId, EnumSet.of(RUNNING), SUSPENDED, LocalDateTime.now());
        requireUpdated(updated, taskId, SUSPENDED);
    }

    /** SUSPENDED → RUNNING */
    @Transactional
    public void resume(Long taskId) {
        int updated = taskRepository.transition(taskId, EnumSet.of(SUSPENDED), RUNNING, LocalDateTime.now());
        requireUpdated(updated, taskId, RUNNING);
    }

    /**
     * RUNNING → COMPLETED
     * 
     * 상품 저장과 같은 트랜잭션에서 호출되어야 합니다 (전이 실패 시 상품 저장도 롤백).
     */
    @Transactional
    public void complete(Long taskId) {
        int updated = taskRepository.finish(taskId, EnumSet.of(RUNNING), COMPLETED, null, LocalDateTime.now());
        requireUpdated(updated, taskId, COMPLETED);
    }

    /**
     * 비종료 상태 → FAILED (에러 메시지 기록)
     * 
     * 실패 기록은 여러 경로(워커, 큐 거절, 기동 복구)에서 호출되므로 예외 대신 결과를 반환합니다.
     * 
     * @param taskId 작업 ID
     * @param error 사람이 읽을 수 있는 실패 원인
     * @return 전이되었으면 true, 이미 종료 상태였으면 false
     */
    @Transactional
    public boolean fail(Long taskId, String error) {
        int updated = taskRepository.finish(taskId, ScrapeTaskStatus.ACTIVE, FAILED, truncate(error), LocalDateTime.now());
        if (updated == 0) {
            log.warn("[Task {}] FAILED로 전이하지 못했습니다 (현재 상태: {})", taskId, currentStatus(taskId));
            return false;
        }
        log.info("[Task {}] FAILED: {}", taskId, error);
        return true;
    }

    private void requireUpdated(int updated, Long taskId, ScrapeTaskStatus target) {
        if (updated == 0) {
            throw new IllegalTaskTransitionException(taskId, currentStatus(taskId), target);
        }
        log.debug("[Task {}] → {}", taskId, target);
    }

    private ScrapeTaskStatus currentStatus(Long taskId) {
        return taskRepository.findById(taskId)
                .map(ScrapeTask::getStatus)
                .orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    private static String truncate(String error) {
        if (error == null || error.isBlank()) {
            return "Unknown error";
        }
        return error.length() <= ScrapeTask.ERROR_MAX_LENGTH ? error : error.substring(0, ScrapeTask.ERROR_MAX_LENGTH);
    }
}

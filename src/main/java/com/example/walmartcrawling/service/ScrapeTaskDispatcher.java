package com.example.walmartcrawling.service;

import com.example.walmartcrawling.config.ScraperProperties;
import com.example.walmartcrawling.entity.ScrapeTask;
import com.example.walmartcrawling.entity.ScrapeTaskStatus;
import com.example.walmartcrawling.repository.ScrapeTaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;

/**
 * 작업 등록 및 비동기 실행 예약
 * 
 * 작업 레코드는 호출 스레드에서 바로 저장되므로 호출자는 반환된 ID로 즉시 조회할 수 있습니다.
 * 실행은 크기가 제한된 워커 풀(scrapeTaskExecutor)에서 진행되어 동시 브라우저 세션 수를 제한합니다.
 * 
 * 실행은 최소 1회 보장(at-least-once)이며, 결과 저장은 작업당 한 번만 반영됩니다.
 * 종료 상태 기록 전에 프로세스가 죽은 작업은 재기동 시 정리됩니다 (recoverUnfinishedTasks).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScrapeTaskDispatcher {

    private final ScrapeTaskRepository taskRepository;
    private final ScrapeTaskWorker worker;
    private final TaskStateMachine stateMachine;
    private final ThreadPoolTaskExecutor scrapeTaskExecutor;
    private final ScraperProperties properties;

    /**
     * 작업 등록 후 실행 예약
     * 
     * @param clientName 요청 고객명
     * @param category 상품 카테고리
     * @param url 상품 페이지 URL (http/https 절대 URL)
     * @return 저장된 작업 (status=PENDING)
     * @throws IllegalArgumentException 입력값이 비어 있거나 URL 형식이 잘못된 경우
     */
    public ScrapeTask submit(String clientName, String category, String url) {
        requireText(clientName, "client_name");
        requireText(category, "category");
        String productUrl = requireProductUrl(url);

        ScrapeTask task = taskRepository.save(ScrapeTask.builder()
                .clientName(clientName.trim())
                .category(category.trim())
                .url(productUrl)
                .status(ScrapeTaskStatus.PENDING)
                .build());
        log.info("[Task {}] 작업 등록 - 고객: {}, 카테고리: {}, URL: {}", task.getId(), task.getClientName(), task.getCategory(), productUrl);

        dispatch(task.getId());
        return task;
    }

    /**
     * 워커 풀에 실행 예약. 큐가 가득 차 거절되면 작업을 FAILED로 기록합니다.
     */
    public void dispatch(Long taskId) {
        try {
            scrapeTaskExecutor.execute(() -> worker.execute(taskId));
        } catch (TaskRejectedException e) {
            log.error("[Task {}] 작업 큐가 가득 차 실행을 예약하지 못했습니다.", taskId, e);
            stateMachine.fail(taskId, "DispatchRejected: 작업 큐가 가득 찼습니다. 다시 요청해 주세요.");
        }
    }

    /**
     * 기동 시 이전 프로세스가 남긴 작업 정리
     * 
     * - RUNNING / SUSPENDED: 실행하던 워커가 사라졌으므로 FAILED
     * - PENDING: 다시 실행 예약
     */
    @EventListener(ApplicationReadyEvent.class)
    public void recoverUnfinishedTasks() {
        if (!properties.getDispatch().isRecoverOnStartup()) {
            return;
        }
        List<ScrapeTask> interrupted = taskRepository.findByStatusIn(EnumSet.of(ScrapeTaskStatus.RUNNING, ScrapeTaskStatus.SUSPENDED));
        for (ScrapeTask task : interrupted) {
            stateMachine.fail(task.getId(), "WorkerStopped: 이전 프로세스가 작업을 끝내지 못하고 종료되었습니다.");
        }
        List<ScrapeTask> pending = taskRepository.findByStatusIn(EnumSet.of(ScrapeTaskStatus.PENDING));
        for (ScrapeTask task : pending) {
            dispatch(task.getId());
        }
        if (!interrupted.isEmpty() || !pending.isEmpty()) {
            log.info("미완료 작업 복구: {}개 실패 처리, {}개 재실행 예약", interrupted.size(), pending.size());
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " 값이 비어 있습니다.");
        }
    }

    private static String requireProductUrl(String url) {
        requireText(url, "url");
        String trimmed = url.trim();
        URI uri;
        try {
            uri = URI.create(trimmed);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("URL 형식이 올바르지 않습니다: " + trimmed, e);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!(scheme.equals("http") || scheme.equals("https")) || uri.getHost() == null) {
            throw new IllegalArgumentException("http/https 상품 페이지 URL이 필요합니다: " + trimmed);
        }
        return trimmed;
    }
}

package com.example.walmartcrawling.service;

import com.example.walmartcrawling.browser.PageSession;
import com.example.walmartcrawling.browser.PageSessionFactory;
import com.example.walmartcrawling.config.ScraperProperties;
import com.example.walmartcrawling.entity.ScrapeTask;
import com.example.walmartcrawling.extractor.CaptchaChallengeException;
import com.example.walmartcrawling.extractor.ExtractedProduct;
import com.example.walmartcrawling.extractor.ProductExtractor;
import com.example.walmartcrawling.output.ProductCsvExporter;
import com.example.walmartcrawling.repository.ScrapeTaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 스크래핑 작업 실행기 (워커 스레드 하나가 작업 하나를 끝까지 담당)
 * 
 * 실행 순서:
 * 1. PENDING → RUNNING
 * 2. 브라우저 세션 열기 → 페이지 이동 → 렌더링 대기
 * 3. 상품 추출 (CAPTCHA 감지 시 SUSPENDED로 전환하고 수동 해결을 제한 시간 동안 대기)
 * 4. 브라우저 세션 닫기 (성공/실패 관계없이 종료 상태 기록 전에 닫힘)
 * 5. 상품 저장 + COMPLETED, 또는 FAILED + 에러 메시지
 * 6. CSV 보조 저장 (실패해도 작업 상태에 영향 없음)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScrapeTaskWorker {

    private final ScrapeTaskRepository taskRepository;
    private final PageSessionFactory sessionFactory;
    private final ProductExtractor extractor;
    private final TaskStateMachine stateMachine;
    private final ScrapeResultWriter resultWriter;
    private final CaptchaInterventionRegistry interventions;
    private final ProductCsvExporter csvExporter;
    private final ScraperProperties properties;

    /** 이 프로세스에서 실행 중인 작업 ID (같은 작업의 동시 실행 방지) */
    private final Set<Long> inFlight = ConcurrentHashMap.newKeySet();

    /**
     * 작업 실행. 어떤 경로로 끝나든 작업은 COMPLETED 또는 FAILED 상태가 됩니다.
     * 
     * @param taskId 실행할 작업 ID
     */
    public void execute(Long taskId) {
        if (!inFlight.add(taskId)) {
            log.warn("[Task {}] 이미 실행 중인 작업입니다. 중복 실행을 건너뜁니다.", taskId);
            return;
        }
        try {
            run(taskId);
        } finally {
            inFlight.remove(taskId);
        }
    }

    public boolean isRunning(Long taskId) {
        return inFlight.contains(taskId);
    }

    private void run(Long taskId) {
        ScrapeTask task;
        try {
            task = taskRepository.findById(taskId).orElse(null);
            if (task == null) {
                log.error("[Task {}] 작업을 찾을 수 없어 실행하지 않습니다.", taskId);
                return;
            }
            stateMachine.start(taskId);
        } catch (IllegalTaskTransitionException e) {
            log.warn("[Task {}] 실행할 수 없는 상태입니다: {}", taskId, e.getMessage());
            return;
        } catch (RuntimeException e) {
            log.error("[Task {}] 작업을 시작하지 못했습니다.", taskId, e);
            stateMachine.fail(taskId, describe(e));
            return;
        }
        log.info("[Task {}] 스크래핑 시작: {}", taskId, task.getUrl());

        ScrapeResultWriter.WriteResult result;
        try {
            ExtractedProduct extracted = scrape(task);
            result = resultWriter.complete(taskId, extracted);
        } catch (Exception e) {
            log.error("[Task {}] 스크래핑 실패: {}", taskId, task.getUrl(), e);
            stateMachine.fail(taskId, describe(e));
            return;
        }
        log.info("[Task {}] 완료. 상품 저장: {}", taskId, result.getProduct().getTitle());

        if (result.isCreated()) {
            csvExporter.append(result.getProduct());
        }
    }

    /**
     * 세션을 열어 추출하고, 반환 전에 반드시 세션을 닫음
     */
    private ExtractedProduct scrape(ScrapeTask task) {
        try (PageSession session = sessionFactory.open()) {
            session.navigate(task.getUrl());
            ProductExtractor.settle(properties.getExtraction().getNavigationSettle());
            return extractWithIntervention(task.getId(), session);
        }
    }

    /**
     * CAPTCHA가 감지되면 작업을 SUSPENDED로 바꾸고 해결 신호를 기다린 뒤 한 번 더 추출
     * 
     * 제한 시간 초과, 워커 중단, 해결 후에도 CAPTCHA가 남아 있는 경우는 예외로 전파되어 FAILED가 됩니다.
     */
    private ExtractedProduct extractWithIntervention(Long taskId, PageSession session) {
        try {
            return extractor.extract(session);
        } catch (CaptchaChallengeException challenge) {
            awaitIntervention(taskId);
            return extractor.extract(session);
        }
    }

    private void awaitIntervention(Long taskId) {
        Duration timeout = properties.getCaptcha().getInterventionTimeout();
        boolean resolved;
        try (CaptchaInterventionRegistry.Intervention intervention = interventions.open(taskId)) {
            stateMachine.suspend(taskId);
            log.warn("[Task {}] CAPTCHA 감지! 브라우저에서 직접 해결한 뒤 POST /tasks/{}/captcha-resolved 를 호출하세요. (최대 {} 대기)",
                    taskId, taskId, timeout);
            resolved = intervention.await(timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CaptchaChallengeException("CAPTCHA 해결을 기다리는 중 워커가 중단되었습니다.");
        }
        if (!resolved) {
            throw new CaptchaChallengeException("CAPTCHA가 " + timeout + " 안에 해결되지 않았습니다.");
        }
        stateMachine.resume(taskId);
        log.info("[Task {}] CAPTCHA 해결됨. 추출을 재개합니다.", taskId);
    }

    /**
     * 작업에 기록할 실패 원인 문자열 ("예외클래스: 메시지")
     */
    static String describe(Throwable error) {
        String message = error.getMessage();
        String name = error.getClass().getSimpleName();
        return message == null || message.isBlank() ? name : name + ": " + message;
    }
}

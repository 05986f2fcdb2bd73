package com.example.walmartcrawling.entity;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * 스크래핑 작업의 상태를 나타내는 열거형
 * 
 * 작업 생명주기:
 * PENDING → RUNNING → COMPLETED
 *             ↕  ↘
 *         SUSPENDED → FAILED (어느 비종료 상태에서든 실패 시)
 * 
 * COMPLETED, FAILED는 종료 상태이며 이후 어떤 전이도 허용되지 않습니다.
 */
public enum ScrapeTaskStatus {
    /** 작업 등록 완료, 워커 할당 대기 상태 */
    PENDING,

    /** 워커가 브라우저 세션을 열고 추출을 진행 중인 상태 */
    RUNNING,

    /** CAPTCHA 감지로 사람의 개입을 기다리는 상태 (RUNNING의 하위 상태) */
    SUSPENDED,

    /** 상품 추출 및 저장 완료 (최종 성공 상태) */
    COMPLETED,

    /** 세션 오류 또는 예기치 못한 오류로 중단됨 (최종 실패 상태, error 필드 기록) */
    FAILED;

    /** 실패로 전이할 수 있는 비종료 상태 */
    public static final Set<ScrapeTaskStatus> ACTIVE = Collections.unmodifiableSet(EnumSet.of(PENDING, RUNNING, SUSPENDED));

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * 현재 상태에서 대상 상태로의 전이가 허용되는지 확인
     * 
     * @param target 전이하려는 상태
     * @return 허용되면 true
     */
    public boolean canTransitionTo(ScrapeTaskStatus target) {
        switch (this) {
            case PENDING:
                return target == RUNNING || target == FAILED;
            case RUNNING:
                return target == SUSPENDED || target == COMPLETED || target == FAILED;
            case SUSPENDED:
                return target == RUNNING || target == FAILED;
            default:
                return false;
        }
    }
}

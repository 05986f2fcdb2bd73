package com.example.walmartcrawling.entity;

import jakarta.persistence.*;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.LocalDateTime;

/**
 * 스크래핑 작업 엔티티
 * 
 * 고객이 요청한 상품 URL 한 건에 대한 작업 단위입니다.
 * 등록 시 PENDING으로 생성되고, 이후 상태 변경은 TaskStateMachine의 조건부 UPDATE로만 이루어집니다.
 */
@Entity
@Table(name = "scrape_task", indexes = {
        @Index(name = "idx_scrape_task_status", columnList = "status"),
        @Index(name = "idx_scrape_task_client", columnList = "clientName")
})
@Getter
@NoArgsConstructor
@EntityListeners(AuditingEntityListener.class)
public class ScrapeTask {

    /** 에러 메시지 최대 길이 */
    public static final int ERROR_MAX_LENGTH = 2000;

    /** Primary Key, 자동 증가 */
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String clientName;

    @Column(nullable = false)
    private String category;

    /** 상품 페이지 URL (같은 URL을 여러 번 요청할 수 있으므로 고유 제약 없음) */
    @Column(nullable = false, length = 1024)
    private String url;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ScrapeTaskStatus status;

    /** 실패 원인 (status=FAILED 일 때만 존재) */
    @Column(length = ERROR_MAX_LENGTH)
    private String error;

    /** 레코드 생성 시간 (자동 설정, 수정 불가) */
    @CreatedDate
    @Column(updatable = false, nullable = false)
    private LocalDateTime createdAt;

    @LastModifiedDate
    @Column(nullable = false)
    private LocalDateTime updatedAt;

    /** 워커가 실행을 시작한 시간 */
    private LocalDateTime startedAt;

    /** 종료 상태(COMPLETED/FAILED)에 도달한 시간 */
    private LocalDateTime finishedAt;

    /**
     * 빌더 패턴 생성자
     * 
     * @param clientName 요청 고객명
     * @param category 상품 카테고리
     * @param url 상품 페이지 URL
     * @param status 초기 상태 (보통 PENDING)
     */
    @Builder
    public ScrapeTask(String clientName, String category, String url, ScrapeTaskStatus status) {
        this.clientName = clientName;
        this.category = category;
        this.url = url;
        this.status = status;
    }
}

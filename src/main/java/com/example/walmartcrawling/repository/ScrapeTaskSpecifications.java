package com.example.walmartcrawling.repository;

import com.example.walmartcrawling.entity.ScrapeTask;
import com.example.walmartcrawling.entity.ScrapeTaskStatus;
import org.springframework.data.jpa.domain.Specification;

/**
 * 작업 목록 조회용 동적 조건
 * 
 * 값이 null(또는 빈 문자열)인 조건은 무시됩니다.
 */
public final class ScrapeTaskSpecifications {

    private ScrapeTaskSpecifications() {}

    public static Specification<ScrapeTask> filter(String clientName, ScrapeTaskStatus status, String category) {
        return Specification.where(clientNameEquals(clientName))
                .and(statusEquals(status))
                .and(categoryEquals(category));
    }

    public static Specification<ScrapeTask> clientNameEquals(String clientName) {
        return (root, query, cb) -> isBlank(clientName) ? null : cb.equal(root.get("clientName"), clientName);
    }

    public static Specification<ScrapeTask> statusEquals(ScrapeTaskStatus status) {
        return (root, query, cb) -> status == null ? null : cb.equal(root.get("status"), status);
    }

    public static Specification<ScrapeTask> categoryEquals(String category) {
        return (root, query, cb) -> isBlank(category) ? null : cb.equal(root.get("category"), category);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

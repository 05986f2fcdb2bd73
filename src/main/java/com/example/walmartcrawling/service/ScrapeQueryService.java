package com.example.walmartcrawling.service;

import com.example.walmartcrawling.dto.ProductResponse;
import com.example.walmartcrawling.dto.TaskResponse;
import com.example.walmartcrawling.entity.ScrapeTaskStatus;
import com.example.walmartcrawling.repository.ProductRepository;
import com.example.walmartcrawling.repository.ProductSpecifications;
import com.example.walmartcrawling.repository.ScrapeTaskRepository;
import com.example.walmartcrawling.repository.ScrapeTaskSpecifications;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 작업 / 상품 조회 서비스 (필터 조건이 null이면 무시)
 */
@Service
@RequiredArgsConstructor
public class ScrapeQueryService {

    private final ScrapeTaskRepository taskRepository;
    private final ProductRepository productRepository;

    /**
     * 작업 목록 (최신 등록순)
     */
    @Transactional
    public List<TaskResponse> listTasks(String clientName, ScrapeTaskStatus status, String category) {
        Sort newestFirst = Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id"));
        return taskRepository.findAll(ScrapeTaskSpecifications.filter(clientName, status, category), newestFirst)
                .stream()
                .map(TaskResponse::from)
                .collect(Collectors.toList());
    }

    @Transactional
    public TaskResponse getTask(Long taskId) {
        return taskRepository.findById(taskId)
                .map(TaskResponse::from)
                .orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    /**
     * 상품 목록 (최신 스크래핑순)
     * 
     * 가격 범위 조건은 숫자 가격에만 적용됩니다.
     */
    @Transactional
    public List<ProductResponse> listProducts(String clientName, String category, Double minPrice, Double maxPrice) {
        if (minPrice != null && maxPrice != null && minPrice > maxPrice) {
            throw new IllegalArgumentException("min_price가 max_price보다 클 수 없습니다.");
        }
        Sort newestFirst = Sort.by(Sort.Order.desc("scrapedAt"), Sort.Order.desc("id"));
        return productRepository.findAll(ProductSpecifications.filter(clientName, category, minPrice, maxPrice), newestFirst)
                .stream()
                .map(ProductResponse::from)
                .collect(Collectors.toList());
    }

    /**
     * 작업 현황 요약 (전체 개수 + 상태별 개수)
     * 
     * @return {"TOTAL_IN_DB": n, "PENDING": n, "RUNNING": n, ...}
     */
    public Map<String, Long> getStatusSummary() {
        Map<String, Long> statusMap = new LinkedHashMap<>();
        statusMap.put("TOTAL_IN_DB", taskRepository.count());
        for (ScrapeTaskStatus status : ScrapeTaskStatus.values()) {
            statusMap.put(status.name(), taskRepository.countByStatus(status));
        }
        return statusMap;
    }

    /**
     * 조회 파라미터의 상태 문자열 변환 (대소문자 무시)
     * 
     * @throws IllegalArgumentException 알 수 없는 상태값
     */
    public static ScrapeTaskStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return ScrapeTaskStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("알 수 없는 작업 상태입니다: " + status);
        }
    }
}

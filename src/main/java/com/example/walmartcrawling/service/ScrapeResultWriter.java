package com.example.walmartcrawling.service;

import com.example.walmartcrawling.entity.Product;
import com.example.walmartcrawling.entity.ScrapeTask;
import com.example.walmartcrawling.extractor.ExtractedProduct;
import com.example.walmartcrawling.repository.ProductRepository;
import com.example.walmartcrawling.repository.ScrapeTaskRepository;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * 추출 결과 저장
 * 
 * 상품 저장과 COMPLETED 전이를 하나의 트랜잭션으로 묶어
 * "상품은 작업이 COMPLETED일 때만 존재한다"는 조건을 유지합니다.
 * 같은 작업이 다시 실행되어도 상품은 한 번만 저장됩니다 (task_id 고유 제약 + 사전 조회).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScrapeResultWriter {

    private final ScrapeTaskRepository taskRepository;
    private final ProductRepository productRepository;
    private final TaskStateMachine stateMachine;

    /**
     * 상품 저장 후 작업을 COMPLETED로 전이
     * 
     * @param taskId 실행 중(RUNNING)인 작업 ID
     * @param extracted 추출 결과
     * @return 저장 결과 (created=false 이면 이전 실행에서 저장된 상품을 재사용)
     * @throws IllegalTaskTransitionException 작업이 RUNNING이 아닌 경우 (상품 저장도 롤백)
     */
    @Transactional
    public WriteResult complete(Long taskId, ExtractedProduct extracted) {
        ScrapeTask task = taskRepository.findById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));

        Optional<Product> existing = productRepository.findByTaskId(taskId);
        Product product;
        if (existing.isPresent()) {
            log.info("[Task {}] 이미 저장된 상품이 있어 재사용합니다. (product id: {})", taskId, existing.get().getId());
            product = existing.get();
        } else {
            product = productRepository.save(toProduct(task, extracted));
        }

        stateMachine.complete(taskId);
        return new WriteResult(product, existing.isEmpty());
    }

    private Product toProduct(ScrapeTask task, ExtractedProduct extracted) {
        return Product.builder()
                .task(task)
                .clientName(task.getClientName())
                .category(task.getCategory())
                .title(extracted.getTitle())
                .price(extracted.getPrice().getAmount())
                .priceText(extracted.getPrice().getRawText())
                .images(extracted.getImages())
                .aboutThisItem(extracted.getAboutThisItem())
                .colors(extracted.getColors())
                .sizes(extracted.getSizes())
                .productUrl(task.getUrl())
                .relatedLinks(extracted.getRelatedLinks())
                .scrapedAt(LocalDateTime.now())
                .build();
    }

    @Value
    public static class WriteResult {
        Product product;
        boolean created;
    }
}

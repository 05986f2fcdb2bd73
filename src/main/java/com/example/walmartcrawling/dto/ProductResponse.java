package com.example.walmartcrawling.dto;

import com.example.walmartcrawling.entity.Product;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 상품 조회 응답
 * 
 * 엔티티의 지연 로딩 컬렉션을 트랜잭션 안에서 복사해 두므로 직렬화 시 세션이 필요 없습니다.
 */
@Getter
@Builder
public class ProductResponse {
    private final Long productId;
    private final Long taskId;
    private final String clientName;
    private final String category;
    private final String title;
    private final Double price;
    private final String priceText;
    private final List<String> images;
    private final List<String> aboutThisItem;
    private final List<String> colors;
    private final List<String> sizes;
    private final String productUrl;
    private final List<String> relatedLinks;
    private final LocalDateTime scrapedAt;

    public static ProductResponse from(Product product) {
        return ProductResponse.builder()
                .productId(product.getId())
                .taskId(product.getTask().getId())
                .clientName(product.getClientName())
                .category(product.getCategory())
                .title(product.getTitle())
                .price(product.getPrice())
                .priceText(product.getPriceText())
                .images(new ArrayList<>(product.getImages()))
                .aboutThisItem(new ArrayList<>(product.getAboutThisItem()))
                .colors(new ArrayList<>(product.getColors()))
                .sizes(new ArrayList<>(product.getSizes()))
                .productUrl(product.getProductUrl())
                .relatedLinks(new ArrayList<>(product.getRelatedLinks()))
                .scrapedAt(product.getScrapedAt())
                .build();
    }
}

package com.example.walmartcrawling.entity;

import jakarta.persistence.*;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * 상품 정보 엔티티
 * 
 * 작업(ScrapeTask)이 성공적으로 끝났을 때 한 번만 생성되며, 이후 수정되지 않습니다.
 * ScrapeTask와 1:1 관계이며 task_id 고유 제약으로 중복 저장을 막습니다.
 * 
 * 가격 저장 규칙:
 * - 숫자로 파싱되면 price에 저장
 * - 파싱에 실패하면 price는 null, 원문을 priceText에 저장
 * - 가격 요소를 찾지 못하면 price = 0.0
 * 
 * 페이지에서 추출한 텍스트와 URL은 길이 제한 없이 저장합니다 (@Lob).
 */
@Entity
@Table(name = "product", indexes = {
        @Index(name = "idx_product_client", columnList = "clientName"),
        @Index(name = "idx_product_scraped_at", columnList = "scrapedAt")
})
@Getter
@NoArgsConstructor
public class Product {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** 스크래핑 작업과의 1:1 관계 (지연 로딩, 고유 제약) */
    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "task_id", unique = true, nullable = false, updatable = false)
    private ScrapeTask task;

    @Column(nullable = false, updatable = false)
    private String clientName;

    @Column(nullable = false, updatable = false)
    private String category;

    @Lob
    @Column(updatable = false)
    private String title;

    @Column(updatable = false)
    private Double price;

    /** 숫자로 해석할 수 없었던 가격 원문 */
    @Lob
    @Column(updatable = false)
    private String priceText;

    /** 상품 이미지 URL (중복 제거, 발견 순서 유지) */
    @ElementCollection
    @CollectionTable(name = "product_image", joinColumns = @JoinColumn(name = "product_id"))
    @OrderColumn(name = "position")
    @Lob
    @Column(name = "url")
    private List<String> images = new ArrayList<>();

    @ElementCollection
    @CollectionTable(name = "product_about", joinColumns = @JoinColumn(name = "product_id"))
    @OrderColumn(name = "position")
    @Lob
    @Column(name = "bullet")
    private List<String> aboutThisItem = new ArrayList<>();

    /** 색상 (중복 없음, 발견 순서 유지, 없으면 "N/A") */
    @ElementCollection
    @CollectionTable(name = "product_color", joinColumns = @JoinColumn(name = "product_id"))
    @OrderColumn(name = "position")
    @Lob
    @Column(name = "color")
    private List<String> colors = new ArrayList<>();

    @ElementCollection
    @CollectionTable(name = "product_size", joinColumns = @JoinColumn(name = "product_id"))
    @OrderColumn(name = "position")
    @Lob
    @Column(name = "size")
    private List<String> sizes = new ArrayList<>();

    @Column(nullable = false, length = 1024, updatable = false)
    private String productUrl;

    /** 연관 상품 링크 (쿼리스트링 제거, 중복 제거) */
    @ElementCollection
    @CollectionTable(name = "product_related_link", joinColumns = @JoinColumn(name = "product_id"))
    @OrderColumn(name = "position")
    @Lob
    @Column(name = "url")
    private List<String> relatedLinks = new ArrayList<>();

    @Column(nullable = false, updatable = false)
    private LocalDateTime scrapedAt;

    @Builder
    public Product(ScrapeTask task, String clientName, String category, String title, Double price, String priceText,
                   Collection<String> images, Collection<String> aboutThisItem, Collection<String> colors,
                   Collection<String> sizes, String productUrl, Collection<String> relatedLinks, LocalDateTime scrapedAt) {
        this.task = task;
        this.clientName = clientName;
        this.category = category;
        this.title = title;
        this.price = price;
        this.priceText = priceText;
        if (images != null) this.images.addAll(images);
        if (aboutThisItem != null) this.aboutThisItem.addAll(aboutThisItem);
        if (colors != null) addDistinct(this.colors, colors);
        if (sizes != null) addDistinct(this.sizes, sizes);
        this.productUrl = productUrl;
        if (relatedLinks != null) addDistinct(this.relatedLinks, relatedLinks);
        this.scrapedAt = scrapedAt;
    }

    private static void addDistinct(List<String> target, Collection<String> values) {
        new LinkedHashSet<>(values).forEach(target::add);
    }
}

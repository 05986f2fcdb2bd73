package com.example.walmartcrawling.repository;

import com.example.walmartcrawling.entity.Product;
import org.springframework.data.jpa.domain.Specification;

/**
 * 상품 목록 조회용 동적 조건
 * 
 * 가격 범위 조건은 숫자 가격(price)에만 적용되므로, 가격 원문만 가진 상품은
 * 범위 조건이 하나라도 주어지면 결과에서 제외됩니다.
 */
public final class ProductSpecifications {

    private ProductSpecifications() {}

    public static Specification<Product> filter(String clientName, String category, Double minPrice, Double maxPrice) {
        return Specification.where(clientNameEquals(clientName))
                .and(categoryEquals(category))
                .and(priceAtLeast(minPrice))
                .and(priceAtMost(maxPrice));
    }

    public static Specification<Product> clientNameEquals(String clientName) {
        return (root, query, cb) -> isBlank(clientName) ? null : cb.equal(root.get("clientName"), clientName);
    }

    public static Specification<Product> categoryEquals(String category) {
        return (root, query, cb) -> isBlank(category) ? null : cb.equal(root.get("category"), category);
    }

    public static Specification<Product> priceAtLeast(Double minPrice) {
        return (root, query, cb) -> minPrice == null ? null : cb.greaterThanOrEqualTo(root.<Double>get("price"), minPrice);
    }

    public static Specification<Product> priceAtMost(Double maxPrice) {
        return (root, query, cb) -> maxPrice == null ? null : cb.lessThanOrEqualTo(root.<Double>get("price"), maxPrice);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

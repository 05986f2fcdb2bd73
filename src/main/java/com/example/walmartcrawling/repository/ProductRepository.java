package com.example.walmartcrawling.repository;

import com.example.walmartcrawling.entity.Product;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Product 엔티티를 위한 Spring Data JPA 레포지토리
 * 
 * 상품 정보의 저장과 목록 조회(필터링)를 제공합니다.
 */
@Repository
public interface ProductRepository extends JpaRepository<Product, Long>, JpaSpecificationExecutor<Product> {

    /**
     * 작업 ID로 Product를 조회하는 메서드
     * 
     * 같은 작업이 다시 실행되었을 때 이미 저장된 상품을 재사용하기 위해 사용됩니다.
     * 
     * @param taskId 작업 ID
     * @return 해당 작업에 연결된 Product (없으면 Optional.empty())
     */
    Optional<Product> findByTaskId(Long taskId);

    boolean existsByTaskId(Long taskId);
}

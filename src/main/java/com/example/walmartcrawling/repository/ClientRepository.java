package com.example.walmartcrawling.repository;

import com.example.walmartcrawling.entity.Client;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Client 엔티티를 위한 Spring Data JPA 레포지토리
 */
@Repository
public interface ClientRepository extends JpaRepository<Client, Long> {

    /**
     * 이메일 중복 확인을 위한 메서드
     * 
     * @param clientEmail 확인할 이메일
     * @return 이미 등록되어 있으면 true
     */
    boolean existsByClientEmail(String clientEmail);
}

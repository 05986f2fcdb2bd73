package com.example.walmartcrawling.entity;

import jakarta.persistence.*;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.LocalDateTime;

/**
 * 스크래핑을 요청하는 고객 엔티티
 * 
 * 이메일이 고유 키이며, 같은 이메일로 다시 등록하면 덮어쓰지 않고 거절합니다.
 */
@Entity
@Table(name = "client")
@Getter
@NoArgsConstructor
@EntityListeners(AuditingEntityListener.class)
public class Client {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String clientName;

    /** 고객 이메일 (고유 제약) */
    @Column(nullable = false, unique = true)
    private String clientEmail;

    @CreatedDate
    @Column(updatable = false, nullable = false)
    private LocalDateTime registeredAt;

    @Builder
    public Client(String clientName, String clientEmail) {
        this.clientName = clientName;
        this.clientEmail = clientEmail;
    }
}

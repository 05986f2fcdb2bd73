package com.example.walmartcrawling.service;

import com.example.walmartcrawling.entity.Client;
import com.example.walmartcrawling.repository.ClientRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * 고객 등록 서비스
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClientService {

    private final ClientRepository clientRepository;

    /**
     * 고객 등록
     * 
     * 이메일이 이미 등록되어 있으면 기존 레코드를 덮어쓰지 않고 거절합니다.
     * 사전 조회와 동시에 다른 요청이 같은 이메일을 등록한 경우에도 고유 제약 위반을 같은 예외로 변환합니다.
     * 
     * @param clientName 고객명
     * @param clientEmail 고객 이메일 (고유 키)
     * @return 저장된 고객
     * @throws DuplicateClientException 이미 등록된 이메일
     */
    public Client register(String clientName, String clientEmail) {
        if (clientName == null || clientName.isBlank()) {
            throw new IllegalArgumentException("client_name 값이 비어 있습니다.");
        }
        if (clientEmail == null || clientEmail.isBlank()) {
            throw new IllegalArgumentException("client_email 값이 비어 있습니다.");
        }
        String email = clientEmail.trim();
        if (clientRepository.existsByClientEmail(email)) {
            throw new DuplicateClientException(email);
        }
        try {
            Client client = clientRepository.saveAndFlush(Client.builder()
                    .clientName(clientName.trim())
                    .clientEmail(email)
                    .build());
            log.info("고객 등록 완료: {} (id: {})", email, client.getId());
            return client;
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateClientException(email);
        }
    }
}

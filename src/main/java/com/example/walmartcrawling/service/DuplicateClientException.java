package com.example.walmartcrawling.service;

/**
 * 이미 등록된 이메일로 고객 등록을 시도함 (서버 오류가 아닌 요청 거절)
 */
public class DuplicateClientException extends RuntimeException {

    public DuplicateClientException(String clientEmail) {
        super("Client already registered: " + clientEmail);
    }
}

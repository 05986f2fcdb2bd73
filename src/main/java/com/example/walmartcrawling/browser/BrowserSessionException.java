package com.example.walmartcrawling.browser;

/**
 * 세션 단위 오류 (브라우저 시작 실패, 크래시, 페이지 이동 실패)
 * 
 * 필드 단위 실패와 달리 이 예외는 작업을 FAILED로 전이시킵니다.
 */
public class BrowserSessionException extends RuntimeException {

    public BrowserSessionException(String message) {
        super(message);
    }

    public BrowserSessionException(String message, Throwable cause) {
        super(message, cause);
    }
}

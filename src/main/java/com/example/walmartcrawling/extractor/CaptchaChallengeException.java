package com.example.walmartcrawling.extractor;

/**
 * 페이지가 CAPTCHA(봇 차단) 화면으로 막혀 있음
 * 
 * 실패가 아니라 사람의 개입이 필요한 중단 상태를 뜻하며, 워커는 작업을 SUSPENDED로 전환합니다.
 */
public class CaptchaChallengeException extends RuntimeException {

    public CaptchaChallengeException(String message) {
        super(message);
    }
}

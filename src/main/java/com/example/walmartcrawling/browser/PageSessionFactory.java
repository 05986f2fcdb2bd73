package com.example.walmartcrawling.browser;

/**
 * 작업마다 새 페이지 세션을 여는 팩토리
 * 
 * 워커는 전역 드라이버를 공유하지 않고, 실행할 때마다 이 팩토리로 세션을 받아 사용 후 닫습니다.
 */
public interface PageSessionFactory {

    /**
     * @return 새로 시작된 세션
     * @throws BrowserSessionException 세션을 시작하지 못한 경우
     */
    PageSession open();
}

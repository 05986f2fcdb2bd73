package com.example.walmartcrawling.browser;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * 작업 하나가 독점하는 브라우저 세션
 * 
 * 추출 엔진이 사용하는 DOM 기능(이동, 대기, 조회, 스크롤, 클릭, 페이지 소스)만 노출합니다.
 * 
 * 오류 규칙:
 * - 요소가 없거나 대기 시간이 초과되는 등 필드 단위 실패는 빈 결과(Optional.empty(), 빈 리스트)로 반환
 * - 세션 자체의 실패(시작 실패, 크래시, 이동 실패)는 BrowserSessionException으로 전파
 * 
 * 작업이 어떤 경로로 끝나든 close()가 호출되어야 합니다.
 */
public interface PageSession extends AutoCloseable {

    /**
     * 지정한 URL로 이동
     * 
     * @param url 상품 페이지 URL
     * @throws BrowserSessionException 이동에 실패한 경우
     */
    void navigate(String url);

    /**
     * 선택자와 일치하는 요소가 나타날 때까지 대기
     * 
     * @param cssSelector CSS 선택자
     * @param timeout 최대 대기 시간
     * @return 첫 번째 일치 요소 (시간 초과 시 Optional.empty())
     */
    Optional<PageElement> waitFor(String cssSelector, Duration timeout);

    /** 대기 없이 현재 일치하는 모든 요소를 문서 순서대로 반환 */
    List<PageElement> findAll(String cssSelector);

    void scrollIntoView(PageElement element);

    void click(PageElement element);

    String pageSource();

    @Override
    void close();
}

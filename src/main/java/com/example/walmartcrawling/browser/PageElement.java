package com.example.walmartcrawling.browser;

import java.util.List;
import java.util.Optional;

/**
 * 페이지 세션에서 조회한 DOM 요소
 */
public interface PageElement {

    /** 요소의 표시 텍스트 (앞뒤 공백 제거, 읽을 수 없으면 빈 문자열) */
    String text();

    /**
     * 속성값 조회. href, src 는 절대 URL로 반환합니다.
     */
    Optional<String> attribute(String name);

    /** 하위 요소 조회 */
    List<PageElement> findAll(String cssSelector);
}

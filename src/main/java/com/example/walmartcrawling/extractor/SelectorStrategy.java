package com.example.walmartcrawling.extractor;

import com.example.walmartcrawling.browser.PageElement;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Optional;

/**
 * 선택자 하나와 값 추출 규칙(텍스트 또는 속성)의 묶음
 */
@Getter
@ToString
@EqualsAndHashCode
public final class SelectorStrategy {

    private final String selector;
    /** null 이면 요소 텍스트를 읽음 */
    private final String attribute;

    private SelectorStrategy(String selector, String attribute) {
        this.selector = selector;
        this.attribute = attribute;
    }

    public static SelectorStrategy text(String selector) {
        return new SelectorStrategy(selector, null);
    }

    public static SelectorStrategy attribute(String selector, String attribute) {
        return new SelectorStrategy(selector, attribute);
    }

    /**
     * 요소에서 값을 읽음
     * 
     * @param element 선택자와 일치한 요소
     * @return 공백 제거 후 비어 있지 않은 값
     */
    public Optional<String> read(PageElement element) {
        if (attribute != null) {
            return element.attribute(attribute);
        }
        String text = element.text();
        return text == null || text.isBlank() ? Optional.empty() : Optional.of(text.trim());
    }
}

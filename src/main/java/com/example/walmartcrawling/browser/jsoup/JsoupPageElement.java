package com.example.walmartcrawling.browser.jsoup;

import com.example.walmartcrawling.browser.PageElement;
import org.jsoup.nodes.Element;

import java.util.List;
import java.util.Optional;

/**
 * Jsoup Element 래퍼
 */
class JsoupPageElement implements PageElement {

    private final Element element;

    JsoupPageElement(Element element) {
        this.element = element;
    }

    @Override
    public String text() {
        return element.text().trim();
    }

    @Override
    public Optional<String> attribute(String name) {
        String value = element.attr(name);
        // 브라우저와 동일하게 링크/이미지 경로는 절대 URL로 반환
        if ("href".equals(name) || "src".equals(name)) {
            String absolute = element.absUrl(name);
            if (!absolute.isEmpty()) {
                value = absolute;
            }
        }
        value = value.trim();
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    @Override
    public List<PageElement> findAll(String cssSelector) {
        return JsoupPageSession.select(element, cssSelector);
    }

    @Override
    public String toString() {
        return element.cssSelector();
    }
}

package com.example.walmartcrawling.browser.selenium;

import com.example.walmartcrawling.browser.PageElement;
import lombok.Getter;
import org.openqa.selenium.By;
import org.openqa.selenium.WebElement;

import java.util.List;
import java.util.Optional;

/**
 * WebElement 래퍼. 모든 호출은 소속 세션의 예외 분류 규칙을 따릅니다.
 */
class SeleniumPageElement implements PageElement {

    @Getter
    private final WebElement element;
    private final SeleniumPageSession session;

    SeleniumPageElement(WebElement element, SeleniumPageSession session) {
        this.element = element;
        this.session = session;
    }

    @Override
    public String text() {
        return session.absorb(() -> {
            String text = element.getText();
            return text == null ? "" : text.trim();
        }, "", "text");
    }

    @Override
    public Optional<String> attribute(String name) {
        return session.absorb(() -> Optional.ofNullable(element.getAttribute(name))
                .map(String::trim)
                .filter(value -> !value.isEmpty()), Optional.empty(), "@" + name);
    }

    @Override
    public List<PageElement> findAll(String cssSelector) {
        return session.absorb(() -> session.wrap(element.findElements(By.cssSelector(cssSelector))), List.of(), cssSelector);
    }
}

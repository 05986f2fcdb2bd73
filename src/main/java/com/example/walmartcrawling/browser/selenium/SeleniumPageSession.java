package com.example.walmartcrawling.browser.selenium;

import com.example.walmartcrawling.browser.BrowserSessionException;
import com.example.walmartcrawling.browser.PageElement;
import com.example.walmartcrawling.browser.PageSession;
import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.By;
import org.openqa.selenium.InvalidElementStateException;
import org.openqa.selenium.JavascriptException;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.NotFoundException;
import org.openqa.selenium.StaleElementReferenceException;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.support.ui.ExpectedConditions;
import org.openqa.selenium.support.ui.WebDriverWait;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Selenium WebDriver 기반 페이지 세션
 * 
 * 작업 하나가 드라이버 하나를 독점하며, close() 시 브라우저를 종료합니다.
 * 
 * 예외 분류:
 * - NotFound / Stale / InvalidElementState / Timeout / Javascript 예외 → 필드 단위 실패로 흡수
 * - 그 밖의 WebDriverException (세션 없음, 크래시 등) → BrowserSessionException
 */
@Slf4j
public class SeleniumPageSession implements PageSession {

    /** 요소를 화면 중앙으로 부드럽게 스크롤하는 스크립트 */
    private static final String SCROLL_INTO_VIEW = "arguments[0].scrollIntoView({behavior:'smooth', block:'center'});";

    private final WebDriver driver;

    public SeleniumPageSession(WebDriver driver) {
        this.driver = driver;
    }

    @Override
    public void navigate(String url) {
        try {
            driver.get(url);
        } catch (WebDriverException e) {
            throw new BrowserSessionException("페이지 이동 실패: " + url, e);
        }
    }

    @Override
    public Optional<PageElement> waitFor(String cssSelector, Duration timeout) {
        return absorb(() -> {
            WebElement element = new WebDriverWait(driver, timeout)
                    .until(ExpectedConditions.presenceOfElementLocated(By.cssSelector(cssSelector)));
            return Optional.<PageElement>of(new SeleniumPageElement(element, this));
        }, Optional.empty(), cssSelector);
    }

    @Override
    public List<PageElement> findAll(String cssSelector) {
        return absorb(() -> wrap(driver.findElements(By.cssSelector(cssSelector))), List.of(), cssSelector);
    }

    @Override
    public void scrollIntoView(PageElement element) {
        absorb(() -> ((JavascriptExecutor) driver).executeScript(SCROLL_INTO_VIEW, unwrap(element)), null, "scroll");
    }

    @Override
    public void click(PageElement element) {
        absorb(() -> {
            unwrap(element).click();
            return null;
        }, null, "click");
    }

    @Override
    public String pageSource() {
        try {
            String source = driver.getPageSource();
            return source == null ? "" : source;
        } catch (WebDriverException e) {
            throw new BrowserSessionException("페이지 소스를 읽을 수 없습니다.", e);
        }
    }

    @Override
    public void close() {
        try {
            driver.quit();
        } catch (WebDriverException e) {
            log.warn("브라우저 종료 중 오류 발생: {}", e.getMessage());
        }
    }

    List<PageElement> wrap(List<WebElement> elements) {
        return elements.stream()
                .map(element -> (PageElement) new SeleniumPageElement(element, this))
                .collect(Collectors.toList());
    }

    /**
     * 필드 단위 실패는 기본값으로 흡수하고, 세션 단위 실패만 전파
     */
    <T> T absorb(Supplier<T> action, T fallback, String target) {
        try {
            return action.get();
        } catch (NotFoundException | StaleElementReferenceException | InvalidElementStateException
                 | TimeoutException | JavascriptException e) {
            log.debug("요소 처리 실패, 기본값 사용 ({}): {}", target, e.getClass().getSimpleName());
            return fallback;
        } catch (WebDriverException e) {
            throw new BrowserSessionException("브라우저 세션 오류 (" + target + "): " + e.getMessage(), e);
        }
    }

    private WebElement unwrap(PageElement element) {
        if (!(element instanceof SeleniumPageElement)) {
            throw new IllegalArgumentException("다른 세션의 요소입니다: " + element);
        }
        return ((SeleniumPageElement) element).getElement();
    }
}

package com.example.walmartcrawling.browser.selenium;

import com.example.walmartcrawling.browser.BrowserSessionException;
import com.example.walmartcrawling.browser.PageSession;
import com.example.walmartcrawling.browser.PageSessionFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * 작업마다 새 WebDriver를 띄워 세션으로 감싸는 팩토리
 * 
 * 드라이버 생성 방식(로컬 ChromeDriver / RemoteWebDriver)은 SeleniumConfig에서 주입됩니다.
 */
@Slf4j
@RequiredArgsConstructor
public class SeleniumPageSessionFactory implements PageSessionFactory {

    private final Supplier<WebDriver> driverSupplier;
    private final Duration pageLoadTimeout;

    @Override
    public PageSession open() {
        WebDriver driver;
        try {
            driver = driverSupplier.get();
        } catch (WebDriverException | IllegalStateException e) {
            throw new BrowserSessionException("브라우저 세션을 시작하지 못했습니다: " + e.getMessage(), e);
        }
        try {
            driver.manage().timeouts().pageLoadTimeout(pageLoadTimeout);
        } catch (WebDriverException e) {
            driver.quit();
            throw new BrowserSessionException("브라우저 세션 초기화 실패: " + e.getMessage(), e);
        }
        log.debug("브라우저 세션 시작: {}", driver.getClass().getSimpleName());
        return new SeleniumPageSession(driver);
    }
}

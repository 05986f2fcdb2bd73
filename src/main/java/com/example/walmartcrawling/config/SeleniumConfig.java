package com.example.walmartcrawling.config;

import com.example.walmartcrawling.browser.BrowserSessionException;
import com.example.walmartcrawling.browser.PageSessionFactory;
import com.example.walmartcrawling.browser.selenium.SeleniumPageSessionFactory;
import jakarta.annotation.PostConstruct;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.remote.RemoteWebDriver;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.MalformedURLException;
import java.net.URL;
import java.util.Collections;

/**
 * Selenium WebDriver 설정 클래스
 * 
 * Chrome 브라우저 자동화를 위한 페이지 세션 팩토리를 등록합니다.
 * - 로컬 환경: ChromeDriver 사용 (selenium.chrome.driver-path 미지정 시 Selenium Manager가 드라이버를 찾음)
 * - Docker 환경: RemoteWebDriver 사용 (Selenium Grid)
 * 
 * 드라이버는 Bean으로 공유하지 않고, 작업마다 새로 생성되어 작업 종료 시 닫힙니다.
 * scraper.browser.driver=jsoup 인 경우 이 설정은 비활성화됩니다.
 */
@Configuration
@ConditionalOnProperty(prefix = "scraper.browser", name = "driver", havingValue = "selenium", matchIfMissing = true)
public class SeleniumConfig {

    /** Selenium Hub URL (Docker 환경에서 사용, 기본값: http://localhost:4444/wd/hub) */
    @Value("${selenium.hub.url:http://localhost:4444/wd/hub}")
    private String seleniumHubUrl;

    /** Remote WebDriver 사용 여부 (Docker 환경: true, 로컬 환경: false) */
    @Value("${selenium.use.remote:false}")
    private boolean useRemoteDriver;

    /** 로컬 chromedriver 경로 (비어 있으면 Selenium Manager 사용) */
    @Value("${selenium.chrome.driver-path:}")
    private String chromeDriverPath;

    /**
     * Bean 생성 후 초기화 메서드
     * 
     * 로컬 환경이고 드라이버 경로가 지정된 경우 시스템 프로퍼티에 설정합니다.
     */
    @PostConstruct
    void postConstruct() {
        if (!useRemoteDriver && !chromeDriverPath.isBlank()) {
            System.setProperty("webdriver.chrome.driver", chromeDriverPath);
        }
    }

    /**
     * 페이지 세션 팩토리 Bean 생성
     * 
     * @param properties 스크래퍼 설정
     * @return 작업마다 새 브라우저를 여는 팩토리
     */
    @Bean
    public PageSessionFactory pageSessionFactory(ScraperProperties properties) {
        ScraperProperties.Browser browser = properties.getBrowser();
        return new SeleniumPageSessionFactory(() -> createDriver(browser), browser.getPageLoadTimeout());
    }

    /**
     * 환경에 따라 로컬 ChromeDriver 또는 RemoteWebDriver를 생성
     */
    private WebDriver createDriver(ScraperProperties.Browser browser) {
        ChromeOptions options = createChromeOptions(browser);

        if (useRemoteDriver) {
            try {
                return new RemoteWebDriver(new URL(seleniumHubUrl), options);
            } catch (MalformedURLException e) {
                throw new BrowserSessionException("Selenium Hub URL이 올바르지 않습니다: " + seleniumHubUrl, e);
            }
        }
        return new ChromeDriver(options);
    }

    /**
     * Chrome 브라우저 옵션 생성
     * 
     * @return 설정된 ChromeOptions
     */
    private ChromeOptions createChromeOptions(ScraperProperties.Browser browser) {
        ChromeOptions options = new ChromeOptions();

        // Docker 환경에서는 headless 필수
        if (browser.isHeadless() || useRemoteDriver) {
            options.addArguments("--headless=new");
        }

        // 자동화 배지 최소화
        options.setExperimentalOption("excludeSwitches", Collections.singletonList("enable-automation"));
        options.addArguments("--disable-blink-features=AutomationControlled");

        options.addArguments("--lang=en-US,en");
        options.addArguments("--window-size=" + browser.getWindowSize());
        options.addArguments("user-agent=" + browser.getUserAgent());

        // --- Docker 환경을 위한 안정성 옵션 ---
        options.addArguments("--disable-gpu");
        options.addArguments("--no-sandbox");
        options.addArguments("--disable-dev-shm-usage");

        return options;
    }
}

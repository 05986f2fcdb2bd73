package com.example.walmartcrawling.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 스크래퍼 설정 (application.properties의 scraper.* 항목)
 * 
 * 대기 시간은 Spring Boot Duration 형식(예: 15s, 5m)으로 지정합니다.
 * 테스트에서는 대기 시간을 0으로 설정해 빠르게 실행합니다.
 */
@Data
@ConfigurationProperties(prefix = "scraper")
public class ScraperProperties {

    private Browser browser = new Browser();
    private Extraction extraction = new Extraction();
    private Captcha captcha = new Captcha();
    private Dispatch dispatch = new Dispatch();
    private Csv csv = new Csv();
    private Cors cors = new Cors();

    @Data
    public static class Browser {
        /** 페이지 세션 구현 (selenium: 실제 브라우저, jsoup: JS 없는 HTTP 로딩) */
        private Driver driver = Driver.SELENIUM;
        private boolean headless = false;
        private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
                + "(KHTML, like Gecko) Chrome/115.0.0.0 Safari/537.36";
        private String windowSize = "1920,1080";
        private Duration pageLoadTimeout = Duration.ofSeconds(60);

        public enum Driver {
            SELENIUM, JSOUP
        }
    }

    @Data
    public static class Extraction {
        private Duration titleTimeout = Duration.ofSeconds(15);
        private Duration priceTimeout = Duration.ofSeconds(10);
        private Duration scrollTimeout = Duration.ofSeconds(10);
        private Duration aboutScrollTimeout = Duration.ofSeconds(15);
        private Duration aboutTimeout = Duration.ofSeconds(12);
        /** 페이지 이동 후 렌더링 대기 */
        private Duration navigationSettle = Duration.ofSeconds(3);
        /** 요소로 스크롤한 뒤 대기 */
        private Duration scrollSettle = Duration.ofSeconds(2);
        /** 썸네일 클릭 후 메인 이미지 교체 대기 */
        private Duration thumbnailSettle = Duration.ofSeconds(1);
        private int maxThumbnails = 5;
    }

    @Data
    public static class Captcha {
        /** CAPTCHA 수동 해결을 기다리는 최대 시간 (초과 시 작업 실패) */
        private Duration interventionTimeout = Duration.ofMinutes(5);
    }

    @Data
    public static class Dispatch {
        /** 동시에 열 수 있는 브라우저 세션 수 */
        private int poolSize = 2;
        private int queueCapacity = 100;
        /** 기동 시 이전 프로세스가 남긴 작업 정리 및 재등록 여부 */
        private boolean recoverOnStartup = true;
    }

    @Data
    public static class Csv {
        private boolean enabled = true;
        private String path = "walmart_data.csv";
    }

    @Data
    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:3000"));
    }
}

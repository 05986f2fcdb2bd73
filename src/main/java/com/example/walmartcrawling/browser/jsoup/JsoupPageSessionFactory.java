package com.example.walmartcrawling.browser.jsoup;

import com.example.walmartcrawling.browser.PageSession;
import com.example.walmartcrawling.browser.PageSessionFactory;
import com.example.walmartcrawling.config.ScraperProperties;
import lombok.RequiredArgsConstructor;
import org.jsoup.Jsoup;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * HTTP GET + Jsoup 파싱으로 세션을 여는 팩토리 (scraper.browser.driver=jsoup)
 * 
 * 브라우저를 띄우지 않으므로 빠르지만, JavaScript로 그려지는 요소는 추출되지 않습니다.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "scraper.browser", name = "driver", havingValue = "jsoup")
public class JsoupPageSessionFactory implements PageSessionFactory {

    private final ScraperProperties properties;

    @Override
    public PageSession open() {
        ScraperProperties.Browser browser = properties.getBrowser();
        int timeoutMs = (int) browser.getPageLoadTimeout().toMillis();
        return new JsoupPageSession(url -> Jsoup.connect(url)
                .userAgent(browser.getUserAgent())
                .header("Accept-Language", "en-US,en;q=0.9")
                .timeout(timeoutMs)
                .get());
    }
}

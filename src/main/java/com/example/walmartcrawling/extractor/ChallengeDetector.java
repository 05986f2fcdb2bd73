package com.example.walmartcrawling.extractor;

import com.example.walmartcrawling.browser.PageSession;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * 페이지 소스에서 CAPTCHA 화면 여부를 판단
 */
@Component
public class ChallengeDetector {

    private static final String CHALLENGE_TOKEN = "captcha";

    public boolean isChallenged(PageSession session) {
        return session.pageSource().toLowerCase(Locale.ROOT).contains(CHALLENGE_TOKEN);
    }
}

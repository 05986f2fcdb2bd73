package com.example.walmartcrawling.extractor;

import com.example.walmartcrawling.browser.PageElement;
import com.example.walmartcrawling.browser.PageSession;
import com.example.walmartcrawling.config.ScraperProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static com.example.walmartcrawling.extractor.ProductSelectors.*;

/**
 * 상품 상세 페이지 추출 엔진
 * 
 * 로드된 페이지 세션에서 선택자 대체 체인으로 상품 필드를 추출합니다.
 * 
 * 추출 순서 (고정, 이전 단계의 스크롤 위치에 의존하는 단계가 있음):
 * 1. 상품명
 * 2. 가격
 * 3. 이미지 (미디어 갤러리로 스크롤 후 썸네일 클릭)
 * 4. 색상 / 사이즈
 * 5. 상품 설명 (About this item 패널로 스크롤)
 * 6. 연관 상품 링크
 * 
 * 필드 단위 실패는 기본값으로 흡수됩니다.
 * 세션 단위 실패(BrowserSessionException)와 CAPTCHA(CaptchaChallengeException)만 호출자에게 전파됩니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProductExtractor {

    /** 텍스트 필드 및 색상/사이즈의 기본값 */
    public static final String NOT_AVAILABLE = "N/A";

    private static final String SIZE_PLACEHOLDER = "select";

    private final ScraperProperties properties;
    private final ChallengeDetector challengeDetector;

    /**
     * 현재 페이지에서 상품 필드 추출
     * 
     * @param session 상품 페이지로 이동이 끝난 세션
     * @return 추출된 상품 필드
     * @throws CaptchaChallengeException 페이지가 CAPTCHA로 막혀 있는 경우
     */
    public ExtractedProduct extract(PageSession session) {
        if (challengeDetector.isChallenged(session)) {
            throw new CaptchaChallengeException("CAPTCHA 화면이 감지되었습니다. 수동 해결이 필요합니다.");
        }
        ScraperProperties.Extraction cfg = properties.getExtraction();

        String title = TITLE.firstMatch(session, cfg.getTitleTimeout()).orElse(NOT_AVAILABLE);
        ParsedPrice price = extractPrice(session, cfg);
        List<String> images = extractImages(session, cfg);
        Set<String> colors = extractColors(session);
        Set<String> sizes = extractSizes(session);
        List<String> aboutThisItem = extractAboutThisItem(session, cfg);
        Set<String> relatedLinks = extractRelatedLinks(session);

        log.debug("추출 완료 - 상품명: {}, 가격: {}, 이미지: {}개, 연관 링크: {}개",
                title, price.display(), images.size(), relatedLinks.size());

        return ExtractedProduct.builder()
                .title(title)
                .price(price)
                .images(Collections.unmodifiableList(images))
                .aboutThisItem(Collections.unmodifiableList(aboutThisItem))
                .colors(Collections.unmodifiableSet(colors))
                .sizes(Collections.unmodifiableSet(sizes))
                .relatedLinks(Collections.unmodifiableSet(relatedLinks))
                .build();
    }

    /**
     * 가격 추출
     * 
     * 일치한 텍스트에서 "$"와 천 단위 구분자를 제거하고 숫자로 변환합니다.
     * 변환에 실패하면 원문을 그대로 유지합니다.
     */
    ParsedPrice extractPrice(PageSession session, ScraperProperties.Extraction cfg) {
        return PRICE.firstMatch(session, cfg.getPriceTimeout())
                .map(PriceParser::parse)
                .orElse(ParsedPrice.NOT_FOUND);
    }

    /**
     * 이미지 추출
     * 
     * 썸네일을 최대 maxThumbnails개까지 차례로 클릭하고, 그때마다 표시되는 메인 이미지 URL을 수집합니다.
     * 같은 URL은 한 번만 포함되며 발견 순서를 유지합니다.
     */
    List<String> extractImages(PageSession session, ScraperProperties.Extraction cfg) {
        scrollTo(session, MEDIA_GALLERY, cfg.getScrollTimeout(), cfg);

        List<String> imageUrls = new ArrayList<>();
        List<PageElement> thumbnails = session.findAll(GALLERY_THUMBNAIL);
        int limit = Math.min(thumbnails.size(), cfg.getMaxThumbnails());
        for (PageElement thumbnail : thumbnails.subList(0, limit)) {
            session.click(thumbnail);
            settle(cfg.getThumbnailSettle());
            session.findAll(GALLERY_MAIN_IMAGE).stream()
                    .findFirst()
                    .flatMap(mainImage -> mainImage.attribute("src"))
                    .filter(src -> !imageUrls.contains(src))
                    .ifPresent(imageUrls::add);
        }
        return imageUrls;
    }

    /**
     * 색상 추출
     * 
     * 라벨이 붙은 색상 선택지가 없으면 alt 텍스트에 "color"가 들어간 이미지로 대체합니다.
     */
    Set<String> extractColors(PageSession session) {
        Set<String> colors = COLORS.firstNonEmptyGroup(session, value -> true);
        if (colors.isEmpty()) {
            colors = COLOR_IMAGE_ALT.firstNonEmptyGroup(session, value -> true);
        }
        return colors.isEmpty() ? notAvailable() : colors;
    }

    /**
     * 사이즈 추출 ("Select" 자리표시자 제외)
     */
    Set<String> extractSizes(PageSession session) {
        Set<String> sizes = SIZES.firstNonEmptyGroup(session, value -> !value.equalsIgnoreCase(SIZE_PLACEHOLDER));
        return sizes.isEmpty() ? notAvailable() : sizes;
    }

    /**
     * "About this item" 설명 추출
     * 
     * 패널로 스크롤한 뒤 패널 아래 문단 텍스트를 문서 순서대로 수집합니다. 빈 문단은 제외합니다.
     */
    List<String> extractAboutThisItem(PageSession session, ScraperProperties.Extraction cfg) {
        scrollTo(session, ABOUT_PANEL, cfg.getAboutScrollTimeout(), cfg);
        return session.waitFor(ABOUT_PANEL, cfg.getAboutTimeout())
                .map(panel -> panel.findAll(ABOUT_PARAGRAPH).stream()
                        .map(PageElement::text)
                        .map(String::trim)
                        .filter(text -> !text.isEmpty())
                        .collect(Collectors.toCollection(ArrayList::new)))
                .orElseGet(ArrayList::new);
    }

    /**
     * 연관 상품 링크 추출 (쿼리스트링 제거 후 중복 제거)
     */
    Set<String> extractRelatedLinks(PageSession session) {
        Set<String> links = new LinkedHashSet<>();
        for (PageElement anchor : session.findAll(RELATED_LINK)) {
            anchor.attribute("href")
                    .map(ProductExtractor::stripQuery)
                    .filter(href -> !href.isEmpty())
                    .ifPresent(links::add);
        }
        return links;
    }

    static String stripQuery(String url) {
        int queryStart = url.indexOf('?');
        return queryStart < 0 ? url : url.substring(0, queryStart);
    }

    private void scrollTo(PageSession session, String selector, Duration timeout, ScraperProperties.Extraction cfg) {
        session.waitFor(selector, timeout).ifPresent(found -> {
            session.scrollIntoView(found);
            settle(cfg.getScrollSettle());
        });
    }

    private static Set<String> notAvailable() {
        Set<String> values = new LinkedHashSet<>();
        values.add(NOT_AVAILABLE);
        return values;
    }

    /**
     * 화면 갱신을 위한 고정 대기 (인터럽트 시 플래그만 복구하고 진행)
     */
    public static void settle(Duration delay) {
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}

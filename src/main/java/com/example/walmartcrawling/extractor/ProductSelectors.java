package com.example.walmartcrawling.extractor;

import static com.example.walmartcrawling.extractor.SelectorStrategy.attribute;
import static com.example.walmartcrawling.extractor.SelectorStrategy.text;

/**
 * 월마트 상품 상세 페이지 선택자 모음
 */
public final class ProductSelectors {

    private ProductSelectors() {}

    public static final FallbackChain TITLE = FallbackChain.of("title",
            text("h1.prod-ProductTitle"),
            text("h1[itemprop=\"name\"]"));

    public static final FallbackChain PRICE = FallbackChain.of("price",
            text("span[itemprop=\"price\"]"),
            text("span[data-automation-id=\"product-price\"]"),
            text("span.price-characteristic"),
            text("div[data-testid=\"price\"] span"));

    public static final FallbackChain COLORS = FallbackChain.of("colors",
            text("ul[data-tl-id*=\"color\"] button span"),
            text("ul[data-tl-id*=\"color\"] label span"),
            text("div[data-automation-id=\"color-picker\"] label span"),
            text("[aria-label*=\"Color\"]"),
            text("button[aria-checked=\"true\"] span"),
            text("[itemprop=\"color\"]"));

    /** 색상 라벨이 없을 때 사용하는 이미지 alt 텍스트 */
    public static final FallbackChain COLOR_IMAGE_ALT = FallbackChain.of("colorImageAlt",
            attribute("img[alt*=\"color\"], img[alt*=\"Color\"]", "alt"));

    public static final FallbackChain SIZES = FallbackChain.of("sizes",
            text("ul[data-tl-id*=\"size\"] button span"),
            text("ul[data-tl-id*=\"size\"] label span"),
            text("div[data-automation-id=\"size-picker\"] label"),
            text("[aria-label*=\"Size\"]"),
            text("button[aria-checked=\"true\"] span"));

    public static final String MEDIA_GALLERY = "div[data-testid=\"media-gallery\"]";
    public static final String GALLERY_THUMBNAIL = "img[data-testid=\"media-gallery-thumbnail-image\"]";
    public static final String GALLERY_MAIN_IMAGE = "div[data-testid=\"media-gallery\"] img";

    public static final String ABOUT_PANEL = "div.dangerous-html.mb3";
    public static final String ABOUT_PARAGRAPH = "p";

    /** 상품 상세(/ip/) 링크 */
    public static final String RELATED_LINK = "a[href*=\"/ip/\"]";
}

package com.example.walmartcrawling.extractor;

import com.example.walmartcrawling.ScraperFixtures;
import com.example.walmartcrawling.browser.PageElement;
import com.example.walmartcrawling.browser.PageSession;
import com.example.walmartcrawling.browser.jsoup.JsoupPageSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.example.walmartcrawling.extractor.ProductSelectors.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ProductExtractorTest {

    private ProductExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new ProductExtractor(ScraperFixtures.zeroDelayProperties(), new ChallengeDetector());
    }

    @Test
    void extractsEveryFieldFromProductPage() {
        PageSession page = JsoupPageSession.ofHtml(ScraperFixtures.PRODUCT_PAGE, ScraperFixtures.BASE_URI);

        ExtractedProduct product = extractor.extract(page);

        assertThat(product.getTitle()).isEqualTo("Cordless Drill");
        assertThat(product.getPrice().getAmount()).isEqualTo(1234.50);
        // 정적 문서에서는 썸네일을 클릭해도 메인 이미지가 같으므로 한 번만 수집
        assertThat(product.getImages()).containsExactly("https://i5.walmartimages.com/drill-main.jpg");
        assertThat(product.getColors()).containsExactly("Red", "Blue");
        assertThat(product.getSizes()).containsExactly("M", "L");
        assertThat(product.getAboutThisItem()).containsExactly("20V lithium battery", "Two speed gearbox");
        assertThat(product.getRelatedLinks()).containsExactlyInAnyOrder(
                "https://www.walmart.com/ip/123",
                "https://www.walmart.com/ip/456");
    }

    @Test
    void missingFieldsTakeDefaults() {
        PageSession page = JsoupPageSession.ofHtml(ScraperFixtures.EMPTY_PAGE, ScraperFixtures.BASE_URI);

        ExtractedProduct product = extractor.extract(page);

        assertThat(product.getTitle()).isEqualTo(ProductExtractor.NOT_AVAILABLE);
        assertThat(product.getPrice()).isEqualTo(ParsedPrice.NOT_FOUND);
        assertThat(product.getImages()).isEmpty();
        assertThat(product.getColors()).containsExactly(ProductExtractor.NOT_AVAILABLE);
        assertThat(product.getSizes()).containsExactly(ProductExtractor.NOT_AVAILABLE);
        assertThat(product.getAboutThisItem()).isEmpty();
        assertThat(product.getRelatedLinks()).isEmpty();
    }

    @Test
    void unparsablePriceKeepsRawText() {
        PageSession page = JsoupPageSession.ofHtml(
                "<html><body><span itemprop=\"price\">Contact for price</span></body></html>", ScraperFixtures.BASE_URI);

        ExtractedProduct product = extractor.extract(page);

        assertThat(product.getPrice().getAmount()).isNull();
        assertThat(product.getPrice().getRawText()).isEqualTo("Contact for price");
    }

    @Test
    void colorsFallBackToImageAltText() {
        PageSession page = JsoupPageSession.ofHtml("""
                <html><body>
                  <img alt="Navy color swatch" src="/navy.jpg">
                  <img alt="Olive Color swatch" src="/olive.jpg">
                  <img alt="Product photo" src="/photo.jpg">
                </body></html>
                """, ScraperFixtures.BASE_URI);

        assertThat(extractor.extractColors(page)).containsExactly("Navy color swatch", "Olive Color swatch");
    }

    @Test
    void sizesDropSelectPlaceholderOnly() {
        PageSession page = JsoupPageSession.ofHtml("""
                <html><body>
                  <ul data-tl-id="variant-size">
                    <li><button><span>SELECT</span></button></li>
                    <li><button><span>Select a size</span></button></li>
                  </ul>
                </body></html>
                """, ScraperFixtures.BASE_URI);

        assertThat(extractor.extractSizes(page)).containsExactly("Select a size");
    }

    @Test
    void imagesAreCappedAndDeduplicated() {
        PageSession session = mock(PageSession.class);
        List<PageElement> thumbnails = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            thumbnails.add(mock(PageElement.class));
        }
        PageElement first = mainImage("https://img/a.jpg");
        PageElement second = mainImage("https://img/b.jpg");
        PageElement third = mainImage("https://img/c.jpg");
        PageElement fourth = mainImage("https://img/d.jpg");
        when(session.findAll(GALLERY_THUMBNAIL)).thenReturn(thumbnails);
        when(session.findAll(GALLERY_MAIN_IMAGE))
                .thenReturn(List.of(first), List.of(second), List.of(first), List.of(third), List.of(fourth));

        List<String> images = extractor.extractImages(session, ScraperFixtures.zeroDelayProperties().getExtraction());

        assertThat(images).containsExactly("https://img/a.jpg", "https://img/b.jpg", "https://img/c.jpg", "https://img/d.jpg");
        verify(session, times(5)).click(any());
    }

    @Test
    void challengePageRaisesCaptchaException() {
        PageSession page = JsoupPageSession.ofHtml(ScraperFixtures.CHALLENGE_PAGE, ScraperFixtures.BASE_URI);

        assertThatThrownBy(() -> extractor.extract(page))
                .isInstanceOf(CaptchaChallengeException.class);
    }

    @Test
    void fieldsAreExtractedInFixedOrder() {
        PageSession session = mock(PageSession.class);
        when(session.pageSource()).thenReturn("<html><body></body></html>");

        extractor.extract(session);

        InOrder order = inOrder(session);
        order.verify(session, atLeastOnce()).waitFor(eq(TITLE.getStrategies().get(0).getSelector()), any());
        order.verify(session, atLeastOnce()).waitFor(eq(PRICE.getStrategies().get(0).getSelector()), any());
        order.verify(session, atLeastOnce()).waitFor(eq(MEDIA_GALLERY), any());
        order.verify(session, atLeastOnce()).findAll(COLORS.getStrategies().get(0).getSelector());
        order.verify(session, atLeastOnce()).findAll(SIZES.getStrategies().get(0).getSelector());
        order.verify(session, atLeastOnce()).waitFor(eq(ABOUT_PANEL), any());
        order.verify(session, atLeastOnce()).findAll(RELATED_LINK);
    }

    private static PageElement mainImage(String src) {
        PageElement image = mock(PageElement.class);
        when(image.attribute("src")).thenReturn(Optional.of(src));
        return image;
    }
}

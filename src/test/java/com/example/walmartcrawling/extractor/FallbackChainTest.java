package com.example.walmartcrawling.extractor;

import com.example.walmartcrawling.browser.PageElement;
import com.example.walmartcrawling.browser.PageSession;
import com.example.walmartcrawling.browser.jsoup.JsoupPageSession;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static com.example.walmartcrawling.extractor.SelectorStrategy.attribute;
import static com.example.walmartcrawling.extractor.SelectorStrategy.text;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FallbackChainTest {

    @Mock
    private PageSession session;

    @Mock
    private PageElement element;

    @Test
    void secondCandidateWinsWhenFirstIsMissing() {
        PageSession page = JsoupPageSession.ofHtml(
                "<html><body><h1 itemprop=\"name\">Cordless Drill</h1></body></html>", "https://www.walmart.com/ip/1");

        Optional<String> title = ProductSelectors.TITLE.firstMatch(page, Duration.ZERO);

        assertThat(title).contains("Cordless Drill");
    }

    @Test
    void stopsAtFirstNonEmptyMatch() {
        FallbackChain chain = FallbackChain.of("price", text("a"), text("b"), text("c"));
        when(session.waitFor(eq("a"), any())).thenReturn(Optional.empty());
        when(session.waitFor(eq("b"), any())).thenReturn(Optional.of(element));
        when(element.text()).thenReturn(" $5.00 ");

        assertThat(chain.firstMatch(session, Duration.ZERO)).contains("$5.00");
        verify(session, never()).waitFor(eq("c"), any());
    }

    @Test
    void blankTextDoesNotCountAsMatch() {
        FallbackChain chain = FallbackChain.of("title", text("a"), text("b"));
        PageElement blank = mock(PageElement.class);
        when(session.waitFor(eq("a"), any())).thenReturn(Optional.of(blank));
        when(blank.text()).thenReturn("   ");
        when(session.waitFor(eq("b"), any())).thenReturn(Optional.of(element));
        when(element.text()).thenReturn("Lamp");

        assertThat(chain.firstMatch(session, Duration.ZERO)).contains("Lamp");
    }

    @Test
    void emptyWhenNoCandidateMatches() {
        FallbackChain chain = FallbackChain.of("title", text("a"), text("b"));

        assertThat(chain.firstMatch(session, Duration.ZERO)).isEmpty();
    }

    @Test
    void groupsAreNotMerged() {
        PageSession page = JsoupPageSession.ofHtml("""
                <html><body>
                  <ul class="first"><li>Red</li><li>Blue</li><li>Red</li></ul>
                  <ul class="second"><li>Green</li></ul>
                </body></html>
                """, "https://www.walmart.com/ip/1");
        FallbackChain chain = FallbackChain.of("colors", text("ul.missing li"), text("ul.first li"), text("ul.second li"));

        assertThat(chain.firstNonEmptyGroup(page, value -> true)).containsExactly("Red", "Blue");
    }

    @Test
    void groupSkippedWhenEveryValueIsRejected() {
        PageSession page = JsoupPageSession.ofHtml("""
                <html><body>
                  <ul class="first"><li>Select</li></ul>
                  <ul class="second"><li>M</li><li>L</li></ul>
                </body></html>
                """, "https://www.walmart.com/ip/1");
        FallbackChain chain = FallbackChain.of("sizes", text("ul.first li"), text("ul.second li"));

        assertThat(chain.firstNonEmptyGroup(page, value -> !value.equalsIgnoreCase("select")))
                .containsExactly("M", "L");
    }

    @Test
    void readsAttributeInsteadOfText() {
        PageSession page = JsoupPageSession.ofHtml(
                "<html><body><img alt=\"Navy color swatch\" src=\"/a.jpg\"></body></html>", "https://www.walmart.com/ip/1");
        FallbackChain chain = FallbackChain.of("alt", attribute("img", "alt"));

        assertThat(chain.firstNonEmptyGroup(page, value -> true)).containsExactly("Navy color swatch");
    }

    @Test
    void requiresAtLeastOneCandidate() {
        assertThatThrownBy(() -> FallbackChain.of("title"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void titleChainDeclaresProductTitleFirst() {
        List<SelectorStrategy> strategies = ProductSelectors.TITLE.getStrategies();

        assertThat(strategies).extracting(SelectorStrategy::getSelector)
                .containsExactly("h1.prod-ProductTitle", "h1[itemprop=\"name\"]");
    }
}

package com.example.walmartcrawling.browser.jsoup;

import com.example.walmartcrawling.browser.BrowserSessionException;
import com.example.walmartcrawling.browser.PageElement;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsoupPageSessionTest {

    private static final String HTML = """
            <html><body>
              <div class="panel">
                <p>first</p>
                <p>second</p>
              </div>
              <a href="/ip/42?from=search">Related</a>
            </body></html>
            """;

    @Test
    void navigateLoadsDocumentFromLoader() {
        JsoupPageSession session = new JsoupPageSession(url -> Jsoup.parse(HTML, url));

        session.navigate("https://www.walmart.com/ip/1");

        assertThat(session.findAll("p")).extracting(PageElement::text).containsExactly("first", "second");
        assertThat(session.pageSource()).contains("panel");
    }

    @Test
    void loaderFailureBecomesSessionException() {
        JsoupPageSession session = new JsoupPageSession(url -> {
            throw new IOException("HTTP 503");
        });

        assertThatThrownBy(() -> session.navigate("https://www.walmart.com/ip/1"))
                .isInstanceOf(BrowserSessionException.class)
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void queryBeforeNavigationIsSessionFailure() {
        JsoupPageSession session = new JsoupPageSession(url -> Jsoup.parse(HTML, url));

        assertThatThrownBy(() -> session.findAll("p")).isInstanceOf(BrowserSessionException.class);
    }

    @Test
    void missingElementIsEmptyNotError() {
        JsoupPageSession session = JsoupPageSession.ofHtml(HTML, "https://www.walmart.com/ip/1");

        assertThat(session.waitFor("h1.title", Duration.ofSeconds(5))).isEmpty();
        assertThat(session.findAll("span.none")).isEmpty();
    }

    @Test
    void invalidSelectorIsEmptyNotError() {
        JsoupPageSession session = JsoupPageSession.ofHtml(HTML, "https://www.walmart.com/ip/1");

        assertThat(session.waitFor("div[", Duration.ZERO)).isEmpty();
        assertThat(session.findAll("div[")).isEmpty();
    }

    @Test
    void hrefIsResolvedAgainstBaseUri() {
        JsoupPageSession session = JsoupPageSession.ofHtml(HTML, "https://www.walmart.com/ip/1");

        List<PageElement> links = session.findAll("a");

        assertThat(links).hasSize(1);
        assertThat(links.get(0).attribute("href")).contains("https://www.walmart.com/ip/42?from=search");
        assertThat(links.get(0).attribute("title")).isEmpty();
    }

    @Test
    void nestedQueryStaysWithinElement() {
        JsoupPageSession session = JsoupPageSession.ofHtml(HTML, "https://www.walmart.com/ip/1");

        PageElement panel = session.waitFor("div.panel", Duration.ZERO).orElseThrow();

        assertThat(panel.findAll("p")).hasSize(2);
        assertThat(panel.findAll("a")).isEmpty();
    }

    @Test
    void closedSessionRejectsQueries() {
        JsoupPageSession session = JsoupPageSession.ofHtml(HTML, "https://www.walmart.com/ip/1");

        session.close();

        assertThat(session.pageSource()).isEmpty();
        assertThatThrownBy(() -> session.findAll("p")).isInstanceOf(BrowserSessionException.class);
    }
}

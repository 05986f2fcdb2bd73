package com.example.walmartcrawling.browser.jsoup;

import com.example.walmartcrawling.browser.BrowserSessionException;
import com.example.walmartcrawling.browser.PageElement;
import com.example.walmartcrawling.browser.PageSession;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Selector;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Jsoup 기반 페이지 세션 (JavaScript 미실행)
 * 
 * 서버에서 렌더링된 HTML을 그대로 파싱하여 DOM 기능을 제공합니다.
 * 렌더링이 끝난 정적 문서이므로:
 * - waitFor()는 대기 없이 즉시 조회
 * - scrollIntoView(), click()은 아무 동작도 하지 않음 (썸네일을 클릭해도 메인 이미지가 바뀌지 않음)
 */
@Slf4j
public class JsoupPageSession implements PageSession {

    private final DocumentLoader loader;
    private Document document;

    public JsoupPageSession(DocumentLoader loader) {
        this.loader = loader;
    }

    /**
     * 이미 확보한 HTML로 세션 생성 (navigate() 호출 시 같은 문서를 다시 사용)
     * 
     * @param html 페이지 HTML
     * @param baseUri 상대 경로(href, src)를 절대 URL로 바꿀 때 기준이 되는 URL
     */
    public static JsoupPageSession ofHtml(String html, String baseUri) {
        Document parsed = Jsoup.parse(html, baseUri);
        JsoupPageSession session = new JsoupPageSession(url -> parsed);
        session.document = parsed;
        return session;
    }

    @Override
    public void navigate(String url) {
        try {
            document = loader.load(url);
        } catch (IOException | IllegalArgumentException e) {
            throw new BrowserSessionException("페이지 이동 실패: " + url, e);
        }
        if (document == null) {
            throw new BrowserSessionException("빈 문서가 반환되었습니다: " + url);
        }
    }

    @Override
    public Optional<PageElement> waitFor(String cssSelector, Duration timeout) {
        try {
            return Optional.ofNullable(requireDocument().selectFirst(cssSelector)).map(JsoupPageElement::new);
        } catch (Selector.SelectorParseException e) {
            log.debug("선택자 해석 실패 ({}): {}", cssSelector, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public List<PageElement> findAll(String cssSelector) {
        return select(requireDocument(), cssSelector);
    }

    @Override
    public void scrollIntoView(PageElement element) {
        // 정적 문서에는 스크롤 위치가 없음
    }

    @Override
    public void click(PageElement element) {
        // 정적 문서에는 이벤트 핸들러가 없음
    }

    @Override
    public String pageSource() {
        return document == null ? "" : document.outerHtml();
    }

    @Override
    public void close() {
        document = null;
    }

    static List<PageElement> select(Element root, String cssSelector) {
        try {
            return root.select(cssSelector).stream()
                    .map(element -> (PageElement) new JsoupPageElement(element))
                    .collect(Collectors.toList());
        } catch (Selector.SelectorParseException e) {
            log.debug("선택자 해석 실패 ({}): {}", cssSelector, e.getMessage());
            return List.of();
        }
    }

    private Document requireDocument() {
        if (document == null) {
            throw new BrowserSessionException("페이지가 로드되지 않았거나 세션이 닫혔습니다.");
        }
        return document;
    }
}

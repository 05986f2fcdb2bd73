package com.example.walmartcrawling.browser.jsoup;

import org.jsoup.nodes.Document;

import java.io.IOException;

/**
 * URL로부터 HTML 문서를 읽어오는 함수
 */
@FunctionalInterface
public interface DocumentLoader {

    Document load(String url) throws IOException;
}

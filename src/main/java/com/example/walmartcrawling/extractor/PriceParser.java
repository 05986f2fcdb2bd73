package com.example.walmartcrawling.extractor;

import java.math.BigDecimal;

/**
 * 가격 문자열 파서
 * 
 * "$1,234.50" → 1234.50
 * "Contact for price" → 원문 그대로 보존 (작업을 실패시키지 않음)
 */
public final class PriceParser {

    private PriceParser() {}

    public static ParsedPrice parse(String text) {
        String raw = text == null ? "" : text.trim();
        String cleaned = raw.replace("$", "").replace(",", "").trim();
        try {
            return ParsedPrice.numeric(new BigDecimal(cleaned).doubleValue());
        } catch (NumberFormatException e) {
            return ParsedPrice.raw(raw);
        }
    }
}

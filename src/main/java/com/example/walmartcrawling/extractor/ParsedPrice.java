package com.example.walmartcrawling.extractor;

import lombok.Value;

/**
 * 가격 추출 결과
 * 
 * amount 와 rawText 중 하나만 값을 가집니다.
 */
@Value
public class ParsedPrice {

    /** 가격 요소를 찾지 못했을 때의 기본값 */
    public static final ParsedPrice NOT_FOUND = new ParsedPrice(0.0, null);

    Double amount;
    /** 숫자로 해석하지 못한 원문 */
    String rawText;

    public static ParsedPrice numeric(double amount) {
        return new ParsedPrice(amount, null);
    }

    public static ParsedPrice raw(String rawText) {
        return new ParsedPrice(null, rawText);
    }

    public boolean isNumeric() {
        return amount != null;
    }

    /** CSV 등 문자열 출력용 */
    public String display() {
        return isNumeric() ? String.valueOf(amount) : rawText;
    }
}

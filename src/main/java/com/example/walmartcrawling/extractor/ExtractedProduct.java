package com.example.walmartcrawling.extractor;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * 페이지에서 추출한 상품 필드 (작업/고객 정보는 포함하지 않음)
 * 
 * 모든 필드는 기본값이 정해져 있어 null이 되지 않습니다:
 * title "N/A", price 0.0, images/aboutThisItem/relatedLinks 빈 컬렉션, colors/sizes {"N/A"}.
 */
@Value
@Builder
public class ExtractedProduct {

    String title;
    ParsedPrice price;
    List<String> images;
    List<String> aboutThisItem;
    Set<String> colors;
    Set<String> sizes;
    Set<String> relatedLinks;
}

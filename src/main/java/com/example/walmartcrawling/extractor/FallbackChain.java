package com.example.walmartcrawling.extractor;

import com.example.walmartcrawling.browser.PageElement;
import com.example.walmartcrawling.browser.PageSession;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * 필드 하나에 대한 선택자 대체 체인
 * 
 * 후보 선택자를 선언된 순서대로 시도하고, 처음으로 비어 있지 않은 결과를 낸 후보에서 멈춥니다.
 * 모든 후보가 실패하면 빈 결과를 반환하며 기본값 적용은 호출자(ProductExtractor)가 담당합니다.
 * 상품 옵션마다 마크업이 달라도 추출이 깨지지 않게 하는 핵심 장치입니다.
 */
@Slf4j
@Getter
public final class FallbackChain {

    private final String field;
    private final List<SelectorStrategy> strategies;

    private FallbackChain(String field, List<SelectorStrategy> strategies) {
        this.field = field;
        this.strategies = strategies;
    }

    public static FallbackChain of(String field, SelectorStrategy... strategies) {
        if (strategies.length == 0) {
            throw new IllegalArgumentException("후보 선택자가 최소 하나 필요합니다: " + field);
        }
        return new FallbackChain(field, List.of(strategies));
    }

    /**
     * 단일 값 필드: 각 후보마다 요소가 나타날 때까지 대기한 뒤 값을 읽음
     * 
     * @param session 페이지 세션
     * @param timeout 후보 하나당 최대 대기 시간
     * @return 첫 번째로 비어 있지 않은 값
     */
    public Optional<String> firstMatch(PageSession session, Duration timeout) {
        for (SelectorStrategy strategy : strategies) {
            Optional<String> value = session.waitFor(strategy.getSelector(), timeout).flatMap(strategy::read);
            if (value.isPresent()) {
                log.debug("[{}] '{}' 에서 값 추출", field, strategy.getSelector());
                return value;
            }
        }
        log.debug("[{}] 모든 후보 선택자 실패", field);
        return Optional.empty();
    }

    /**
     * 다중 값 필드: 값이 하나라도 나온 첫 번째 후보 그룹의 값만 사용 (그룹 간 병합 없음)
     * 
     * 대기 없이 현재 DOM을 조회하며, 같은 문자열은 한 번만 포함됩니다 (발견 순서 유지).
     * 
     * @param session 페이지 세션
     * @param accept 포함할 값 조건 (예: "select" 자리표시자 제외)
     * @return 첫 번째로 비어 있지 않은 그룹의 값, 없으면 빈 Set
     */
    public Set<String> firstNonEmptyGroup(PageSession session, Predicate<String> accept) {
        for (SelectorStrategy strategy : strategies) {
            Set<String> values = new LinkedHashSet<>();
            for (PageElement element : session.findAll(strategy.getSelector())) {
                strategy.read(element).filter(accept).ifPresent(values::add);
            }
            if (!values.isEmpty()) {
                log.debug("[{}] '{}' 에서 {}개 추출", field, strategy.getSelector(), values.size());
                return values;
            }
        }
        return new LinkedHashSet<>();
    }
}

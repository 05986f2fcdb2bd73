package com.example.walmartcrawling.service;

import com.example.walmartcrawling.entity.ScrapeTaskStatus;
import lombok.Getter;

/**
 * 허용되지 않거나 다른 작성자에게 선점된 상태 전이
 */
@Getter
public class IllegalTaskTransitionException extends RuntimeException {

    private final Long taskId;
    private final ScrapeTaskStatus current;
    private final ScrapeTaskStatus target;

    public IllegalTaskTransitionException(Long taskId, ScrapeTaskStatus current, ScrapeTaskStatus target) {
        super(String.format("작업 %d: %s → %s 전이 불가 (%s)", taskId, current, target,
                current != null && current.canTransitionTo(target) ? "다른 워커가 먼저 상태를 변경함" : "허용되지 않는 전이"));
        this.taskId = taskId;
        this.current = current;
        this.target = target;
    }
}

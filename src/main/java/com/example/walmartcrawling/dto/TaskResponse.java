package com.example.walmartcrawling.dto;

import com.example.walmartcrawling.entity.ScrapeTask;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDateTime;
import java.util.Locale;

/**
 * 작업 조회 응답 (status는 소문자: pending, running, suspended, completed, failed)
 */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TaskResponse {
    private final Long taskId;
    private final String clientName;
    private final String category;
    private final String url;
    private final String status;
    private final LocalDateTime createdAt;
    private final LocalDateTime startedAt;
    private final LocalDateTime finishedAt;
    private final String error;

    public static TaskResponse from(ScrapeTask task) {
        return TaskResponse.builder()
                .taskId(task.getId())
                .clientName(task.getClientName())
                .category(task.getCategory())
                .url(task.getUrl())
                .status(task.getStatus().name().toLowerCase(Locale.ROOT))
                .createdAt(task.getCreatedAt())
                .startedAt(task.getStartedAt())
                .finishedAt(task.getFinishedAt())
                .error(task.getError())
                .build();
    }
}

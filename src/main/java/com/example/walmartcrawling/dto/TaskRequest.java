package com.example.walmartcrawling.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 스크래핑 작업 등록 요청 ({"client_name", "category", "url"})
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TaskRequest {
    private String clientName;
    private String category;
    private String url;
}

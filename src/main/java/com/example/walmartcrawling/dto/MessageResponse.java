package com.example.walmartcrawling.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 메시지 응답. 작업/고객 ID는 해당 요청에서만 포함됩니다.
 */
@Getter
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MessageResponse {
    private final String message;
    private final Long taskId;
    private final Long clientId;

    public static MessageResponse of(String message) {
        return new MessageResponse(message, null, null);
    }

    public static MessageResponse taskSubmitted(Long taskId) {
        return new MessageResponse("Task submitted successfully.", taskId, null);
    }

    public static MessageResponse clientRegistered(Long clientId) {
        return new MessageResponse("Client registered successfully.", null, clientId);
    }
}

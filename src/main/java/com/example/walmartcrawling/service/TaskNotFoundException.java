package com.example.walmartcrawling.service;

public class TaskNotFoundException extends RuntimeException {

    public TaskNotFoundException(Long taskId) {
        super("작업을 찾을 수 없습니다: " + taskId);
    }
}

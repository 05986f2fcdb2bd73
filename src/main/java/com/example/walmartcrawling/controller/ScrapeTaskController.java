package com.example.walmartcrawling.controller;

import com.example.walmartcrawling.dto.MessageResponse;
import com.example.walmartcrawling.dto.TaskRequest;
import com.example.walmartcrawling.dto.TaskResponse;
import com.example.walmartcrawling.entity.ScrapeTask;
import com.example.walmartcrawling.service.CaptchaInterventionRegistry;
import com.example.walmartcrawling.service.ScrapeQueryService;
import com.example.walmartcrawling.service.ScrapeTaskDispatcher;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * 스크래핑 작업 REST API 컨트롤러
 * 
 * 주요 기능:
 * 1. 작업 등록 (즉시 task_id 반환, 실행은 워커 풀에서 비동기 진행)
 * 2. 작업 목록 / 단건 조회
 * 3. CAPTCHA 수동 해결 신호
 * 4. 작업 현황 조회
 */
@Tag(name = "Scrape Task Controller", description = "월마트 상품 스크래핑 작업 API")
@RestController
@RequiredArgsConstructor
public class ScrapeTaskController {

    private final ScrapeTaskDispatcher dispatcher;
    private final ScrapeQueryService queryService;
    private final CaptchaInterventionRegistry interventions;

    /**
     * 작업 등록 API
     * 
     * 작업 레코드를 PENDING으로 저장한 뒤 바로 응답합니다.
     * 
     * @param request client_name, category, url
     * @return 등록 메시지와 task_id
     */
    @Operation(summary = "1. 스크래핑 작업 등록",
               description = "상품 페이지 URL을 작업으로 등록합니다. 작업은 'pending' 상태로 저장되고 워커 풀에서 비동기로 실행됩니다.")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "작업 등록 완료",
            content = @Content(mediaType = "application/json",
                examples = @ExampleObject(value = """
                    {
                      "message": "Task submitted successfully.",
                      "task_id": 42
                    }
                    """))),
        @ApiResponse(responseCode = "400", description = "필수 값 누락 또는 http/https URL이 아님")
    })
    @PostMapping({"/submit-task", "/submit-task/"})
    public ResponseEntity<MessageResponse> submitTask(@RequestBody TaskRequest request) {
        ScrapeTask task = dispatcher.submit(request.getClientName(), request.getCategory(), request.getUrl());
        return ResponseEntity.ok(MessageResponse.taskSubmitted(task.getId()));
    }

    @Operation(summary = "2. 작업 목록 조회",
               description = "고객명 / 상태 / 카테고리로 필터링한 작업 목록을 최신 등록순으로 반환합니다.")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "작업 목록"),
        @ApiResponse(responseCode = "400", description = "알 수 없는 상태값")
    })
    @GetMapping({"/tasks", "/tasks/"})
    public ResponseEntity<List<TaskResponse>> listTasks(
        @Parameter(description = "고객명") @RequestParam(name = "client_name", required = false) String clientName,
        @Parameter(description = "pending, running, suspended, completed, failed", example = "completed")
        @RequestParam(required = false) String status,
        @Parameter(description = "카테고리") @RequestParam(required = false) String category) {
        return ResponseEntity.ok(queryService.listTasks(clientName, ScrapeQueryService.parseStatus(status), category));
    }

    @Operation(summary = "3. 작업 단건 조회")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "작업 정보"),
        @ApiResponse(responseCode = "404", description = "존재하지 않는 작업")
    })
    @GetMapping({"/tasks/{taskId}", "/tasks/{taskId}/"})
    public ResponseEntity<TaskResponse> getTask(@PathVariable Long taskId) {
        return ResponseEntity.ok(queryService.getTask(taskId));
    }

    /**
     * CAPTCHA 해결 신호 API
     * 
     * 브라우저에서 CAPTCHA를 직접 해결한 뒤 호출하면, 대기 중인 워커가 추출을 다시 시작합니다.
     * 
     * @return 대기 중인 워커가 있었으면 200, 없으면 409
     */
    @Operation(summary = "4. CAPTCHA 해결 신호",
               description = "'suspended' 상태 작업의 워커에게 CAPTCHA가 해결되었음을 알립니다. 제한 시간이 지난 작업은 이미 'failed'입니다.")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "워커가 추출을 재개함"),
        @ApiResponse(responseCode = "404", description = "존재하지 않는 작업"),
        @ApiResponse(responseCode = "409", description = "CAPTCHA 해결을 기다리는 워커가 없음")
    })
    @PostMapping({"/tasks/{taskId}/captcha-resolved", "/tasks/{taskId}/captcha-resolved/"})
    public ResponseEntity<MessageResponse> captchaResolved(@PathVariable Long taskId) {
        queryService.getTask(taskId);
        if (!interventions.resolve(taskId)) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(MessageResponse.of("Task is not waiting for CAPTCHA resolution."));
        }
        return ResponseEntity.ok(MessageResponse.of("CAPTCHA resolution received."));
    }

    @Operation(summary = "5. 전체 작업 현황 조회",
               description = "전체 작업의 상태별 개수를 요약하여 보여줍니다.")
    @ApiResponse(responseCode = "200", description = "현재 작업 현황",
        content = @Content(mediaType = "application/json",
            examples = @ExampleObject(value = """
                {
                  "TOTAL_IN_DB": 12,
                  "PENDING": 3,
                  "RUNNING": 2,
                  "SUSPENDED": 0,
                  "COMPLETED": 6,
                  "FAILED": 1
                }
                """)))
    @GetMapping({"/status", "/status/"})
    public ResponseEntity<Map<String, Long>> getStatus() {
        return ResponseEntity.ok(queryService.getStatusSummary());
    }
}

package com.example.walmartcrawling.controller;

import com.example.walmartcrawling.dto.ClientRequest;
import com.example.walmartcrawling.dto.MessageResponse;
import com.example.walmartcrawling.entity.Client;
import com.example.walmartcrawling.service.ClientService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Client Controller", description = "고객 등록 API")
@RestController
@RequiredArgsConstructor
public class ClientController {

    private final ClientService clientService;

    @Operation(summary = "고객 등록",
               description = "이메일은 고유해야 하며, 이미 등록된 이메일이면 기존 정보를 덮어쓰지 않고 거절합니다.")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "등록 완료 (client_id 반환)"),
        @ApiResponse(responseCode = "400", description = "이미 등록된 이메일 또는 필수 값 누락")
    })
    @PostMapping({"/register-client", "/register-client/"})
    public ResponseEntity<MessageResponse> registerClient(@RequestBody ClientRequest request) {
        Client client = clientService.register(request.getClientName(), request.getClientEmail());
        return ResponseEntity.ok(MessageResponse.clientRegistered(client.getId()));
    }
}

package com.example.walmartcrawling.controller;

import com.example.walmartcrawling.dto.ProductResponse;
import com.example.walmartcrawling.service.ScrapeQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Tag(name = "Product Controller", description = "수집된 상품 조회 API")
@RestController
@RequiredArgsConstructor
public class ProductController {

    private final ScrapeQueryService queryService;

    /**
     * 상품 목록 조회 API
     * 
     * 가격 범위 조건은 숫자 가격이 있는 상품에만 적용됩니다.
     * 가격 원문(price_text)만 있는 상품은 min_price / max_price 중 하나라도 지정하면 제외됩니다.
     */
    @Operation(summary = "상품 목록 조회",
               description = "고객명 / 카테고리 / 가격 범위로 필터링한 상품 목록을 최신 스크래핑순으로 반환합니다.")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "상품 목록"),
        @ApiResponse(responseCode = "400", description = "min_price가 max_price보다 큼")
    })
    @GetMapping({"/products", "/products/"})
    public ResponseEntity<List<ProductResponse>> listProducts(
        @Parameter(description = "고객명") @RequestParam(name = "client_name", required = false) String clientName,
        @Parameter(description = "카테고리") @RequestParam(required = false) String category,
        @Parameter(description = "최소 가격", example = "10.0") @RequestParam(name = "min_price", required = false) Double minPrice,
        @Parameter(description = "최대 가격", example = "100.0") @RequestParam(name = "max_price", required = false) Double maxPrice) {
        return ResponseEntity.ok(queryService.listProducts(clientName, category, minPrice, maxPrice));
    }
}

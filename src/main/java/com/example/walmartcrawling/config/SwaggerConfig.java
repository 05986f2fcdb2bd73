package com.example.walmartcrawling.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Swagger (SpringDoc OpenAPI) 설정 클래스
 * 
 * 접속 URL: http://localhost:8080/swagger-ui.html
 */
@Configuration
public class SwaggerConfig {

    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
                .components(new Components())
                .info(apiInfo());
    }

    private Info apiInfo() {
        return new Info()
                .title("Walmart Scraping Task API")
                .description("월마트 상품 페이지 스크래핑 작업을 등록하고, 작업 상태와 수집된 상품을 조회하는 API 명세서입니다. "
                        + "작업은 워커 풀에서 비동기로 실행되며 CAPTCHA가 나오면 수동 해결을 기다립니다.")
                .version("1.0.0");
    }
}

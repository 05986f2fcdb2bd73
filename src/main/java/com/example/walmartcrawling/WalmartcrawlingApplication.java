package com.example.walmartcrawling;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

/**
 * 월마트 상품 스크래핑 시스템의 메인 애플리케이션 클래스
 * 
 * 이 클래스는 Spring Boot 애플리케이션의 진입점 역할을 합니다.
 * - @EnableJpaAuditing: ScrapeTask, Client 엔티티의 생성일시/수정일시 자동 설정
 * - @ConfigurationPropertiesScan: scraper.* 설정 클래스(ScraperProperties) 바인딩
 */
@EnableJpaAuditing
@ConfigurationPropertiesScan
@SpringBootApplication
public class WalmartcrawlingApplication {

	/**
	 * 애플리케이션 실행 진입점
	 * 
	 * @param args 커맨드 라인 인자
	 */
	public static void main(String[] args) {
		SpringApplication.run(WalmartcrawlingApplication.class, args);
	}
}

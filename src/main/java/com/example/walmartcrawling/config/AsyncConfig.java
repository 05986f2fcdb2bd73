package com.example.walmartcrawling.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * 스크래핑 워커 풀 설정
 * 
 * 작업 하나가 브라우저 세션 하나를 끝까지 점유하므로 풀 크기가 곧 동시 브라우저 수입니다.
 * 대기열이 가득 차면 TaskRejectedException이 발생하며, 해당 작업은 FAILED로 기록됩니다.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "scrapeTaskExecutor")
    public ThreadPoolTaskExecutor scrapeTaskExecutor(ScraperProperties properties) {
        ScraperProperties.Dispatch dispatch = properties.getDispatch();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(dispatch.getPoolSize());
        executor.setMaxPoolSize(dispatch.getPoolSize());
        executor.setQueueCapacity(dispatch.getQueueCapacity());
        executor.setThreadNamePrefix("scrape-worker-");
        // 종료 시 CAPTCHA 대기 중인 워커를 기다리지 않음 (남은 작업은 기동 시 복구)
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}

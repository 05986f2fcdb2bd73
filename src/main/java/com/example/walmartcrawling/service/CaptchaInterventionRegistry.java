package com.example.walmartcrawling.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * CAPTCHA 수동 해결 신호를 워커에게 전달하는 레지스트리
 * 
 * 워커는 제한 시간 동안만 대기하므로 해결되지 않은 CAPTCHA가 워커 풀을 계속 점유하지 않습니다.
 */
@Slf4j
@Component
public class CaptchaInterventionRegistry {

    private final ConcurrentMap<Long, CountDownLatch> waiting = new ConcurrentHashMap<>();

    /**
     * 해결 신호 대기 등록 (워커 스레드에서 호출)
     * 
     * 작업을 SUSPENDED로 바꾸기 전에 등록해야 상태를 본 운영자의 신호가 유실되지 않습니다.
     * 
     * @param taskId 작업 ID
     * @return 대기 핸들 (close 시 등록 해제)
     */
    public Intervention open(Long taskId) {
        Intervention intervention = new Intervention(taskId);
        waiting.put(taskId, intervention.latch);
        return intervention;
    }

    /**
     * 해결 신호 전송 (운영자 요청에서 호출)
     * 
     * @return 대기 중인 워커가 있었으면 true
     */
    public boolean resolve(Long taskId) {
        CountDownLatch latch = waiting.get(taskId);
        if (latch == null) {
            return false;
        }
        latch.countDown();
        log.info("[Task {}] CAPTCHA 해결 신호 수신", taskId);
        return true;
    }

    public boolean isWaiting(Long taskId) {
        return waiting.containsKey(taskId);
    }

    /**
     * 작업 하나의 CAPTCHA 해결 대기
     */
    public class Intervention implements AutoCloseable {

        private final Long taskId;
        private final CountDownLatch latch = new CountDownLatch(1);

        private Intervention(Long taskId) {
            this.taskId = taskId;
        }

        /**
         * @param timeout 최대 대기 시간
         * @return 시간 안에 해결 신호를 받았거나 이미 받은 상태면 true
         * @throws InterruptedException 대기 중 워커가 중단된 경우
         */
        public boolean await(Duration timeout) throws InterruptedException {
            return latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        @Override
        public void close() {
            waiting.remove(taskId, latch);
        }
    }
}

package com.claude.warehouse.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * 비동기 처리 설정
 *
 * 엔티티별 Silver 파이프라인을 병렬로 실행하기 위한 스레드 풀.
 * 파이프라인끼리는 서로 다른 Bronze/Silver 테이블만 다루므로 독립적으로 실행된다.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    /**
     * 배치 작업용 스레드 풀 설정
     *
     * 설정값:
     * - corePoolSize: 6 (엔티티 수만큼 동시 실행)
     * - maxPoolSize: 12
     * - queueCapacity: 50
     */
    @Bean(name = "batchTaskExecutor")
    public Executor batchTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(6);
        executor.setMaxPoolSize(12);
        executor.setQueueCapacity(50);
        executor.setKeepAliveSeconds(60);

        // 스레드 이름 접두사 (로깅 및 디버깅용)
        executor.setThreadNamePrefix("SilverLoad-");

        // 애플리케이션 종료 시 진행 중인 적재 완료 대기
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);

        executor.initialize();

        return executor;
    }
}

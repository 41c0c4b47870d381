package com.insightreport.generator.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * 파이프라인 실행 스레드 풀 설정
 *
 * 인스턴스 조정용 풀과 액티비티 실행용 풀의 크기를 독립적으로 제한한다.
 * 초과 작업은 큐에서 대기한다.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AsyncConfig {

    private final PipelineProperties pipelineProperties;

    /**
     * 파이프라인 인스턴스 실행자
     */
    @Bean(name = "workflowExecutor")
    public ThreadPoolTaskExecutor workflowExecutor() {
        int size = pipelineProperties.getMaxConcurrentInstances();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(size);
        executor.setMaxPoolSize(size);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("report-workflow-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        log.info("Workflow executor initialized: maxConcurrentInstances={}", size);
        return executor;
    }

    /**
     * 액티비티 실행자 (AI 호출, 차트/문서 렌더링)
     */
    @Bean(name = "activityExecutor")
    public ThreadPoolTaskExecutor activityExecutor() {
        int size = pipelineProperties.getMaxConcurrentActivities();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(size);
        executor.setMaxPoolSize(size);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("report-activity-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(120);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.initialize();
        log.info("Activity executor initialized: maxConcurrentActivities={}", size);
        return executor;
    }

    /**
     * 하트비트 전송용 스케줄러
     */
    @Bean(name = "heartbeatScheduler")
    public ThreadPoolTaskScheduler heartbeatScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("report-heartbeat-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }
}

package com.newsinsight.refresh.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
@EnableScheduling
@RequiredArgsConstructor
@Slf4j
public class AsyncConfig {

    private final RefreshProperties refreshProperties;

    /**
     * 라운드 코디네이터 실행자.
     * 소스별 수집 작업은 라운드마다 별도의 제한된 워커 풀에서 실행된다.
     */
    @Bean(name = "refreshTaskExecutor")
    public ThreadPoolTaskExecutor refreshTaskExecutor() {
        RefreshProperties.ExecutorSettings settings = refreshProperties.getExecutor();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(settings.getCorePoolSize());
        executor.setMaxPoolSize(settings.getMaxPoolSize());
        executor.setQueueCapacity(settings.getQueueCapacity());
        executor.setThreadNamePrefix("refresh-round-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(settings.getAwaitTerminationSeconds());
        // Rejections must reach the orchestrator so it can release its guard
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.initialize();

        log.info("Refresh task executor ready: core={}, max={}, queue={}",
                settings.getCorePoolSize(), settings.getMaxPoolSize(), settings.getQueueCapacity());
        return executor;
    }
}

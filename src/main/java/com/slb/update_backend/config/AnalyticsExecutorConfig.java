package com.slb.update_backend.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class AnalyticsExecutorConfig {

    public static final String ANALYTICS_EXECUTOR = "analyticsExecutor";

    /**
     * 有界线程池；队列满时 AbortPolicy 抛出 TaskRejectedException，由 DownloadRecorder 记录后丢弃。
     */
    @Bean(name = ANALYTICS_EXECUTOR)
    public ThreadPoolTaskExecutor analyticsExecutor(AnalyticsProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getCoreSize());
        executor.setMaxPoolSize(Math.max(properties.getMaxSize(), properties.getCoreSize()));
        executor.setQueueCapacity(properties.getQueueCapacity());
        executor.setThreadFactory(new ThreadFactoryBuilder()
                .setNameFormat("analytics-%d")
                .setDaemon(true)
                .build());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(5);
        executor.initialize();
        return executor;
    }
}

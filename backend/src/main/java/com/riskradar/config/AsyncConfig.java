package com.riskradar.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools: analysis-executor runs coordinator pipelines (which block on delegation),
 * worker-executor runs stage requests received by this node acting as a worker.
 * Neither runs on the web event loop, which must stay free to receive acknowledgments and results.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String ANALYSIS_EXECUTOR = "analysis-executor";
    public static final String WORKER_EXECUTOR = "worker-executor";

    @Bean(name = ANALYSIS_EXECUTOR)
    public Executor analysisExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(4);
        e.setMaxPoolSize(16);
        e.setQueueCapacity(200);
        e.setThreadNamePrefix("analysis-");
        e.initialize();
        return e;
    }

    @Bean(name = WORKER_EXECUTOR)
    public Executor workerExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(4);
        e.setMaxPoolSize(8);
        e.setQueueCapacity(200);
        e.setThreadNamePrefix("worker-");
        e.initialize();
        return e;
    }
}

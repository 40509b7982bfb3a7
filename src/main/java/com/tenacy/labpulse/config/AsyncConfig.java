package com.tenacy.labpulse.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
@EnableAsync
public class AsyncConfig {

    @Value("${labpulse.alert.forwarding.pool-size:2}")
    private int forwardingPoolSize;

    @Value("${labpulse.alert.forwarding.queue-capacity:100}")
    private int forwardingQueueCapacity;

    @Bean(name = "alertForwardingExecutor")
    public Executor alertForwardingExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(forwardingPoolSize);
        executor.setMaxPoolSize(forwardingPoolSize * 2);
        executor.setQueueCapacity(forwardingQueueCapacity);
        executor.setThreadNamePrefix("alert-");
        // 큐가 가득 차면 호출 스레드에서 전송
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }
}

package com.example.callbackscheduler.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Worker pool for callback execution and the wall clock used for minute arithmetic.
 * <p>
 * The pool is bounded on both threads and queue. A full queue rejects the
 * dispatch instead of running it on the caller, so a tick never blocks on
 * slow callbacks.
 */
@Slf4j
@Configuration
public class AsyncConfig {

    @Bean(name = "callbackDispatchExecutor")
    public ThreadPoolTaskExecutor callbackDispatchExecutor(CallbackSchedulerProperties properties) {
        log.info("Creating callback dispatch executor with {} threads and queue capacity {}",
                properties.getDispatchPoolSize(), properties.getDispatchQueueCapacity());

        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getDispatchPoolSize());
        executor.setMaxPoolSize(properties.getDispatchPoolSize());
        executor.setQueueCapacity(properties.getDispatchQueueCapacity());
        executor.setThreadNamePrefix("callback-dispatch-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();

        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}

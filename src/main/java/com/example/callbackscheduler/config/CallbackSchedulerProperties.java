package com.example.callbackscheduler.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the callback scheduler.
 * Loaded from application.yml, overridable through environment variables.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "callback-scheduler")
public class CallbackSchedulerProperties {

    /**
     * Delay in milliseconds between the end of one tick and the start of the next
     */
    @Min(1000)
    private long tickIntervalMs = 60000;

    /**
     * Delay in milliseconds between periodic catchup passes
     */
    @Min(1000)
    private long catchupIntervalMs = 300000;

    /**
     * Run a catchup pass as soon as the application is ready
     */
    private boolean catchupOnStartup = true;

    /**
     * Rows fetched per store page for scans and index queries
     */
    @Min(1)
    private int pageSize = 100;

    /**
     * Worker threads executing callbacks
     */
    @Min(1)
    private int dispatchPoolSize = 20;

    /**
     * Dispatches waiting for a worker before new ones are rejected
     */
    @Min(0)
    private int dispatchQueueCapacity = 500;

    /**
     * Callback connect timeout in milliseconds
     */
    @Min(1)
    private int connectTimeoutMs = 1000;

    /**
     * Callback response timeout in milliseconds
     */
    @Min(1)
    private int clientTimeoutMs = 3000;
}

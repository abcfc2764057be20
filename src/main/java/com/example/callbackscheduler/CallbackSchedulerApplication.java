package com.example.callbackscheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Callback Scheduler Service.
 * <p>
 * Calls client endpoints back at a requested minute, with retries, and keeps
 * the outcome of every call for later inspection.
 */
@EnableScheduling
@SpringBootApplication
public class CallbackSchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CallbackSchedulerApplication.class, args);
    }
}

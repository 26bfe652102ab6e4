package com.processflow.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application entry point for the ProcessFlow engine.
 */
@SpringBootApplication(scanBasePackages = {
    "com.processflow.api",
    "com.processflow.engine"
})
public class ProcessFlowApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProcessFlowApplication.class, args);
    }
}

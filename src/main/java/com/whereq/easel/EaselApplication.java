package com.whereq.easel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for WhereQ Easel.
 * This service accepts generation requests for configured topics, admits them under
 * concurrency and backlog limits, and runs them on a node-graph execution engine.
 *
 * @author WhereQ Inc.
 */
@SpringBootApplication
@EnableScheduling
public class EaselApplication {

    public static void main(String[] args) {
        SpringApplication.run(EaselApplication.class, args);
    }
}

package com.z254.conductor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * CONDUCTOR - content workflow orchestration for online support programs.
 *
 * <p>CONDUCTOR provides:
 * <ul>
 *   <li>Workflow Engine - phase-based plans with parallel and sequential phases and critical-phase abort</li>
 *   <li>Quality Gate - one bounded refinement pass for content below the quality threshold</li>
 *   <li>Knowledge Retrieval - concurrent search strategies with deduplication, ranking and a TTL cache</li>
 *   <li>External API Guard - rate limiting and a bounded number of concurrent outbound calls</li>
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties
public class ConductorApplication {

    public static void main(String[] args) {
        SpringApplication.run(ConductorApplication.class, args);
    }
}

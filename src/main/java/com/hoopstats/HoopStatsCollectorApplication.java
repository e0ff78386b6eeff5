package com.hoopstats;

import com.hoopstats.infrastructure.config.PipelineProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main Spring Boot application for the player statistics collector.
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(PipelineProperties.class)
public class HoopStatsCollectorApplication {

    public static void main(String[] args) {
        SpringApplication.run(HoopStatsCollectorApplication.class, args);
    }
}

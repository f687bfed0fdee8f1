package com.companya.trippipeline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Hosts the three pipeline stages: file ingestion into the trip stream, merging
 * stream records into the trip store, and scheduled fare KPI aggregation.
 */
@EnableScheduling
@SpringBootApplication
public class TripPipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(TripPipelineApplication.class, args);
    }
}

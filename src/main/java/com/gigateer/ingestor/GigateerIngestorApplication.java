package com.gigateer.ingestor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main Spring Boot application for the gig ingestion service.
 */
@SpringBootApplication
public class GigateerIngestorApplication {

    public static void main(String[] args) {
        SpringApplication.run(GigateerIngestorApplication.class, args);
    }
}

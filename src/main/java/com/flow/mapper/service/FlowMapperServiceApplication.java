package com.flow.mapper.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Flow Mapper Service Application - Entry point for the Spring Boot application.
 *
 * This application builds and edits process graphs. It:
 * - Translates semantic process intents into graph patches
 * - Applies patches while keeping the node degree rules
 * - Keeps a bounded undo history per flow
 */
@SpringBootApplication
@ConfigurationPropertiesScan("com.flow.mapper.service.config")
public class FlowMapperServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(FlowMapperServiceApplication.class, args);
    }
}

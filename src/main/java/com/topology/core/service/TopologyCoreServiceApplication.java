package com.topology.core.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Topology Core Service Application - Entry point for the Spring Boot application.
 *
 * This application discovers network devices and the links between them and
 * keeps a versioned topology graph. It serves as the central service that:
 * - Runs discovery rounds over passive listeners, SNMP and vendor APIs
 * - Reconciles observations into canonical devices and links
 * - Serves snapshots, diffs, analytics findings and change events
 */
@SpringBootApplication
@EnableScheduling
@EnableAsync
@ConfigurationPropertiesScan("com.topology.core.service.config")
public class TopologyCoreServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(TopologyCoreServiceApplication.class, args);
    }
}

package com.visaflow.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application entry point for the document validation service.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class VisaflowApplication {

    public static void main(String[] args) {
        SpringApplication.run(VisaflowApplication.class, args);
    }
}

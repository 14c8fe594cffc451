package com.ai.courseassistant;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Course Assistant Application
 * Main entry point for the Spring Boot application.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class CourseAssistantApplication {

    public static void main(String[] args) {
        SpringApplication.run(CourseAssistantApplication.class, args);
    }
}

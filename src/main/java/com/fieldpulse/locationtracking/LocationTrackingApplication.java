package com.fieldpulse.locationtracking;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main Spring Boot Application Class
 * Location Tracking & Trip Analytics Engine
 */
@SpringBootApplication
public class LocationTrackingApplication {

    public static void main(String[] args) {
        SpringApplication.run(LocationTrackingApplication.class, args);
    }

}

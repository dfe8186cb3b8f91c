package com.whereq.cadence;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for WhereQ Cadence.
 * This service sequences video analysis jobs through a single rate-limited worker
 * so that calls to the external analysis service stay within its request quota.
 *
 * @author WhereQ Inc.
 */
@SpringBootApplication
public class CadenceApplication {

    public static void main(String[] args) {
        SpringApplication.run(CadenceApplication.class, args);
    }
}

package com.reprise;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for Reprise - semantic response cache for generation calls.
 */
@SpringBootApplication
@EnableScheduling
public class RepriseApplication {

    public static void main(String[] args) {
        SpringApplication.run(RepriseApplication.class, args);
    }
}

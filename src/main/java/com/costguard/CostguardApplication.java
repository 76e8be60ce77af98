package com.costguard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for Costguard - query-result cache and scoped budget evaluation core.
 */
@SpringBootApplication
@EnableScheduling
public class CostguardApplication {

    public static void main(String[] args) {
        SpringApplication.run(CostguardApplication.class, args);
    }
}

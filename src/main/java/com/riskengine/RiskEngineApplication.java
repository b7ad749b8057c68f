package com.riskengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main entry point for the territory conquest engine.
 *
 * Features:
 * - Map descriptions loaded from JSON
 * - Bot policies with different strategies
 * - Seedable, reproducible simulation
 */
@SpringBootApplication
public class RiskEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(RiskEngineApplication.class, args);
    }
}

package com.platform.resilience;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Resilience Lab Application
 * 
 * Measures how well a dependency-graph model predicts the live behaviour of a
 * container-based microservice mesh under random failures:
 * - Chaos windows stopping a random fraction of eligible containers
 * - Live probing of user-facing endpoints during each outage
 * - Monte Carlo reliability estimates from traced service dependencies
 * - Statistical comparison of model and live success rates
 */
@SpringBootApplication
public class ResilienceLabApplication {

    public static void main(String[] args) {
        SpringApplication.run(ResilienceLabApplication.class, args);
    }
}

package com.vineroute.hoscompliance;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main Spring Boot Application Class
 * Driver time cards, hours-of-service limits and the 150 air-mile exemption
 */
@SpringBootApplication
public class HosComplianceApplication {

    public static void main(String[] args) {
        SpringApplication.run(HosComplianceApplication.class, args);
    }

}

package com.riskradar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RiskRadarApplication {

    public static void main(String[] args) {
        SpringApplication.run(RiskRadarApplication.class, args);
    }
}

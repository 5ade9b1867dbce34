package com.engagement.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EngagementAnomalyApplication {

    public static void main(String[] args) {
        SpringApplication.run(EngagementAnomalyApplication.class, args);
    }
}

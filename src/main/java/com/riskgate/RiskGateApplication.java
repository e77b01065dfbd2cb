package com.riskgate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class RiskGateApplication {

    public static void main(String[] args) {
        SpringApplication.run(RiskGateApplication.class, args);
    }
}

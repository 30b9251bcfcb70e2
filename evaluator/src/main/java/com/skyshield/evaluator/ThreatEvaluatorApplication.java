package com.skyshield.evaluator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ThreatEvaluatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(ThreatEvaluatorApplication.class, args);
    }
}

package com.eainde.compliance;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ComplianceEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(ComplianceEngineApplication.class, args);
    }
}

package com.eainde.compliance.config;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ComplianceAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(ComplianceAgentApplication.class, args);
    }
}

package com.eainde.compliance;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ComplianceMatrixApplication {

    public static void main(String[] args) {
        SpringApplication.run(ComplianceMatrixApplication.class, args);
    }
}

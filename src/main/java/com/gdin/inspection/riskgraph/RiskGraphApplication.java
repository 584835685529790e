package com.gdin.inspection.riskgraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RiskGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(RiskGraphApplication.class, args);
    }

}

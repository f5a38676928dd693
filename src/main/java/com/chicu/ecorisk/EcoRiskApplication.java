package com.chicu.ecorisk;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.chicu.ecorisk")
public class EcoRiskApplication {

    public static void main(String[] args) {
        SpringApplication.run(EcoRiskApplication.class, args);
    }
}

package com.techanalysis;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TechAnalysisApplication {

    public static void main(String[] args) {
        SpringApplication.run(TechAnalysisApplication.class, args);
    }
}

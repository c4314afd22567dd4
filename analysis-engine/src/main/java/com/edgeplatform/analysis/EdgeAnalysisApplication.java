package com.edgeplatform.analysis;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EdgeAnalysisApplication {

    public static void main(String[] args) {
        SpringApplication.run(EdgeAnalysisApplication.class, args);
    }
}

package com.brainfusion.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BrainOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(BrainOrchestratorApplication.class, args);
    }
}

package com.example.registryexport;

import org.springframework.batch.core.configuration.annotation.EnableBatchProcessing;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
@EnableBatchProcessing
public class RegistryExportApplication {
    public static void main(String[] args) {
        SpringApplication.run(RegistryExportApplication.class, args);
    }
}

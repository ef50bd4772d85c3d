package com.example.registryexport.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.annotation.PostConstruct;
import java.nio.file.Path;
import java.nio.file.Paths;

@Slf4j
@Configuration
public class OutputConfig {

    @Value("${app.data-dir:data}")
    private String dataDir;

    @Value("${app.export-dir:data/export}")
    private String exportDir;

    private Path cleanedDataDir;
    private Path cleanedExportDir;

    @PostConstruct
    public void init() {
        // paths coming from the environment often carry stray whitespace
        this.cleanedDataDir = Paths.get(dataDir.trim()).toAbsolutePath().normalize();
        this.cleanedExportDir = Paths.get(exportDir.trim()).toAbsolutePath().normalize();

        log.info("Data directory: [{}]", cleanedDataDir);
        log.info("Export directory: [{}]", cleanedExportDir);
    }

    @Bean
    public Path dataDirectory() {
        return cleanedDataDir;
    }

    @Bean
    public Path exportDirectory() {
        return cleanedExportDir;
    }
}

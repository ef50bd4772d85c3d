package com.example.registryexport.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/** Structured settings under {@code app.*}; scalar ones are read with {@code @Value}. */
@Data
@ConfigurationProperties("app")
public class RegistryProperties {

    private Normalizer normalizer = new Normalizer();
    private Layout layout = new Layout();
    private Sample sample = new Sample();

    @Data
    public static class Normalizer {
        /** Suffix tokens, longer forms first. Empty means the built-in list. */
        private List<String> suffixes = new ArrayList<>();
    }

    @Data
    public static class Layout {
        private int totalWidth = 1440;
        private int maxOfficers = 6;
        private String datePattern = "yyyyMMdd";
        /** Head columns in record order. Empty means the cordata layout. */
        private List<Column> headFields = new ArrayList<>();
        private List<Column> officerFields = new ArrayList<>();
    }

    @Data
    public static class Column {
        private String name;
        private int width;
    }

    public enum SampleMode {
        BASIC,
        COMPREHENSIVE
    }

    @Data
    public static class Sample {
        private boolean enabled = true;
        private SampleMode mode = SampleMode.COMPREHENSIVE;
        private int count = 1000;
        private long seed = 42L;
    }
}

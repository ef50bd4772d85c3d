package com.example.registryexport.config;

import com.example.registryexport.batch.Batcher;
import com.example.registryexport.codec.RecordCodec;
import com.example.registryexport.generators.SampleRegistryGenerator;
import com.example.registryexport.layout.FieldLayout;
import com.example.registryexport.layout.FieldLayouts;
import com.example.registryexport.matching.NameNormalizer;
import com.example.registryexport.reader.CsvRegistryImporter;
import com.example.registryexport.reader.ParallelRecordDecoder;
import com.example.registryexport.writer.EntityLineAggregator;
import com.example.registryexport.writer.JsonDocumentWriter;
import com.example.registryexport.writer.SegmentFileWriter;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the record codec, matching and file components from configuration. */
@Slf4j
@Configuration
@EnableConfigurationProperties(RegistryProperties.class)
public class RegistryConfig {

    @Value("${app.chunk-size:100}")
    private int chunkSize;

    @Value("${app.thread-pool.size:4}")
    private int threadPoolSize;

    @Value("${app.segment-prefix:cordata}")
    private String segmentPrefix;

    @Bean
    public FieldLayout fieldLayout(RegistryProperties properties) {
        RegistryProperties.Layout config = properties.getLayout();
        if (config.getHeadFields().isEmpty()) {
            FieldLayout layout = FieldLayouts.cordata();
            log.info("Using cordata layout {}", layout);
            return layout;
        }
        FieldLayout.Builder builder = FieldLayout.builder(config.getTotalWidth())
                .maxOfficers(config.getMaxOfficers());
        for (RegistryProperties.Column column : config.getHeadFields()) {
            builder.field(column.getName(), column.getWidth());
        }
        for (RegistryProperties.Column column : config.getOfficerFields()) {
            builder.officerField(column.getName(), column.getWidth());
        }
        FieldLayout layout = builder.build();
        log.info("Using configured layout {}", layout);
        return layout;
    }

    @Bean
    public RecordCodec recordCodec(FieldLayout fieldLayout, RegistryProperties properties) {
        return new RecordCodec(fieldLayout, properties.getLayout().getDatePattern());
    }

    @Bean
    public NameNormalizer nameNormalizer(RegistryProperties properties) {
        if (properties.getNormalizer().getSuffixes().isEmpty()) {
            return new NameNormalizer();
        }
        return new NameNormalizer(properties.getNormalizer().getSuffixes());
    }

    @Bean
    public Batcher batcher(RecordCodec recordCodec) {
        return new Batcher(recordCodec, chunkSize);
    }

    @Bean
    public SegmentFileWriter segmentFileWriter(Batcher batcher, RecordCodec recordCodec) {
        return new SegmentFileWriter(batcher, new EntityLineAggregator(recordCodec), segmentPrefix);
    }

    @Bean
    public ParallelRecordDecoder parallelRecordDecoder(RecordCodec recordCodec) {
        return new ParallelRecordDecoder(recordCodec, threadPoolSize);
    }

    @Bean
    public CsvRegistryImporter csvRegistryImporter() {
        return new CsvRegistryImporter();
    }

    @Bean
    public SampleRegistryGenerator sampleRegistryGenerator(RegistryProperties properties) {
        return new SampleRegistryGenerator(properties.getSample().getSeed());
    }

    @Bean
    public JsonDocumentWriter jsonDocumentWriter(ObjectMapper objectMapper) {
        return new JsonDocumentWriter(objectMapper);
    }
}

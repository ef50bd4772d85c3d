package com.example.registryexport.config;

import com.example.registryexport.generators.SampleRegistryGenerator;
import com.example.registryexport.listener.RunStatusListener;
import com.example.registryexport.matching.NameNormalizer;
import com.example.registryexport.reader.CsvRegistryImporter;
import com.example.registryexport.reader.ParallelRecordDecoder;
import com.example.registryexport.tasklet.ExportTasklet;
import com.example.registryexport.tasklet.IngestTasklet;
import com.example.registryexport.writer.JsonDocumentWriter;
import com.example.registryexport.writer.SegmentFileWriter;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.Step;
import org.springframework.batch.core.configuration.annotation.JobBuilderFactory;
import org.springframework.batch.core.configuration.annotation.StepBuilderFactory;
import org.springframework.batch.core.launch.support.RunIdIncrementer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
public class BatchConfig {

    @Autowired
    private JobBuilderFactory jobBuilderFactory;

    @Autowired
    private StepBuilderFactory stepBuilderFactory;

    @Autowired
    @Qualifier("dataDirectory")
    private Path dataDirectory;

    @Autowired
    @Qualifier("exportDirectory")
    private Path exportDirectory;

    @Autowired
    private RegistryProperties properties;

    @Value("${app.input-pattern:cordata*.txt}")
    private String inputPattern;

    @Value("${app.csv-file:sunbiz_data.csv}")
    private String csvFile;

    @Value("${app.index-file:name_index.json}")
    private String indexFile;

    @Value("${app.status-file:status.json}")
    private String statusFile;

    @Value("${app.skip-malformed:true}")
    private boolean skipMalformed;

    @Bean
    public Job registryExportJob(RunStatusListener runStatusListener, Step ingestStep, Step exportStep) {
        return jobBuilderFactory.get("registryExportJob")
                .incrementer(new RunIdIncrementer())
                .listener(runStatusListener)
                .start(ingestStep)          // make sure fixed-width input exists
                .next(exportStep)           // then decode, re-segment and index it
                .build();
    }

    @Bean
    public Step ingestStep(IngestTasklet ingestTasklet) {
        return stepBuilderFactory.get("ingestStep")
                .tasklet(ingestTasklet)
                .build();
    }

    @Bean
    public Step exportStep(ExportTasklet exportTasklet) {
        return stepBuilderFactory.get("exportStep")
                .tasklet(exportTasklet)
                .build();
    }

    @Bean
    public IngestTasklet ingestTasklet(CsvRegistryImporter csvRegistryImporter,
                                       SampleRegistryGenerator sampleRegistryGenerator,
                                       SegmentFileWriter segmentFileWriter) {
        return new IngestTasklet(dataDirectory, exportDirectory, inputPattern, dataDirectory.resolve(csvFile.trim()),
                properties.getSample(), csvRegistryImporter, sampleRegistryGenerator, segmentFileWriter);
    }

    @Bean
    public ExportTasklet exportTasklet(ParallelRecordDecoder parallelRecordDecoder,
                                       SegmentFileWriter segmentFileWriter,
                                       NameNormalizer nameNormalizer,
                                       JsonDocumentWriter jsonDocumentWriter) {
        return new ExportTasklet(dataDirectory, exportDirectory, inputPattern, dataDirectory.resolve(indexFile.trim()),
                skipMalformed, parallelRecordDecoder, segmentFileWriter, nameNormalizer, jsonDocumentWriter);
    }

    @Bean
    public RunStatusListener runStatusListener(JsonDocumentWriter jsonDocumentWriter) {
        return new RunStatusListener(dataDirectory.resolve(statusFile.trim()), jsonDocumentWriter);
    }
}

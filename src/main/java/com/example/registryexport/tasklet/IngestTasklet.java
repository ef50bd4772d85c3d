package com.example.registryexport.tasklet;

import com.example.registryexport.config.RegistryProperties;
import com.example.registryexport.generators.SampleRegistryGenerator;
import com.example.registryexport.model.Entity;
import com.example.registryexport.reader.CsvRegistryImporter;
import com.example.registryexport.reader.InputFiles;
import com.example.registryexport.writer.SegmentFileWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.StepContribution;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.repeat.RepeatStatus;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Makes sure fixed-width input exists in the data directory. Existing
 * {@code cordata} files are used as they are; otherwise a local CSV extract
 * is converted, and failing that sample associations are generated.
 */
@Slf4j
public class IngestTasklet implements Tasklet {

    private final Path dataDirectory;
    private final Path exportDirectory;
    private final String inputPattern;
    private final Path csvFile;
    private final RegistryProperties.Sample sample;
    private final CsvRegistryImporter csvImporter;
    private final SampleRegistryGenerator sampleGenerator;
    private final SegmentFileWriter segmentWriter;

    public IngestTasklet(Path dataDirectory, Path exportDirectory, String inputPattern, Path csvFile,
                         RegistryProperties.Sample sample, CsvRegistryImporter csvImporter,
                         SampleRegistryGenerator sampleGenerator, SegmentFileWriter segmentWriter) {
        this.dataDirectory = dataDirectory;
        this.exportDirectory = exportDirectory;
        this.inputPattern = inputPattern;
        this.csvFile = csvFile;
        this.sample = sample;
        this.csvImporter = csvImporter;
        this.sampleGenerator = sampleGenerator;
        this.segmentWriter = segmentWriter;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) throws Exception {
        Files.createDirectories(dataDirectory);
        Files.createDirectories(exportDirectory);

        List<Path> existing = InputFiles.list(dataDirectory, inputPattern);
        if (!existing.isEmpty()) {
            log.info("Found {} input files in {}", existing.size(), dataDirectory);
            return RepeatStatus.FINISHED;
        }

        List<Entity> entities;
        if (csvFile != null && Files.isRegularFile(csvFile)) {
            log.info("No fixed-width input, converting {}", csvFile);
            entities = csvImporter.importFile(csvFile);
        } else if (sample.isEnabled()) {
            log.info("No fixed-width input or CSV extract, creating {} sample data", sample.getMode());
            entities = sample.getMode() == RegistryProperties.SampleMode.BASIC
                    ? SampleRegistryGenerator.basicSample()
                    : sampleGenerator.generate(sample.getCount());
        } else {
            throw new IllegalStateException("No input matching " + inputPattern + " in " + dataDirectory
                    + ", no CSV extract at " + csvFile + " and sample data is disabled");
        }

        segmentWriter.write(dataDirectory, entities);
        contribution.incrementWriteCount(entities.size());
        return RepeatStatus.FINISHED;
    }
}

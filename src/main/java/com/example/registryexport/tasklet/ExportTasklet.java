package com.example.registryexport.tasklet;

import com.example.registryexport.matching.MatchIndex;
import com.example.registryexport.matching.NameNormalizer;
import com.example.registryexport.reader.DecodedBatch;
import com.example.registryexport.reader.InputFiles;
import com.example.registryexport.reader.ParallelRecordDecoder;
import com.example.registryexport.reader.RecordFailure;
import com.example.registryexport.writer.JsonDocumentWriter;
import com.example.registryexport.writer.SegmentFileWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.StepContribution;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.repeat.RepeatStatus;

import java.nio.file.Path;
import java.util.List;

/**
 * Decodes every input segment, re-emits the entities as normalized segment
 * files in the export directory and writes the name index.
 */
@Slf4j
public class ExportTasklet implements Tasklet {

    public static final String SUMMARY_KEY = "summary";

    private final Path dataDirectory;
    private final Path exportDirectory;
    private final String inputPattern;
    private final Path indexFile;
    private final boolean skipMalformed;
    private final ParallelRecordDecoder decoder;
    private final SegmentFileWriter segmentWriter;
    private final NameNormalizer normalizer;
    private final JsonDocumentWriter jsonWriter;

    public ExportTasklet(Path dataDirectory, Path exportDirectory, String inputPattern, Path indexFile,
                         boolean skipMalformed, ParallelRecordDecoder decoder, SegmentFileWriter segmentWriter,
                         NameNormalizer normalizer, JsonDocumentWriter jsonWriter) {
        this.dataDirectory = dataDirectory;
        this.exportDirectory = exportDirectory;
        this.inputPattern = inputPattern;
        this.indexFile = indexFile;
        this.skipMalformed = skipMalformed;
        this.decoder = decoder;
        this.segmentWriter = segmentWriter;
        this.normalizer = normalizer;
        this.jsonWriter = jsonWriter;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) throws Exception {
        List<Path> inputs = InputFiles.list(dataDirectory, inputPattern);
        DecodedBatch batch = decoder.decodeFiles(inputs);

        for (int i = 0; i < batch.getEntities().size(); i++) {
            contribution.incrementReadCount();
        }
        for (RecordFailure failure : batch.getFailures()) {
            log.warn("Malformed record {}", failure);
            contribution.incrementReadSkipCount();
        }
        if (batch.hasFailures() && !skipMalformed) {
            throw new IllegalStateException(batch.getFailures().size() + " malformed records, first: "
                    + batch.getFailures().get(0));
        }

        List<Path> segments = segmentWriter.write(exportDirectory, batch.getEntities());
        contribution.incrementWriteCount(batch.getEntities().size());

        MatchIndex index = MatchIndex.build(batch.getEntities(), normalizer);
        jsonWriter.writeIndex(indexFile, index);

        String summary = String.format("Processed %d records from %d files into %d segments, %d skipped, %d names indexed",
                batch.getEntities().size(), inputs.size(), segments.size(), batch.getFailures().size(), index.size());
        ExecutionContext jobContext = chunkContext.getStepContext().getStepExecution()
                .getJobExecution().getExecutionContext();
        jobContext.putString(SUMMARY_KEY, summary);
        log.info(summary);
        return RepeatStatus.FINISHED;
    }
}

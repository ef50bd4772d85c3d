package com.example.registryexport.writer;

import com.example.registryexport.batch.Batcher;
import com.example.registryexport.model.Entity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.item.file.FlatFileItemWriter;
import org.springframework.batch.item.file.builder.FlatFileItemWriterBuilder;
import org.springframework.batch.item.file.transform.LineAggregator;
import org.springframework.core.io.FileSystemResource;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Writes the chunks of a {@link Batcher} to {@code <prefix><n>.txt}, one
 * file per chunk, numbered from zero. Segment files left over from an
 * earlier, larger run are removed first.
 */
@Slf4j
public class SegmentFileWriter {

    private static final String ENCODING = "US-ASCII";

    private final Batcher batcher;
    private final LineAggregator<Entity> lineAggregator;
    private final String prefix;
    private final Pattern segmentName;

    public SegmentFileWriter(Batcher batcher, LineAggregator<Entity> lineAggregator, String prefix) {
        this.batcher = batcher;
        this.lineAggregator = lineAggregator;
        this.prefix = prefix;
        this.segmentName = Pattern.compile(Pattern.quote(prefix) + "\\d+\\.txt");
    }

    public List<Path> write(Path directory, List<Entity> entities) throws Exception {
        Files.createDirectories(directory);
        deleteSegments(directory);

        List<Path> written = new ArrayList<>();
        int fileNum = 0;
        for (List<Entity> chunk : batcher.chunks(entities)) {
            Path file = directory.resolve(prefix + fileNum + ".txt");
            FlatFileItemWriter<Entity> writer = new FlatFileItemWriterBuilder<Entity>()
                    .name("segmentWriter")
                    .resource(new FileSystemResource(file))
                    .encoding(ENCODING)
                    .lineSeparator(Batcher.LINE_SEPARATOR)
                    .lineAggregator(lineAggregator)
                    .shouldDeleteIfExists(true)
                    .transactional(false)   // the file is complete when write returns
                    .build();
            writer.open(new ExecutionContext());
            try {
                writer.write(chunk);
            } finally {
                writer.close();
            }
            log.debug("Wrote {} entities to {}", chunk.size(), file);
            written.add(file);
            fileNum++;
        }
        log.info("Wrote {} entities to {} segment files in {}", entities.size(), written.size(), directory);
        return written;
    }

    private void deleteSegments(Path directory) throws IOException {
        List<Path> stale = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory,
                p -> segmentName.matcher(p.getFileName().toString()).matches())) {
            for (Path path : stream) {
                stale.add(path);
            }
        }
        for (Path path : stale) {
            Files.delete(path);
        }
        if (!stale.isEmpty()) {
            log.info("Removed {} segment files from an earlier run in {}", stale.size(), directory);
        }
    }
}

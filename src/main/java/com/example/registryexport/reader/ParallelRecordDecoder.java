package com.example.registryexport.reader;

import com.example.registryexport.codec.RecordCodec;
import com.example.registryexport.codec.RecordFormatException;
import com.example.registryexport.model.Entity;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Decodes record lines on a small thread pool. Lines are split into
 * contiguous slices, one task per slice, and the slices are joined back in
 * order, so the entity list always follows the input line order.
 */
@Slf4j
public class ParallelRecordDecoder {

    private final RecordCodec codec;
    private final int threads;

    public ParallelRecordDecoder(RecordCodec codec, int threads) {
        if (threads <= 0) {
            throw new IllegalArgumentException("thread count must be positive, was " + threads);
        }
        this.codec = codec;
        this.threads = threads;
    }

    /** Reads and decodes each file in the given order. */
    public DecodedBatch decodeFiles(List<Path> files) throws IOException {
        List<Entity> entities = new ArrayList<>();
        List<RecordFailure> failures = new ArrayList<>();
        for (Path file : files) {
            // ISO-8859-1 maps every byte, so stray non-ASCII bytes surface as length or field problems
            List<String> lines = Files.readAllLines(file, StandardCharsets.ISO_8859_1);
            DecodedBatch batch = decode(file.getFileName().toString(), lines);
            log.info("Decoded {}: {} records, {} failures", file, batch.getEntities().size(), batch.getFailures().size());
            entities.addAll(batch.getEntities());
            failures.addAll(batch.getFailures());
        }
        return new DecodedBatch(Collections.unmodifiableList(entities), Collections.unmodifiableList(failures));
    }

    public DecodedBatch decode(String source, List<String> lines) {
        if (lines.isEmpty()) {
            return new DecodedBatch(Collections.emptyList(), Collections.emptyList());
        }
        int sliceSize = Math.max(1, (lines.size() + threads - 1) / threads);
        ExecutorService executorService = Executors.newFixedThreadPool(Math.min(threads, lines.size()));

        try {
            List<CompletableFuture<List<Outcome>>> futures = new ArrayList<>();
            for (int start = 0; start < lines.size(); start += sliceSize) {
                int from = start;
                int to = Math.min(lines.size(), start + sliceSize);
                futures.add(CompletableFuture.supplyAsync(() -> decodeSlice(lines, from, to), executorService));
            }

            List<Entity> entities = new ArrayList<>(lines.size());
            List<RecordFailure> failures = new ArrayList<>();
            for (CompletableFuture<List<Outcome>> future : futures) {
                for (Outcome outcome : future.join()) {
                    if (outcome.entity != null) {
                        entities.add(outcome.entity);
                    } else {
                        failures.add(new RecordFailure(source, outcome.lineNumber,
                                outcome.error.getReason(), outcome.error.getMessage()));
                    }
                }
            }
            return new DecodedBatch(entities, failures);
        } finally {
            executorService.shutdown();
        }
    }

    private List<Outcome> decodeSlice(List<String> lines, int from, int to) {
        List<Outcome> outcomes = new ArrayList<>(to - from);
        for (int i = from; i < to; i++) {
            try {
                outcomes.add(new Outcome(i + 1, codec.decode(lines.get(i)), null));
            } catch (RecordFormatException e) {
                outcomes.add(new Outcome(i + 1, null, e));
            }
        }
        return outcomes;
    }

    private static final class Outcome {
        final int lineNumber;
        final Entity entity;
        final RecordFormatException error;

        Outcome(int lineNumber, Entity entity, RecordFormatException error) {
            this.lineNumber = lineNumber;
            this.entity = entity;
            this.error = error;
        }
    }
}

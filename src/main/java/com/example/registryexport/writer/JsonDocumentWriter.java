package com.example.registryexport.writer;

import com.example.registryexport.matching.MatchIndex;
import com.example.registryexport.model.RunStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;

/** Writes the JSON side documents of a run: the name index and the run status. */
@Slf4j
public class JsonDocumentWriter {

    private final ObjectMapper objectMapper;

    public JsonDocumentWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void writeIndex(Path file, MatchIndex index) throws IOException {
        write(file, index.asMap());
        log.info("Wrote name index with {} entries to {}", index.size(), file);
    }

    public void writeStatus(Path file, String status, String message) throws IOException {
        write(file, new RunStatus(LocalDateTime.now().toString(), status, message));
        log.info("Status {}: {}", status, message);
    }

    private void write(Path file, Object document) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writeValue(file.toFile(), document);
    }
}

package com.example.registryexport.writer;

import com.example.registryexport.matching.MatchIndex;
import com.example.registryexport.matching.NameNormalizer;
import com.example.registryexport.model.Entity;
import com.example.registryexport.model.RunStatus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class JsonDocumentWriterTest {

    @TempDir
    Path dir;

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("should write the index as a name to document number object")
    void writesIndex() throws Exception {
        MatchIndex index = MatchIndex.build(Arrays.asList(
                Entity.builder().documentNumber("M1").name("PELICAN BAY FOUNDATION INC").build(),
                Entity.builder().documentNumber("M2").name("BONITA BAY CLUB INC").build()), new NameNormalizer());
        Path file = dir.resolve("nested/name_index.json");

        new JsonDocumentWriter(mapper).writeIndex(file, index);

        JsonNode json = mapper.readTree(file.toFile());
        assertThat(json.get("PELICAN BAY FOUNDATION").asText()).isEqualTo("M1");
        assertThat(json.get("BONITA BAY CLUB").asText()).isEqualTo("M2");
        assertThat(json.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("should write last_update, status and message")
    void writesStatus() throws Exception {
        Path file = dir.resolve("status.json");

        new JsonDocumentWriter(mapper).writeStatus(file, RunStatus.SUCCESS, "done");

        RunStatus status = mapper.readValue(file.toFile(), RunStatus.class);
        assertThat(status.getStatus()).isEqualTo("success");
        assertThat(status.getMessage()).isEqualTo("done");
        assertThat(status.getLastUpdate()).isNotBlank();
        assertThat(mapper.readTree(file.toFile()).has("last_update")).isTrue();
    }
}

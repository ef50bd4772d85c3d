package com.example.registryexport.reader;

import com.example.registryexport.codec.Fixtures;
import com.example.registryexport.codec.RecordCodec;
import com.example.registryexport.codec.RecordFormatException;
import com.example.registryexport.layout.FieldLayouts;
import com.example.registryexport.model.Entity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParallelRecordDecoderTest {

    private final RecordCodec codec = new RecordCodec(FieldLayouts.cordata());

    private List<String> lines(int count) {
        List<String> lines = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            lines.add(codec.encode(Fixtures.pelicanBay().toBuilder()
                    .documentNumber("D" + i)
                    .name("ASSOCIATION " + i)
                    .build()));
        }
        return lines;
    }

    @Test
    @DisplayName("should return entities in input order")
    void preservesOrder() {
        DecodedBatch batch = new ParallelRecordDecoder(codec, 4).decode("test", lines(1003));

        assertThat(batch.hasFailures()).isFalse();
        assertThat(batch.getEntities()).hasSize(1003);
        for (int i = 0; i < 1003; i++) {
            assertThat(batch.getEntities().get(i).getDocumentNumber()).isEqualTo("D" + i);
        }
    }

    @Test
    @DisplayName("should report bad lines with their line number and keep the rest")
    void reportsFailures() {
        List<String> lines = lines(10);
        lines.set(3, lines.get(3).substring(0, 100));
        lines.set(7, "");

        DecodedBatch batch = new ParallelRecordDecoder(codec, 3).decode("cordata0.txt", lines);

        assertThat(batch.getEntities()).extracting(Entity::getDocumentNumber)
                .containsExactly("D0", "D1", "D2", "D4", "D5", "D6", "D8", "D9");
        assertThat(batch.getFailures()).extracting(RecordFailure::getLineNumber).containsExactly(4, 8);
        assertThat(batch.getFailures()).extracting(RecordFailure::getReason)
                .containsOnly(RecordFormatException.Reason.LENGTH_MISMATCH);
        assertThat(batch.getFailures().get(0).getSource()).isEqualTo("cordata0.txt");
    }

    @Test
    @DisplayName("should handle fewer lines than threads and no lines at all")
    void smallInputs() {
        ParallelRecordDecoder decoder = new ParallelRecordDecoder(codec, 8);

        assertThat(decoder.decode("one", lines(1)).getEntities()).hasSize(1);
        assertThat(decoder.decode("none", Collections.emptyList()).getEntities()).isEmpty();
    }

    @Test
    @DisplayName("should read files in the given order")
    void decodesFiles(@TempDir Path dir) throws Exception {
        List<String> all = lines(5);
        Path first = dir.resolve("cordata0.txt");
        Path second = dir.resolve("cordata1.txt");
        Files.write(first, all.subList(0, 3), StandardCharsets.US_ASCII);
        Files.write(second, all.subList(3, 5), StandardCharsets.US_ASCII);

        DecodedBatch batch = new ParallelRecordDecoder(codec, 2).decodeFiles(Arrays.asList(first, second));

        assertThat(batch.getEntities()).extracting(Entity::getDocumentNumber)
                .containsExactly("D0", "D1", "D2", "D3", "D4");
    }

    @Test
    @DisplayName("should reject a non-positive thread count")
    void invalidThreads() {
        assertThatThrownBy(() -> new ParallelRecordDecoder(codec, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}

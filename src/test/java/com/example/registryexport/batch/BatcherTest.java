package com.example.registryexport.batch;

import com.example.registryexport.codec.Fixtures;
import com.example.registryexport.codec.RecordCodec;
import com.example.registryexport.layout.FieldLayouts;
import com.example.registryexport.model.Entity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BatcherTest {

    private final RecordCodec codec = new RecordCodec(FieldLayouts.cordata());

    private static List<Entity> entities(int count) {
        List<Entity> entities = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            entities.add(Fixtures.pelicanBay().toBuilder()
                    .documentNumber(String.format("M%08d", i))
                    .name("ASSOCIATION " + i)
                    .build());
        }
        return entities;
    }

    private static <T> List<T> toList(Iterable<T> iterable) {
        List<T> list = new ArrayList<>();
        iterable.forEach(list::add);
        return list;
    }

    @Test
    @DisplayName("should split 250 entities into chunks of 100, 100 and 50 in order")
    void chunkSizes() {
        List<Entity> source = entities(250);

        List<List<Entity>> chunks = toList(new Batcher(codec, 100).chunks(source));

        assertThat(chunks).extracting(List::size).containsExactly(100, 100, 50);
        assertThat(chunks.get(0)).containsExactlyElementsOf(source.subList(0, 100));
        assertThat(chunks.get(1)).containsExactlyElementsOf(source.subList(100, 200));
        assertThat(chunks.get(2)).containsExactlyElementsOf(source.subList(200, 250));
    }

    @Test
    @DisplayName("should yield the same partition on every iteration")
    void restartable() {
        Iterable<List<Entity>> chunks = new Batcher(codec, 7).chunks(entities(20));

        assertThat(toList(chunks)).isEqualTo(toList(chunks));
        assertThat(toList(chunks)).extracting(List::size).containsExactly(7, 7, 6);
    }

    @Test
    @DisplayName("should produce no chunks for an empty list and one chunk for a short list")
    void edgeSizes() {
        Batcher batcher = new Batcher(codec, 100);

        assertThat(toList(batcher.chunks(Collections.emptyList()))).isEmpty();
        assertThat(toList(batcher.chunks(entities(100)))).hasSize(1);
        assertThat(toList(batcher.segments(Collections.emptyList()))).isEmpty();
    }

    @Test
    @DisplayName("should render each chunk as newline-terminated fixed-width lines")
    void segments() {
        List<Entity> source = entities(5);

        List<String> segments = toList(new Batcher(codec, 2).segments(source));

        assertThat(segments).hasSize(3);
        String[] lines = segments.get(1).split("\n", -1);
        assertThat(lines).hasSize(3);
        assertThat(lines[0]).isEqualTo(codec.encode(source.get(2)));
        assertThat(lines[1]).isEqualTo(codec.encode(source.get(3)));
        assertThat(lines[2]).isEmpty();
        assertThat(segments.get(2)).hasSize(1441);
    }

    @Test
    @DisplayName("should not let callers change the source through a chunk")
    void chunksAreReadOnly() {
        List<Entity> chunk = new Batcher(codec, 3).chunks(entities(3)).iterator().next();

        assertThatThrownBy(() -> chunk.remove(0)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("should fail past the last chunk")
    void exhausted() {
        Iterator<List<Entity>> it = new Batcher(codec, 3).chunks(entities(2)).iterator();
        it.next();

        assertThat(it.hasNext()).isFalse();
        assertThatThrownBy(it::next).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    @DisplayName("should reject a non-positive chunk size")
    void invalidChunkSize() {
        assertThatThrownBy(() -> new Batcher(codec, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}

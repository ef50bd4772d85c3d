package com.example.registryexport.batch;

import com.example.registryexport.codec.RecordCodec;
import com.example.registryexport.model.Entity;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Splits an ordered entity list into consecutive chunks of {@code chunkSize}
 * (the last one possibly shorter) and renders each chunk as one text segment
 * of fixed-width lines. Chunking is positional only.
 *
 * <p>The returned iterables are lazy and can be iterated any number of
 * times; each iteration walks the same partition. They read the source list
 * as it is at iteration time.
 */
public class Batcher {

    public static final String LINE_SEPARATOR = "\n";

    private final RecordCodec codec;
    private final int chunkSize;

    public Batcher(RecordCodec codec, int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunk size must be positive, was " + chunkSize);
        }
        this.codec = codec;
        this.chunkSize = chunkSize;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public Iterable<List<Entity>> chunks(List<Entity> entities) {
        return () -> new ChunkIterator(entities, chunkSize);
    }

    public Iterable<String> segments(List<Entity> entities) {
        return () -> new Iterator<String>() {
            private final Iterator<List<Entity>> chunks = new ChunkIterator(entities, chunkSize);

            @Override
            public boolean hasNext() {
                return chunks.hasNext();
            }

            @Override
            public String next() {
                return encode(chunks.next());
            }
        };
    }

    /** Encodes every member of {@code chunk} in order, one line each. */
    public String encode(List<Entity> chunk) {
        StringBuilder segment = new StringBuilder(chunk.size() * (codec.getLayout().totalWidth() + 1));
        for (Entity entity : chunk) {
            segment.append(codec.encode(entity)).append(LINE_SEPARATOR);
        }
        return segment.toString();
    }

    private static final class ChunkIterator implements Iterator<List<Entity>> {
        private final List<Entity> source;
        private final int size;
        private int next;

        ChunkIterator(List<Entity> source, int size) {
            this.source = source;
            this.size = size;
        }

        @Override
        public boolean hasNext() {
            return next < source.size();
        }

        @Override
        public List<Entity> next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            int end = Math.min(source.size(), next + size);
            List<Entity> chunk = Collections.unmodifiableList(source.subList(next, end));
            next = end;
            return chunk;
        }
    }
}

package com.example.registryexport.writer;

import com.example.registryexport.codec.RecordCodec;
import com.example.registryexport.model.Entity;
import org.springframework.batch.item.file.transform.LineAggregator;

/**
 * Renders an entity as one fixed-width record line. Characters outside ASCII
 * are replaced with {@code ?} here, one for one, so the line keeps its width
 * when written with an ASCII encoder.
 */
public class EntityLineAggregator implements LineAggregator<Entity> {

    private static final char REPLACEMENT = '?';

    private final RecordCodec codec;

    public EntityLineAggregator(RecordCodec codec) {
        this.codec = codec;
    }

    @Override
    public String aggregate(Entity entity) {
        char[] line = codec.encode(entity).toCharArray();
        for (int i = 0; i < line.length; i++) {
            if (line[i] > 0x7F) {
                line[i] = REPLACEMENT;
            }
        }
        return new String(line);
    }
}

package com.example.registryexport.matching;

import com.example.registryexport.model.Entity;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Canonical name to document number lookup built once from a finished batch.
 * When two entities share a key the later one wins. The index never changes
 * after {@link #build}, so any number of threads may call {@link #lookup}.
 */
@Slf4j
public final class MatchIndex {

    private final NameNormalizer normalizer;
    private final Map<String, String> entries;

    private MatchIndex(NameNormalizer normalizer, Map<String, String> entries) {
        this.normalizer = normalizer;
        this.entries = Collections.unmodifiableMap(entries);
    }

    public static MatchIndex build(Iterable<Entity> entities, NameNormalizer normalizer) {
        Map<String, String> entries = new LinkedHashMap<>();
        int withoutKey = 0;
        int replaced = 0;
        for (Entity entity : entities) {
            if (!entity.hasDocumentNumber()) {
                withoutKey++;
                continue;
            }
            String key = normalizer.normalize(entity.getName());
            if (key.isEmpty()) {
                withoutKey++;
                continue;
            }
            String previous = entries.put(key, entity.getDocumentNumber());
            if (previous != null && !previous.equals(entity.getDocumentNumber())) {
                replaced++;
                log.debug("Name '{}' now maps to {} (was {})", key, entity.getDocumentNumber(), previous);
            }
        }
        log.info("Match index built: {} names, {} replaced by a later entity, {} entities without name or document number",
                entries.size(), replaced, withoutKey);
        return new MatchIndex(normalizer, entries);
    }

    /** Document number for the entity whose canonical name equals that of {@code rawName}. */
    public Optional<String> lookup(String rawName) {
        return Optional.ofNullable(entries.get(normalizer.normalize(rawName)));
    }

    public int size() {
        return entries.size();
    }

    /** Read-only view in insertion order of first appearance, for serialization. */
    public Map<String, String> asMap() {
        return entries;
    }
}

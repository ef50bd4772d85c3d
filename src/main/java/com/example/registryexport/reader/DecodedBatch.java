package com.example.registryexport.reader;

import com.example.registryexport.model.Entity;
import lombok.Value;

import java.util.List;

/** Entities in input order plus the records that could not be decoded. */
@Value
public class DecodedBatch {
    List<Entity> entities;
    List<RecordFailure> failures;

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}

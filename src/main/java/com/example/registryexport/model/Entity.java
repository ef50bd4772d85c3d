package com.example.registryexport.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * One registry entity as carried by a fixed-width record. Immutable; use
 * {@link #toBuilder()} to derive a changed copy.
 */
@Value
@Builder(toBuilder = true)
public class Entity {

    /** Registry key, {@code null} for records that carry none. */
    String documentNumber;
    @Builder.Default
    String name = "";
    @Builder.Default
    EntityStatus status = EntityStatus.UNKNOWN;
    @Builder.Default
    String entityType = "";
    @Builder.Default
    Address principalAddress = Address.EMPTY;
    @Builder.Default
    Address mailingAddress = Address.EMPTY;
    LocalDate fileDate;
    @Builder.Default
    Party registeredAgent = Party.EMPTY;
    @Builder.Default
    Party propertyManager = Party.EMPTY;
    @Singular
    List<Officer> officers;

    public boolean hasDocumentNumber() {
        return documentNumber != null && !documentNumber.isEmpty();
    }
}

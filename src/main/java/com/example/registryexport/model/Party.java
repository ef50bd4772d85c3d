package com.example.registryexport.model;

import lombok.Builder;
import lombok.Value;

/**
 * A named party attached to an entity: the registered agent or the property
 * manager. {@code type} is the registry's one-letter flag (C corporation,
 * P person), empty when unknown.
 */
@Value
@Builder(toBuilder = true)
public class Party {

    public static final Party EMPTY = Party.builder().build();

    @Builder.Default
    String name = "";
    @Builder.Default
    String type = "";
    @Builder.Default
    Address address = Address.EMPTY;
}

package com.example.registryexport.model;

import lombok.Builder;
import lombok.Value;

/**
 * One officer stride. The raw {@code titleCode} is kept so codes without an
 * {@link OfficerTitle} constant survive a decode/encode cycle.
 */
@Value
@Builder(toBuilder = true)
public class Officer {

    @Builder.Default
    String titleCode = "";
    @Builder.Default
    String type = "";
    @Builder.Default
    String name = "";
    @Builder.Default
    Address address = Address.EMPTY;

    public OfficerTitle getTitle() {
        return OfficerTitle.fromCode(titleCode);
    }
}

package com.example.registryexport.layout;

import lombok.Value;

/** One named column of a fixed-width record. */
@Value
public class FieldSpec {
    String name;
    int width;

    public static FieldSpec of(String name, int width) {
        return new FieldSpec(name, width);
    }
}

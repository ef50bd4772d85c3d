package com.example.registryexport.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class Address {

    public static final Address EMPTY = Address.builder().build();

    @Builder.Default
    String line1 = "";
    @Builder.Default
    String line2 = "";
    @Builder.Default
    String city = "";
    @Builder.Default
    String state = "";
    @Builder.Default
    String postalCode = "";
    @Builder.Default
    String country = "";
}

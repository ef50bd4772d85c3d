package com.example.registryexport.model;

public enum EntityStatus {
    ACTIVE("A"),
    INACTIVE("I"),
    // codes the registry adds later land here instead of failing the record
    UNKNOWN("");

    private final String code;

    EntityStatus(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static EntityStatus fromCode(String code) {
        if (code == null || code.isEmpty()) {
            return UNKNOWN;
        }
        for (EntityStatus status : values()) {
            if (status != UNKNOWN && status.code.equals(code)) {
                return status;
            }
        }
        return UNKNOWN;
    }
}

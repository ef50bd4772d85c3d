package com.example.registryexport.model;

/** Officer role codes as they appear in the four-column title field. */
public enum OfficerTitle {
    PRESIDENT("PRES"),
    VICE_PRESIDENT("VICE"),
    TREASURER("TREA"),
    SECRETARY("SECR"),
    DIRECTOR("DIRE"),
    CHIEF_EXECUTIVE("CEO"),
    MANAGER("MGR"),
    MANAGING_MEMBER("MGRM"),
    AUTHORIZED_MEMBER("AMBR"),
    OTHER("");

    private final String code;

    OfficerTitle(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static OfficerTitle fromCode(String code) {
        if (code == null) {
            return OTHER;
        }
        String trimmed = code.trim();
        for (OfficerTitle title : values()) {
            if (title != OTHER && title.code.equals(trimmed)) {
                return title;
            }
        }
        return OTHER;
    }
}

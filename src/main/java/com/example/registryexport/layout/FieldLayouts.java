package com.example.registryexport.layout;

import static com.example.registryexport.layout.RecordFields.*;

/** Built-in layouts. */
public final class FieldLayouts {

    public static final int CORDATA_WIDTH = 1440;
    public static final int CORDATA_MAX_OFFICERS = 6;

    private FieldLayouts() {
    }

    /**
     * Quarterly corporate data file: 668 head columns, six officer strides of
     * 128 and four trailing filler columns.
     */
    public static FieldLayout cordata() {
        FieldLayout.Builder b = FieldLayout.builder(CORDATA_WIDTH)
                .field(DOCUMENT_NUMBER, 12)
                .field(NAME, 192)
                .field(STATUS, 1)
                .field(ENTITY_TYPE, 15);
        fullAddress(b, PRINCIPAL_ADDRESS);
        fullAddress(b, MAILING_ADDRESS);
        b.field(FILE_DATE, 8)
                .field(FILLER_PREFIX + "1", 64)
                .field(path(REGISTERED_AGENT, NAME), 42)
                .field(path(REGISTERED_AGENT, TYPE), 1)
                .field(path(REGISTERED_AGENT, ADDRESS, LINE1), 42)
                .field(path(REGISTERED_AGENT, ADDRESS, CITY), 28)
                .field(path(REGISTERED_AGENT, ADDRESS, STATE), 2)
                .field(path(REGISTERED_AGENT, ADDRESS, POSTAL_CODE), 9);

        return b.officerField(TITLE, 4)
                .officerField(TYPE, 1)
                .officerField(NAME, 42)
                .officerField(path(ADDRESS, LINE1), 42)
                .officerField(path(ADDRESS, CITY), 28)
                .officerField(path(ADDRESS, STATE), 2)
                .officerField(path(ADDRESS, POSTAL_CODE), 9)
                .maxOfficers(CORDATA_MAX_OFFICERS)
                .build();
    }

    private static void fullAddress(FieldLayout.Builder b, String block) {
        b.field(path(block, LINE1), 42)
                .field(path(block, LINE2), 42)
                .field(path(block, CITY), 28)
                .field(path(block, STATE), 2)
                .field(path(block, POSTAL_CODE), 10)
                .field(path(block, COUNTRY), 2);
    }
}

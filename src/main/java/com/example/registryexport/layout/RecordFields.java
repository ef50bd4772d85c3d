package com.example.registryexport.layout;

/**
 * Column names understood by the record codec. Address and party columns are
 * dotted paths under their owning block.
 */
public final class RecordFields {

    public static final String FILLER_PREFIX = "filler";

    public static final String DOCUMENT_NUMBER = "documentNumber";
    public static final String NAME = "name";
    public static final String STATUS = "status";
    public static final String ENTITY_TYPE = "entityType";
    public static final String FILE_DATE = "fileDate";

    public static final String PRINCIPAL_ADDRESS = "principalAddress";
    public static final String MAILING_ADDRESS = "mailingAddress";
    public static final String REGISTERED_AGENT = "registeredAgent";
    public static final String PROPERTY_MANAGER = "propertyManager";

    // address members
    public static final String ADDRESS = "address";
    public static final String LINE1 = "line1";
    public static final String LINE2 = "line2";
    public static final String CITY = "city";
    public static final String STATE = "state";
    public static final String POSTAL_CODE = "postalCode";
    public static final String COUNTRY = "country";

    // party and officer members
    public static final String TYPE = "type";
    public static final String TITLE = "title";

    private RecordFields() {
    }

    public static String path(String... parts) {
        return String.join(".", parts);
    }

    public static boolean isFiller(String name) {
        return name.startsWith(FILLER_PREFIX);
    }
}

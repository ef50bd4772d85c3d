package com.example.registryexport.reader;

import com.example.registryexport.codec.RecordCodec;
import com.example.registryexport.model.Address;
import com.example.registryexport.model.Entity;
import com.example.registryexport.model.EntityStatus;
import com.example.registryexport.model.Officer;
import com.example.registryexport.model.OfficerTitle;
import com.example.registryexport.model.Party;
import org.springframework.batch.item.file.mapping.FieldSetMapper;
import org.springframework.batch.item.file.transform.FieldSet;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Properties;

/**
 * Maps one row of a CSV registry extract to an {@link Entity}. Columns are
 * looked up by header name; missing columns fall back to the defaults the
 * registry export has always used. The document number is left empty when
 * the row has none, the importer assigns one.
 */
public class CsvEntityFieldSetMapper implements FieldSetMapper<Entity> {

    private static final DateTimeFormatter FILE_DATE = RecordCodec.strictDateFormat(RecordCodec.DEFAULT_DATE_PATTERN);

    static final String DEFAULT_NAME = "UNKNOWN ASSOCIATION";
    static final String DEFAULT_TYPE = "CONDO";
    static final String DEFAULT_LINE1 = "123 Main St";
    static final String DEFAULT_CITY = "Fort Myers";
    static final String DEFAULT_STATE = "FL";
    static final String DEFAULT_ZIP = "33901";
    static final String DEFAULT_COUNTRY = "US";
    static final String DEFAULT_FILE_DATE = "20200101";
    static final String DEFAULT_AGENT = "REGISTERED AGENT LLC";
    static final String DEFAULT_AGENT_LINE1 = "1000 Corporate Dr";
    static final String AGENT_TYPE_CORPORATION = "C";
    static final String OFFICER_TYPE_PERSON = "P";

    @Override
    public Entity mapFieldSet(FieldSet fieldSet) {
        Properties row = fieldSet.getProperties();

        String city = column(row, DEFAULT_CITY, "city");
        String zip = column(row, DEFAULT_ZIP, "zip");
        Address principal = Address.builder()
                .line1(column(row, DEFAULT_LINE1, "address1", "address"))
                .line2(column(row, "", "address2"))
                .city(city)
                .state(column(row, DEFAULT_STATE, "state"))
                .postalCode(zip)
                .country(column(row, DEFAULT_COUNTRY, "country"))
                .build();

        String propertyManager = column(row, "", "property_manager");
        Party agent = Party.builder()
                .name(column(row, propertyManager.isEmpty() ? DEFAULT_AGENT : propertyManager, "agent_name"))
                .type(AGENT_TYPE_CORPORATION)
                .address(Address.builder()
                        .line1(column(row, DEFAULT_AGENT_LINE1, "agent_address"))
                        .city(column(row, city, "agent_city"))
                        .state(DEFAULT_STATE)
                        .postalCode(column(row, prefix(zip, 5), "agent_zip"))
                        .build())
                .build();

        String status = column(row, EntityStatus.ACTIVE.getCode(), "status");
        Entity.EntityBuilder entity = Entity.builder()
                .documentNumber(emptyToNull(column(row, "", "document_number", "id")))
                .name(column(row, DEFAULT_NAME, "entity_name", "name"))
                .status(EntityStatus.fromCode(status.substring(0, 1)))
                .entityType(column(row, DEFAULT_TYPE, "type"))
                .principalAddress(principal)
                .mailingAddress(principal)
                .fileDate(LocalDate.parse(column(row, DEFAULT_FILE_DATE, "file_date"), FILE_DATE))
                .registeredAgent(agent);
        if (!propertyManager.isEmpty()) {
            entity.propertyManager(Party.builder().name(propertyManager).build());
        }

        Address officerAddress = Address.builder()
                .line1(DEFAULT_LINE1)
                .city(city)
                .state(DEFAULT_STATE)
                .postalCode(prefix(zip, 9))
                .build();
        entity.officer(officer(OfficerTitle.PRESIDENT, "JOHN SMITH", officerAddress))
                .officer(officer(OfficerTitle.VICE_PRESIDENT, "JANE DOE", officerAddress))
                .officer(officer(OfficerTitle.TREASURER, "ROBERT JOHNSON", officerAddress))
                .officer(officer(OfficerTitle.SECRETARY, "MARY WILLIAMS", officerAddress));
        return entity.build();
    }

    private static Officer officer(OfficerTitle title, String name, Address address) {
        return Officer.builder()
                .titleCode(title.getCode())
                .type(OFFICER_TYPE_PERSON)
                .name(name)
                .address(address)
                .build();
    }

    /** First non-blank value among {@code names}, else {@code fallback}. */
    private static String column(Properties row, String fallback, String... names) {
        for (String name : names) {
            String value = row.getProperty(name);
            if (value != null && !value.trim().isEmpty()) {
                return value.trim();
            }
        }
        return fallback;
    }

    private static String prefix(String s, int n) {
        return s.length() <= n ? s : s.substring(0, n);
    }

    private static String emptyToNull(String s) {
        return s.isEmpty() ? null : s;
    }
}

package com.example.registryexport.codec;

import com.example.registryexport.model.Address;
import com.example.registryexport.model.Entity;
import com.example.registryexport.model.EntityStatus;
import com.example.registryexport.model.Officer;
import com.example.registryexport.model.Party;

import java.time.LocalDate;

/** Entities whose values fit the cordata columns. */
public final class Fixtures {

    private Fixtures() {
    }

    public static Address officerAddress(String line1) {
        return Address.builder().line1(line1).city("NAPLES").state("FL").postalCode("34108").build();
    }

    public static Officer officer(String title, String name) {
        return Officer.builder().titleCode(title).type("P").name(name).address(officerAddress("123 MAIN ST")).build();
    }

    public static Entity pelicanBay() {
        Address principal = Address.builder()
                .line1("6251 PELICAN BAY BLVD")
                .line2("SUITE  100")
                .city("NAPLES")
                .state("FL")
                .postalCode("34108")
                .country("US")
                .build();
        return Entity.builder()
                .documentNumber("M13000010")
                .name("PELICAN BAY FOUNDATION INC")
                .status(EntityStatus.ACTIVE)
                .entityType("DOMNP")
                .principalAddress(principal)
                .mailingAddress(principal.toBuilder().line1("PO BOX 1234").line2("").build())
                .fileDate(LocalDate.of(1974, 4, 19))
                .registeredAgent(Party.builder()
                        .name("CORPORATE AGENTS OF NAPLES")
                        .type("C")
                        .address(Address.builder().line1("1000 CORPORATE DR").city("FORT MYERS")
                                .state("FL").postalCode("33907").build())
                        .build())
                .officer(officer("PRES", "JOHN SMITH"))
                .officer(officer("VICE", "JANE DOE"))
                .officer(officer("TREA", "ROBERT JOHNSON"))
                .build();
    }

    public static String repeat(char c, int n) {
        StringBuilder sb = new StringBuilder(n);
        for (int i = 0; i < n; i++) {
            sb.append(c);
        }
        return sb.toString();
    }
}

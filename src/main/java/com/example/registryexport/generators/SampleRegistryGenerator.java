package com.example.registryexport.generators;

import com.example.registryexport.model.Address;
import com.example.registryexport.model.Entity;
import com.example.registryexport.model.EntityStatus;
import com.example.registryexport.model.Officer;
import com.example.registryexport.model.OfficerTitle;
import com.example.registryexport.model.Party;
import com.github.javafaker.Faker;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Random;

/**
 * Builds sample community associations for runs without a real extract.
 * Names, cities and managers rotate through fixed lists so the same count
 * always yields the same entities; officer street addresses come from a
 * seeded {@link Faker}.
 */
public class SampleRegistryGenerator {

    private static final List<String> PREFIXES = Arrays.asList(
            "The", "Las", "Villa", "Park", "Grand", "Royal", "Palm", "Ocean", "Bay", "Gulf",
            "Marina", "Harbor", "Sunset", "Sunrise", "Eagle", "Coral", "Beach", "Island");

    private static final List<String> NAMES = Arrays.asList(
            "Palms", "Gardens", "Estates", "Villas", "Towers", "Pointe", "Landing", "Preserve",
            "Harbour", "Shores", "Ridge", "Cove", "Terrace", "Plaza", "Square", "Commons",
            "Crossing", "Village", "Plantation", "Oaks");

    private static final List<String> SUFFIXES = Arrays.asList(
            "Condominium Association Inc", "Homeowners Association Inc",
            "Property Owners Association Inc", "Community Association Inc",
            "Master Association Inc");

    private static final String[][] CITIES = {
            {"Fort Myers", "33901"}, {"Naples", "34102"}, {"Cape Coral", "33904"},
            {"Bonita Springs", "34134"}, {"Estero", "33928"}, {"Marco Island", "34145"},
            {"Sanibel", "33957"}, {"Fort Myers Beach", "33931"}, {"Lehigh Acres", "33936"},
            {"Immokalee", "34142"}, {"North Fort Myers", "33903"}, {"Punta Gorda", "33950"},
            {"Port Charlotte", "33948"}, {"Englewood", "34223"}, {"Venice", "34285"},
            {"Sarasota", "34236"}, {"Bradenton", "34205"}, {"Palmetto", "34221"}};

    private static final List<String> PROPERTY_MANAGERS = Arrays.asList(
            "Premier Property Management SW FL",
            "Coastal Property Services Inc",
            "Gulf Coast Management Group LLC",
            "Sunshine State Property Management",
            "Florida Community Management Corp",
            "Professional Property Services",
            "Sandcastle Community Management",
            "Tropical Property Management Inc",
            "Elite Property Management SWFL",
            "Paradise Property Management",
            "Gulfshore Property Services",
            "Southwest Florida Management",
            "Beacon Property Management",
            "Compass Rose Management",
            "Seabreeze Property Services");

    private static final List<String> STREET_TYPES = Arrays.asList("Blvd", "Ave", "Dr", "Way", "Ln", "Ct");

    private static final String[][] OFFICERS = {
            {"JOHN", "SMITH", "JOHNSON", "WILLIAMS", "BROWN"},
            {"JANE", "DOE", "DAVIS", "MILLER", "WILSON"},
            {"ROBERT", "JONES", "GARCIA", "MARTINEZ", "ANDERSON"},
            {"MARY", "TAYLOR", "THOMAS", "HERNANDEZ", "MOORE"},
            {"JAMES", "MARTIN", "JACKSON", "THOMPSON", "WHITE"}};

    private static final OfficerTitle[] OFFICER_TITLES = {
            OfficerTitle.PRESIDENT, OfficerTitle.VICE_PRESIDENT, OfficerTitle.TREASURER,
            OfficerTitle.SECRETARY, OfficerTitle.DIRECTOR};

    static final long FIRST_DOCUMENT = 13_000_001L;

    private final Faker faker;

    public SampleRegistryGenerator(long seed) {
        this.faker = new Faker(new Locale("en-US"), new Random(seed));
    }

    public List<Entity> generate(int count) {
        List<Entity> entities = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            entities.add(generateAssociation(i));
        }
        return entities;
    }

    Entity generateAssociation(int i) {
        String name = NAMES.get((i / PREFIXES.size()) % NAMES.size());
        String entityName = (PREFIXES.get(i % PREFIXES.size()) + " " + name + " "
                + SUFFIXES.get(i % SUFFIXES.size())).toUpperCase(Locale.ROOT);
        String[] city = CITIES[i % CITIES.length];
        String manager = PROPERTY_MANAGERS.get(i % PROPERTY_MANAGERS.size());

        Address principal = Address.builder()
                .line1((1000 + i * 10) + " " + name + " " + STREET_TYPES.get(i % STREET_TYPES.size()))
                .city(city[0])
                .state("FL")
                .postalCode(city[1])
                .country("US")
                .build();

        Entity.EntityBuilder entity = Entity.builder()
                .documentNumber(String.format("M%011d", FIRST_DOCUMENT + i))
                .name(entityName)
                .status(EntityStatus.ACTIVE)
                .entityType("CONDO")
                .principalAddress(principal)
                .mailingAddress(principal)
                .fileDate(LocalDate.of(2000 + (i % 24), 1, 1))
                // the manager doubles as registered agent, as in the quarterly files
                .registeredAgent(Party.builder()
                        .name(manager)
                        .type("C")
                        .address(Address.builder()
                                .line1("5000 Executive Way")
                                .city("Fort Myers")
                                .state("FL")
                                .postalCode("33907")
                                .build())
                        .build())
                .propertyManager(Party.builder().name(manager).type("C").build());

        for (int k = 0; k < OFFICERS.length; k++) {
            String[] names = OFFICERS[k];
            entity.officer(Officer.builder()
                    .titleCode(OFFICER_TITLES[k].getCode())
                    .type("P")
                    .name(names[0] + " " + names[1 + i % 4])
                    .address(Address.builder()
                            .line1(faker.address().streetAddress())
                            .city(city[0])
                            .state("FL")
                            .postalCode(city[1])
                            .build())
                    .build());
        }
        return entity.build();
    }

    /** The five associations used to smoke-test a deployment. */
    public static List<Entity> basicSample() {
        String[][] rows = {
                {"M00000000001", "PELICAN BAY FOUNDATION INC", "NAPLES", "34108"},
                {"M00000000002", "FIDDLERS CREEK COMMUNITY ASSOCIATION INC", "NAPLES", "34114"},
                {"M00000000003", "BONITA BAY CLUB INC", "BONITA SPRINGS", "34134"},
                {"M00000000004", "THE BROOKS COMMUNITY ASSOCIATION INC", "BONITA SPRINGS", "34135"},
                {"M00000000005", "MIROMAR LAKES COMMUNITY ASSOCIATION INC", "ESTERO", "33913"}};
        List<Entity> entities = new ArrayList<>(rows.length);
        for (String[] row : rows) {
            entities.add(Entity.builder()
                    .documentNumber(row[0])
                    .name(row[1])
                    .status(EntityStatus.ACTIVE)
                    .entityType("CONDO")
                    .principalAddress(Address.builder()
                            .line1("123 Main St")
                            .city(row[2])
                            .state("FL")
                            .postalCode(row[3])
                            .country("US")
                            .build())
                    .build());
        }
        return entities;
    }
}

package com.example.registryexport.reader;

import com.example.registryexport.codec.RecordCodec;
import com.example.registryexport.layout.FieldLayouts;
import com.example.registryexport.model.Entity;
import com.example.registryexport.model.EntityStatus;
import com.example.registryexport.model.OfficerTitle;
import com.example.registryexport.model.Officer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CsvRegistryImporterTest {

    @TempDir
    Path dir;

    private Path csv(String... lines) throws Exception {
        Path file = dir.resolve("sunbiz_data.csv");
        Files.write(file, Arrays.asList(lines), StandardCharsets.UTF_8);
        return file;
    }

    @Test
    @DisplayName("should map named columns and copy the principal address to mailing")
    void mapsColumns() throws Exception {
        Path file = csv(
                "document_number,entity_name,status,type,address1,city,state,zip,file_date,agent_name",
                "N11000001,\"SEABREEZE TOWERS, INC.\",I,DOMNP,1 Gulf Shore Blvd,Naples,FL,34102,19990315,Ann Agent");

        List<Entity> entities = new CsvRegistryImporter().importFile(file);

        assertThat(entities).hasSize(1);
        Entity entity = entities.get(0);
        assertThat(entity.getDocumentNumber()).isEqualTo("N11000001");
        assertThat(entity.getName()).isEqualTo("SEABREEZE TOWERS, INC.");
        assertThat(entity.getStatus()).isEqualTo(EntityStatus.INACTIVE);
        assertThat(entity.getEntityType()).isEqualTo("DOMNP");
        assertThat(entity.getPrincipalAddress().getCity()).isEqualTo("Naples");
        assertThat(entity.getPrincipalAddress().getCountry()).isEqualTo("US");
        assertThat(entity.getMailingAddress()).isEqualTo(entity.getPrincipalAddress());
        assertThat(entity.getFileDate()).isEqualTo(LocalDate.of(1999, 3, 15));
        assertThat(entity.getRegisteredAgent().getName()).isEqualTo("Ann Agent");
        assertThat(entity.getRegisteredAgent().getType()).isEqualTo("C");
        assertThat(entity.getRegisteredAgent().getAddress().getPostalCode()).isEqualTo("34102");
        assertThat(entity.getOfficers()).extracting(Officer::getTitle).containsExactly(
                OfficerTitle.PRESIDENT, OfficerTitle.VICE_PRESIDENT, OfficerTitle.TREASURER, OfficerTitle.SECRETARY);
    }

    @Test
    @DisplayName("should fall back to defaults and synthesize document numbers")
    void defaults() throws Exception {
        Path file = csv("name,property_manager", "Palm Cove Association,Beacon Property Management", "Oak Ridge,");

        List<Entity> entities = new CsvRegistryImporter().importFile(file);

        assertThat(entities).extracting(Entity::getDocumentNumber).containsExactly("M00000000000", "M00000000001");
        Entity first = entities.get(0);
        assertThat(first.getName()).isEqualTo("Palm Cove Association");
        assertThat(first.getStatus()).isEqualTo(EntityStatus.ACTIVE);
        assertThat(first.getEntityType()).isEqualTo("CONDO");
        assertThat(first.getPrincipalAddress().getCity()).isEqualTo("Fort Myers");
        assertThat(first.getFileDate()).isEqualTo(LocalDate.of(2020, 1, 1));
        assertThat(first.getPropertyManager().getName()).isEqualTo("Beacon Property Management");
        assertThat(first.getRegisteredAgent().getName()).isEqualTo("Beacon Property Management");
        assertThat(entities.get(1).getRegisteredAgent().getName()).isEqualTo("REGISTERED AGENT LLC");
        assertThat(entities.get(1).getPropertyManager().getName()).isEmpty();
    }

    @Test
    @DisplayName("should skip rows that cannot be mapped")
    void skipsBadRows() throws Exception {
        Path file = csv("document_number,entity_name,file_date",
                "A1,GOOD ONE,20010101",
                "A2,BAD DATE,2001-01-01",
                "A3,GOOD TWO,20020202",
                "A4,NO SUCH DAY,20210231");

        List<Entity> entities = new CsvRegistryImporter().importFile(file);

        assertThat(entities).extracting(Entity::getDocumentNumber).containsExactly("A1", "A3");
    }

    @Test
    @DisplayName("should number synthetic documents by position within twelve columns")
    void syntheticNumbers() {
        assertThat(CsvRegistryImporter.syntheticDocumentNumber(0)).isEqualTo("M00000000000");
        assertThat(CsvRegistryImporter.syntheticDocumentNumber(250)).isEqualTo("M00000000250");
        assertThat(CsvRegistryImporter.syntheticDocumentNumber(Integer.MAX_VALUE)).hasSize(12);
    }

    @Test
    @DisplayName("should keep synthetic numbers distinct after a fixed-width round trip")
    void syntheticNumbersSurviveEncoding() {
        RecordCodec codec = new RecordCodec(FieldLayouts.cordata());
        Entity template = Entity.builder().name("LARGE EXTRACT ROW").build();

        String first = codec.decode(codec.encode(template.toBuilder()
                .documentNumber(CsvRegistryImporter.syntheticDocumentNumber(100_000)).build())).getDocumentNumber();
        String second = codec.decode(codec.encode(template.toBuilder()
                .documentNumber(CsvRegistryImporter.syntheticDocumentNumber(100_001)).build())).getDocumentNumber();

        assertThat(first).isEqualTo("M00000100000");
        assertThat(second).isEqualTo("M00000100001");
    }
}

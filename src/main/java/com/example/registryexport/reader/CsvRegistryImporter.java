package com.example.registryexport.reader;

import com.example.registryexport.model.Entity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.item.file.FlatFileItemReader;
import org.springframework.batch.item.file.FlatFileParseException;
import org.springframework.batch.item.file.builder.FlatFileItemReaderBuilder;
import org.springframework.batch.item.file.transform.DelimitedLineTokenizer;
import org.springframework.core.io.FileSystemResource;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads a local CSV registry extract (header row first) into entities.
 * Rows that cannot be mapped are logged and skipped. Rows without a document
 * number get {@code M} followed by their zero-padded position in the
 * imported list, which always fits the 12-column document number.
 */
@Slf4j
public class CsvRegistryImporter {

    private static final String SYNTHETIC_FORMAT = "M%011d";

    public List<Entity> importFile(Path csv) throws Exception {
        DelimitedLineTokenizer tokenizer = new DelimitedLineTokenizer();
        tokenizer.setStrict(false);

        FlatFileItemReader<Entity> reader = new FlatFileItemReaderBuilder<Entity>()
                .name("csvRegistryReader")
                .resource(new FileSystemResource(csv))
                .encoding("UTF-8")
                .linesToSkip(1)
                .skippedLinesCallback(header -> tokenizer.setNames(headerNames(header)))
                .lineTokenizer(tokenizer)
                .fieldSetMapper(new CsvEntityFieldSetMapper())
                .build();

        List<Entity> entities = new ArrayList<>();
        int skipped = 0;
        reader.open(new ExecutionContext());
        try {
            while (true) {
                Entity entity;
                try {
                    entity = reader.read();
                } catch (FlatFileParseException e) {
                    skipped++;
                    log.warn("Skipping CSV line {} of {}: {}", e.getLineNumber(), csv, e.getMessage());
                    continue;
                }
                if (entity == null) {
                    break;
                }
                if (!entity.hasDocumentNumber()) {
                    entity = entity.toBuilder().documentNumber(syntheticDocumentNumber(entities.size())).build();
                }
                entities.add(entity);
            }
        } finally {
            reader.close();
        }
        log.info("Imported {} entities from {} ({} rows skipped)", entities.size(), csv, skipped);
        return entities;
    }

    static String syntheticDocumentNumber(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("row index must not be negative, was " + index);
        }
        return String.format(SYNTHETIC_FORMAT, index);
    }

    private static String[] headerNames(String header) {
        // spreadsheet exports often start with a byte order mark
        String line = header.startsWith("\uFEFF") ? header.substring(1) : header;
        String[] names = new DelimitedLineTokenizer().tokenize(line).getValues();
        for (int i = 0; i < names.length; i++) {
            names[i] = names[i].trim().toLowerCase(Locale.ROOT);
        }
        return names;
    }
}

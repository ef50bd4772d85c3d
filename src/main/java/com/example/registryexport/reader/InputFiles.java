package com.example.registryexport.reader;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

public final class InputFiles {

    // cordata2.txt before cordata10.txt
    private static final Comparator<Path> SEGMENT_ORDER = Comparator
            .comparingInt((Path p) -> p.getFileName().toString().length())
            .thenComparing(p -> p.getFileName().toString());

    private InputFiles() {
    }

    /** Regular files in {@code directory} matching {@code glob}, in segment order. */
    public static List<Path> list(Path directory, String glob) throws IOException {
        List<Path> files = new ArrayList<>();
        if (!Files.isDirectory(directory)) {
            return files;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, glob)) {
            for (Path path : stream) {
                if (Files.isRegularFile(path)) {
                    files.add(path);
                }
            }
        }
        files.sort(SEGMENT_ORDER);
        return files;
    }
}

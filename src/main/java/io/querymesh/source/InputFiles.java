package io.querymesh.source;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

public final class InputFiles {
    private InputFiles() {
    }

    /**
     * A single file is returned as is. A directory yields its direct children the reader supports,
     * sorted by name.
     */
    public static List<Path> discover(Path source, QueryFileReader reader) throws IOException {
        if (Files.isRegularFile(source)) {
            return List.of(source.toAbsolutePath().normalize());
        }
        if (!Files.isDirectory(source)) {
            throw new IOException("Input path does not exist: " + source);
        }
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(source)) {
            for (Path path : stream) {
                if (Files.isRegularFile(path) && reader.supports(path)) {
                    files.add(path.toAbsolutePath().normalize());
                }
            }
        }
        files.sort(Comparator.comparing(path -> path.getFileName().toString()));
        return files;
    }
}

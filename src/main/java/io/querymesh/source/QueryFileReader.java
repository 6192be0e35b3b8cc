package io.querymesh.source;

import java.io.IOException;
import java.nio.file.Path;
import java.util.function.Consumer;

/**
 * Reads the query corpus of one input file.
 */
public interface QueryFileReader {
    boolean supports(Path file);

    /**
     * Streams every row of {@code file} to {@code sink} in file order.
     *
     * @throws IOException if the file is missing, unreadable or malformed
     */
    void read(Path file, String queryColumn, Consumer<QueryRow> sink) throws IOException;
}

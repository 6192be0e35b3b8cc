package io.querymesh.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.querymesh.util.Jsons;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * One JSON object per line. Blank lines are skipped; any other line that is not a JSON object
 * makes the whole file unreadable.
 */
public final class JsonLinesQueryFileReader implements QueryFileReader {
    public static final String EXTENSION = ".jsonl";

    @Override
    public boolean supports(Path file) {
        return file.getFileName().toString().toLowerCase().endsWith(EXTENSION);
    }

    @Override
    public void read(Path file, String queryColumn, Consumer<QueryRow> sink) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            long lineNo = 0L;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                if (line.isBlank()) {
                    continue;
                }
                JsonNode node;
                try {
                    node = Jsons.mapper().readTree(line);
                } catch (JsonProcessingException e) {
                    throw new IOException("Malformed JSON at " + file + ":" + lineNo, e);
                }
                if (node == null || !node.isObject()) {
                    throw new IOException("Expected a JSON object at " + file + ":" + lineNo);
                }
                sink.accept(toRow(node, queryColumn));
            }
        }
    }

    private QueryRow toRow(JsonNode node, String queryColumn) {
        Map<String, String> columns = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value == null || value.isNull()) {
                continue;
            }
            columns.put(field.getKey(), value.isValueNode() ? value.asText() : value.toString());
        }
        return new QueryRow(columns.get(queryColumn), columns);
    }
}

package de.htwsaar.datalinker.datalink.tap;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Spalten-Metadaten des TAP-Schemas aus YAML-Dateien, beim ersten Zugriff geladen und danach gecacht.
 *
 * <p>Format je Datei: {@code tables: {<schema.table>: {tap:principal: [...], lsst:minimal: [...]}}}.
 * Mehrere Dateien dürfen dieselbe Tabelle beschreiben; die Einträge werden zusammengeführt.</p>
 */
public class TapColumnMetadata {

    private static final Logger log = LoggerFactory.getLogger(TapColumnMetadata.class);

    private final Path metadataDir;
    private final ObjectMapper yaml = new ObjectMapper(new YAMLFactory());

    private volatile Map<String, Map<String, List<String>>> columns;

    /**
     * @param metadataDir Verzeichnis mit {@code *.yaml}-Dateien, {@code null} für "keine Metadaten"
     */
    public TapColumnMetadata(Path metadataDir) {
        this.metadataDir = metadataDir;
    }

    /**
     * @param table     voll qualifizierter Tabellenname
     * @param columnSet Schlüssel der Spaltenliste (z. B. {@code tap:principal})
     * @return Spalten, leer wenn unbekannt
     */
    public List<String> columns(String table, String columnSet) {
        return load().getOrDefault(table, Map.of()).getOrDefault(columnSet, List.of());
    }

    private Map<String, Map<String, List<String>>> load() {
        Map<String, Map<String, List<String>>> current = columns;
        if (current == null) {
            synchronized (this) {
                if (columns == null) {
                    columns = readAll();
                }
                current = columns;
            }
        }
        return current;
    }

    private Map<String, Map<String, List<String>>> readAll() {
        if (metadataDir == null || !Files.isDirectory(metadataDir)) {
            return Map.of();
        }
        Map<String, Map<String, List<String>>> result = new LinkedHashMap<>();
        try (Stream<Path> files = Files.list(metadataDir)) {
            List<Path> yamlFiles = files.filter(p -> p.getFileName().toString().endsWith(".yaml"))
                    .sorted()
                    .toList();
            for (Path file : yamlFiles) {
                mergeFile(file, result);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read TAP metadata from " + metadataDir, e);
        }
        log.info("Loaded TAP column metadata for {} tables from {}", result.size(), metadataDir);
        return Collections.unmodifiableMap(result);
    }

    private void mergeFile(Path file, Map<String, Map<String, List<String>>> into) throws IOException {
        JsonNode tables = yaml.readTree(file.toFile()).path("tables");
        Iterator<Map.Entry<String, JsonNode>> it = tables.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> table = it.next();
            Map<String, List<String>> sets = into.computeIfAbsent(table.getKey(), k -> new LinkedHashMap<>());
            Iterator<Map.Entry<String, JsonNode>> setIt = table.getValue().fields();
            while (setIt.hasNext()) {
                Map.Entry<String, JsonNode> set = setIt.next();
                List<String> cols = new ArrayList<>();
                set.getValue().forEach(c -> cols.add(c.asText()));
                sets.put(set.getKey(), List.copyOf(cols));
            }
        }
    }
}

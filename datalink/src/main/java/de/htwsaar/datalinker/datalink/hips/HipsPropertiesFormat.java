package de.htwsaar.datalinker.datalink.hips;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Lesen und Schreiben des HiPS-{@code properties}-Formats ({@code key = value}, eine Zeile pro Eintrag).
 */
public final class HipsPropertiesFormat {

    /** Pflichtfeld der HiPS-Liste, das unsere properties-Dateien nicht enthalten. */
    public static final String SERVICE_URL_KEY = "hips_service_url";

    static final String STATUS_KEY = "hips_status";

    private HipsPropertiesFormat() {}

    /**
     * Parst eine properties-Datei. Leerzeilen und {@code #}-Kommentare werden ignoriert,
     * bei doppelten Schlüsseln gewinnt der letzte Wert.
     *
     * @param text Dateiinhalt
     * @return Schlüssel → Wert in Dateireihenfolge
     */
    public static Map<String, String> parse(String text) {
        Map<String, String> properties = new LinkedHashMap<>();
        if (text == null) return properties;
        for (String line : text.split("\\R")) {
            String trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;
            int eq = trimmed.indexOf('=');
            if (eq <= 0) continue;
            properties.put(trimmed.substring(0, eq).strip(), trimmed.substring(eq + 1).strip());
        }
        return properties;
    }

    /**
     * Fügt die {@code hips_service_url}-Zeile direkt vor {@code hips_status} ein (ohne {@code hips_status}: am Ende).
     * Eine vorhandene Zeile wird ersetzt; Kommentare, Leerzeilen und Ausrichtung der Datei bleiben erhalten.
     *
     * @param text       abgerufene properties-Datei
     * @param serviceUrl URL des HiPS-Baums
     * @return Block mit Service-URL, mit {@code \n} abgeschlossen
     */
    public static String insertServiceUrl(String text, String serviceUrl) {
        String serviceLine = formatLine(SERVICE_URL_KEY, serviceUrl);
        List<String> lines = new ArrayList<>();
        if (text != null && !text.isEmpty()) {
            lines.addAll(List.of(text.split("\\R", -1)));
            // split liefert nach dem abschließenden Zeilenumbruch ein leeres Element
            if (lines.get(lines.size() - 1).isEmpty()) lines.remove(lines.size() - 1);
        }
        lines.removeIf(line -> SERVICE_URL_KEY.equals(keyOf(line)));

        int status = -1;
        for (int i = 0; i < lines.size() && status < 0; i++) {
            if (STATUS_KEY.equals(keyOf(lines.get(i)))) status = i;
        }
        lines.add(status < 0 ? lines.size() : status, serviceLine);
        return String.join("\n", lines) + "\n";
    }

    /**
     * Formatiert einen Properties-Block; Schlüssel werden auf 25 Zeichen ausgerichtet.
     *
     * @param properties Properties in Ausgabereihenfolge
     * @return Block, jede Zeile mit {@code \n} abgeschlossen
     */
    public static String format(Map<String, String> properties) {
        StringBuilder sb = new StringBuilder();
        properties.forEach((key, value) -> sb.append(formatLine(key, value)).append('\n'));
        return sb.toString();
    }

    /** Auch Schlüssel ab 25 Zeichen behalten ein Leerzeichen vor dem {@code =}. */
    static String formatLine(String key, String value) {
        return String.format("%-24s = %s", key, value);
    }

    private static String keyOf(String line) {
        String trimmed = line.strip();
        if (trimmed.isEmpty() || trimmed.startsWith("#")) return null;
        int eq = trimmed.indexOf('=');
        return eq <= 0 ? null : trimmed.substring(0, eq).strip();
    }

    /**
     * Die HiPS-Liste ist die Verkettung aller Properties-Blöcke (im abgerufenen Wortlaut), getrennt durch Leerzeilen.
     *
     * @param entries Einträge in Ausgabereihenfolge
     * @return HiPS-Liste als Text
     */
    public static String formatList(Collection<CollectionListEntry> entries) {
        return entries.stream().map(CollectionListEntry::text).collect(Collectors.joining("\n"));
    }
}

package de.htwsaar.datalinker.datalink.identifier;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parst und klassifiziert opake Identifier.
 *
 * <p>Reine Funktion über dem String, ohne Backend-Zugriff. Erkannte Formen:</p>
 * <ul>
 *   <li>{@code butler://<label>/<uuid>} – Bild in einem Butler-Repository</li>
 *   <li>{@code img:<token>} – Bild</li>
 *   <li>{@code row:<schema.table>:<rowId>} – Katalogzeile</li>
 * </ul>
 * Jedes andere {@code scheme:rest} ist {@link IdentifierKind#UNKNOWN}; ohne Schema ist der Identifier ungültig.
 */
public class IdentifierResolver {

    /** Obergrenze für die Gesamtlänge. */
    public static final int MAX_LENGTH = 2048;

    private static final Pattern SCHEME = Pattern.compile("^([A-Za-z][A-Za-z0-9+.-]*):(.+)$");
    private static final Pattern BUTLER = Pattern.compile("^butler://([A-Za-z0-9_.-]+)/([a-f0-9-]+)$");
    private static final Pattern UUID_SHAPE =
            Pattern.compile("^[a-f0-9]{8}-[a-f0-9]{4}-[a-f0-9]{4}-[a-f0-9]{4}-[a-f0-9]{12}$");
    private static final Pattern IMAGE_TOKEN = Pattern.compile("^[A-Za-z0-9_.-]{1,256}$");
    private static final Pattern CATALOG_ROW = Pattern.compile("^([A-Za-z0-9_]+\\.)?([A-Za-z0-9_]+):([0-9]{1,20})$");

    /**
     * Bestimmt nur die Art eines Identifiers.
     *
     * @param identifier roher Identifier
     * @return erkannte Art
     * @throws InvalidIdentifierException wenn der Identifier strukturell ungültig ist
     */
    public IdentifierKind classify(String identifier) {
        return parse(identifier).kind();
    }

    /**
     * Parst einen Identifier vollständig.
     *
     * @param identifier roher Identifier
     * @return geparster {@link Identifier}
     * @throws InvalidIdentifierException wenn der Identifier strukturell ungültig ist
     */
    public Identifier parse(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new InvalidIdentifierException(String.valueOf(identifier), "identifier is empty");
        }
        if (identifier.length() > MAX_LENGTH) {
            throw new InvalidIdentifierException(
                    identifier.substring(0, 64) + "...", "identifier longer than " + MAX_LENGTH + " characters");
        }
        for (int i = 0; i < identifier.length(); i++) {
            char c = identifier.charAt(i);
            if (Character.isWhitespace(c) || Character.isISOControl(c) || "<>\"{}|\\^`".indexOf(c) >= 0) {
                throw new InvalidIdentifierException(identifier, "disallowed character at position " + i);
            }
        }

        Matcher scheme = SCHEME.matcher(identifier);
        if (!scheme.matches()) {
            throw new InvalidIdentifierException(identifier, "missing scheme");
        }
        String name = scheme.group(1).toLowerCase(Locale.ROOT);
        String rest = scheme.group(2);

        return switch (name) {
            case "butler" -> parseButler(identifier);
            case "img" -> parseImage(identifier, rest);
            case "row" -> parseCatalogRow(identifier, rest);
            default -> new Identifier(identifier, IdentifierKind.UNKNOWN, name, null, rest);
        };
    }

    /**
     * Parst einen Identifier und verlangt eine der angegebenen Arten.
     *
     * @param identifier roher Identifier
     * @param accepted   zulässige Arten
     * @return geparster {@link Identifier}
     * @throws InvalidIdentifierException bei ungültiger Struktur oder nicht zulässiger Art
     */
    public Identifier require(String identifier, Set<IdentifierKind> accepted) {
        Identifier parsed = parse(identifier);
        if (!accepted.contains(parsed.kind())) {
            throw new InvalidIdentifierException(identifier, "unsupported identifier kind " + parsed.kind());
        }
        return parsed;
    }

    /** Alle Arten, für die Links erzeugt werden können. */
    public static Set<IdentifierKind> linkableKinds() {
        return EnumSet.of(IdentifierKind.IMAGE, IdentifierKind.CATALOG_ROW);
    }

    private static Identifier parseButler(String identifier) {
        Matcher m = BUTLER.matcher(identifier);
        if (!m.matches()) {
            throw new InvalidIdentifierException(identifier, "expected butler://<label>/<uuid>");
        }
        if (!UUID_SHAPE.matcher(m.group(2)).matches()) {
            throw new InvalidIdentifierException(identifier, "bad or missing UUID");
        }
        return new Identifier(identifier, IdentifierKind.IMAGE, "butler", m.group(1), m.group(2));
    }

    private static Identifier parseImage(String identifier, String rest) {
        if (!IMAGE_TOKEN.matcher(rest).matches()) {
            throw new InvalidIdentifierException(identifier, "invalid image token");
        }
        return new Identifier(identifier, IdentifierKind.IMAGE, "img", null, rest);
    }

    private static Identifier parseCatalogRow(String identifier, String rest) {
        Matcher m = CATALOG_ROW.matcher(rest);
        if (!m.matches()) {
            throw new InvalidIdentifierException(identifier, "expected row:<schema.table>:<rowId>");
        }
        String table = m.group(1) != null ? m.group(1) + m.group(2) : m.group(2);
        return new Identifier(identifier, IdentifierKind.CATALOG_ROW, "row", table, m.group(3));
    }
}

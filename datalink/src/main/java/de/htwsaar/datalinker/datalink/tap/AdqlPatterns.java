package de.htwsaar.datalinker.datalink.tap;

import java.util.regex.Pattern;

/**
 * Zulässige Formen von ADQL-Bezeichnern in Redirect-Parametern (verhindert SQL-Injection).
 */
public final class AdqlPatterns {

    /** Tabelle mit optionalem Schema-Präfix. */
    public static final Pattern COMPOUND_TABLE = Pattern.compile("^([a-zA-Z0-9_]+\\.)?[a-zA-Z0-9_.]+$");

    /** Spalte einer fremden Tabelle: {@code [schema.]table.column}. */
    public static final Pattern FOREIGN_COLUMN = Pattern.compile("^([a-zA-Z0-9_]+\\.){1,2}[a-zA-Z0-9_]+$");

    /** Einfacher Bezeichner. */
    public static final Pattern IDENTIFIER = Pattern.compile("^[a-zA-Z0-9_]+$");

    private AdqlPatterns() {}
}

package de.htwsaar.datalinker.datalink.link;

/**
 * Kontrolliertes Vokabular für die Spalte {@code semantics}
 * (IVOA DataLink core vocabulary).
 */
public final class Semantics {

    /** Das primäre Datenobjekt selbst. */
    public static final String THIS = "#this";

    /** Ausschnitt (SODA-Cutout) des primären Objekts. */
    public static final String CUTOUT = "#cutout";

    private Semantics() {}
}

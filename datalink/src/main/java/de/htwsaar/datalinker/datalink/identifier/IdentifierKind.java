package de.htwsaar.datalinker.datalink.identifier;

/**
 * Geschlossene Menge der Identifier-Arten.
 *
 * <p>{@link #UNKNOWN} bedeutet: syntaktisch gültig ({@code scheme:rest}), aber kein bekanntes Schema.</p>
 */
public enum IdentifierKind {
    IMAGE,
    CATALOG_ROW,
    UNKNOWN
}

package de.htwsaar.datalinker.datalink.tap;

import java.util.Locale;

/**
 * Abstraktes Filterband zur Einschränkung einer Zeitreihen-Abfrage.
 */
public enum Band {
    ALL,
    U,
    G,
    R,
    I,
    Z,
    Y;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @param value Parameterwert ({@code all}, {@code u}, …), Groß-/Kleinschreibung egal
     * @return Band
     * @throws IllegalArgumentException bei unbekanntem Wert
     */
    public static Band parse(String value) {
        return Band.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

package de.htwsaar.datalinker.datalink.link;

/**
 * Optionale Link-Arten. Die Deklarationsreihenfolge ist die Zeilenreihenfolge der Antwort.
 */
public enum Capability {
    CUTOUT
}

package de.htwsaar.datalinker.datalink.link;

import de.htwsaar.datalinker.datalink.domain.ObjectReference;
import de.htwsaar.datalinker.datalink.identifier.Identifier;

/**
 * Eintrag der Capability-Tabelle: Eignungsprüfung plus Zeilen-Erzeugung für eine optionale Link-Art.
 */
public interface OptionalLinkProvider {

    Capability capability();

    /**
     * @param identifier geparster Identifier
     * @param primary    aufgelöstes Primärobjekt, {@code null} wenn die Auflösung fehlschlug
     * @return {@code true} wenn für diesen Identifier eine Zeile versucht werden soll
     */
    boolean appliesTo(Identifier identifier, ObjectReference primary);

    /**
     * Erzeugt Zeile und ggf. Deskriptor. Backend-Fehler werden als Fehlerzeile zurückgegeben, nie geworfen.
     *
     * @param identifier geparster Identifier
     * @return Zeile plus optionaler Deskriptor
     */
    ProvidedLink provide(Identifier identifier);

    /**
     * @param entry      Tabellenzeile
     * @param descriptor zugehöriger Deskriptor oder {@code null} bei Fehlerzeilen
     */
    record ProvidedLink(LinkEntry entry, ServiceDescriptor descriptor) {}
}

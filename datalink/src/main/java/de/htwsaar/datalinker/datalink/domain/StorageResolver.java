package de.htwsaar.datalinker.datalink.domain;

import de.htwsaar.datalinker.datalink.identifier.Identifier;

/**
 * Port zur Dataset-Registry: löst einen Identifier auf das primäre Datenobjekt auf.
 * Wiederholungsversuche sind Sache der Implementierung, nicht des Aufrufers.
 */
public interface StorageResolver {

    /**
     * @param identifier geparster Identifier
     * @return Referenz auf das Objekt
     * @throws NotFoundException       wenn kein Objekt existiert
     * @throws StorageLookupException  bei sonstigen Backend-Fehlern
     */
    ObjectReference locate(Identifier identifier);
}

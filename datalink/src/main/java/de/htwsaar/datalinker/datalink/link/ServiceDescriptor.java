package de.htwsaar.datalinker.datalink.link;

import java.util.List;
import java.util.Objects;

/**
 * Benannter Service-Deskriptor (VOTable {@code RESOURCE type="meta" utype="adhoc:service"}).
 *
 * @param id          Ressourcen-ID, auf die {@link LinkEntry#serviceDef()} verweist
 * @param standardId  Protokoll-URI (z. B. {@code ivo://ivoa.net/std/SODA#sync-1.0})
 * @param accessUrl   aufgelöster Endpunkt
 * @param inputParams deklarierte Eingabeparameter in fester Reihenfolge
 */
public record ServiceDescriptor(String id, String standardId, String accessUrl, List<ServiceParameter> inputParams) {

    public ServiceDescriptor {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(standardId, "standardId must not be null");
        Objects.requireNonNull(accessUrl, "accessUrl must not be null");
        inputParams = List.copyOf(inputParams);
    }
}

package de.htwsaar.datalinker.datalink.adapter.http;

import de.htwsaar.datalinker.common.serialization.DatalinkSerializationException;
import de.htwsaar.datalinker.common.serialization.JacksonCodec;
import de.htwsaar.datalinker.datalink.domain.NotFoundException;
import de.htwsaar.datalinker.datalink.domain.ObjectReference;
import de.htwsaar.datalinker.datalink.domain.StorageLookupException;
import de.htwsaar.datalinker.datalink.domain.StorageResolver;
import de.htwsaar.datalinker.datalink.identifier.Identifier;
import java.net.URI;
import java.util.Objects;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * HTTP-Adapter zur Dataset-Registry ({@code GET <base>/api/datasets?id=<identifier>}).
 *
 * <p>Enthält alle HTTP-Details; die Link-Logik hängt nur am {@link StorageResolver}-Port.
 * Timeouts kommen aus der Konfiguration des übergebenen {@link RestTemplate}.</p>
 */
public final class HttpDatasetRegistryClient implements StorageResolver {

    private final RestTemplate restTemplate;
    private final URI registryBaseUri;

    public HttpDatasetRegistryClient(RestTemplate restTemplate, URI registryBaseUri) {
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate must not be null");
        this.registryBaseUri = Objects.requireNonNull(registryBaseUri, "registryBaseUri must not be null");
    }

    @Override
    public ObjectReference locate(Identifier identifier) {
        URI uri = lookupUri(identifier);
        ResponseEntity<String> resp;
        try {
            resp = restTemplate.getForEntity(uri, String.class);
        } catch (HttpClientErrorException.NotFound e) {
            throw new NotFoundException("Dataset " + identifier.raw() + " does not exist");
        } catch (RestClientException e) {
            throw new StorageLookupException("Dataset registry request failed: " + e.getMessage(), e);
        }

        String body = resp.getBody();
        if (body == null || body.isBlank()) {
            throw new StorageLookupException("Dataset registry returned an empty response for " + identifier.raw());
        }
        DatasetRecord record;
        try {
            record = JacksonCodec.fromJson(body, DatasetRecord.class);
        } catch (DatalinkSerializationException e) {
            throw new StorageLookupException("Unreadable dataset registry response for " + identifier.raw(), e);
        }
        if (record.uri() == null || record.uri().isBlank()) {
            throw new NotFoundException("Dataset " + identifier.raw() + " has no stored artifact");
        }
        try {
            return new ObjectReference(
                    URI.create(record.uri()), record.size(), record.datasetType(), record.contentType(), record.expiresAt());
        } catch (IllegalArgumentException e) {
            throw new StorageLookupException("Invalid artifact URI from dataset registry: " + record.uri(), e);
        }
    }

    /** Baut die Lookup-URI; der Identifier wird als Query-Parameter kodiert. */
    private URI lookupUri(Identifier identifier) {
        return UriComponentsBuilder.fromUri(registryBaseUri)
                .path("/api/datasets")
                .queryParam("id", "{id}")
                .encode()
                .buildAndExpand(identifier.raw())
                .toUri();
    }
}

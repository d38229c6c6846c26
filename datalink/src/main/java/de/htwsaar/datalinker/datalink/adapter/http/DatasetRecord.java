package de.htwsaar.datalinker.datalink.adapter.http;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;

/**
 * JSON-Antwort der Dataset-Registry für einen Identifier.
 *
 * @param uri         Speicherort des Objekts
 * @param size        Größe in Bytes (optional)
 * @param datasetType Dataset-Typ (optional)
 * @param contentType MIME-Type (optional)
 * @param expiresAt   Ablauf, falls {@code uri} bereits signiert ist (optional)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DatasetRecord(String uri, Long size, String datasetType, String contentType, Instant expiresAt) {}

package de.htwsaar.datalinker.datalink.hips;

import de.htwsaar.datalinker.datalink.domain.DatalinkException;
import java.util.Collection;

/**
 * Angefragter HiPS-Datensatz ist nicht konfiguriert (HTTP 404).
 */
public class UnknownDatasetException extends DatalinkException {

    public UnknownDatasetException(String dataset, Collection<String> available) {
        super("Dataset '" + dataset + "' not configured. Available datasets: " + available);
    }

    public UnknownDatasetException(String message) {
        super(message);
    }
}

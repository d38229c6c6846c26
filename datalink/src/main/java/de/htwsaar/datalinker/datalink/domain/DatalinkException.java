package de.htwsaar.datalinker.datalink.domain;

/**
 * Basis aller fachlichen Exceptions des DataLink-Dienstes.
 */
public class DatalinkException extends RuntimeException {

    public DatalinkException(String message) {
        super(message);
    }

    public DatalinkException(String message, Throwable cause) {
        super(message, cause);
    }
}

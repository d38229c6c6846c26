package de.htwsaar.datalinker.datalink.domain;

/**
 * Für ein Objekt konnte keine signierte URL erzeugt werden.
 */
public class SigningException extends DatalinkException {

    public SigningException(String message) {
        super(message);
    }

    public SigningException(String message, Throwable cause) {
        super(message, cause);
    }
}

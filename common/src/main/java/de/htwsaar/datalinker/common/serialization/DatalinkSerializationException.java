package de.htwsaar.datalinker.common.serialization;

public class DatalinkSerializationException extends RuntimeException {

    public DatalinkSerializationException(String message) {

        super(message);
    }

    public DatalinkSerializationException(String message, Throwable cause) {

        super(message, cause);
    }
}

package de.htwsaar.datalinker.datalink.domain;

public class CutoutUnavailableException extends DatalinkException {

    public CutoutUnavailableException(String message) {
        super(message);
    }
}

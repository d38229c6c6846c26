package de.htwsaar.datalinker.datalink.tap;

import de.htwsaar.datalinker.datalink.domain.DatalinkException;

/**
 * Ungültiger Parameter für eine TAP-Weiterleitung (HTTP 422).
 */
public class TapQueryException extends DatalinkException {

    private final String parameter;

    public TapQueryException(String parameter, String message) {
        super(message);
        this.parameter = parameter;
    }

    public String getParameter() {
        return parameter;
    }
}

package de.htwsaar.datalinker.datalink.link;

/**
 * Standard-Fehlernamen der DataLink-Spalte {@code error_message}.
 */
public enum Fault {
    NOT_FOUND("NotFoundFault"),
    USAGE("UsageFault"),
    TRANSIENT("TransientFault"),
    FATAL("FatalFault"),
    DEFAULT("DefaultFault");

    private final String label;

    Fault(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * @param detail Fehlertext
     * @return {@code <FaultName>: <detail>}
     */
    public String message(String detail) {
        return label + ": " + detail;
    }
}

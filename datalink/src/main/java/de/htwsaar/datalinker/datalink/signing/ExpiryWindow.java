package de.htwsaar.datalinker.datalink.signing;

import java.time.Instant;
import java.util.Optional;

/**
 * Minimaler Ablaufzeitpunkt aller signierten URLs einer Antwort.
 *
 * @param minExpiry frühester Ablauf, {@code null} wenn keine Zeile eine ablaufende URL trägt
 */
public record ExpiryWindow(Instant minExpiry) {

    private static final ExpiryWindow UNSET = new ExpiryWindow(null);

    public static ExpiryWindow unset() {
        return UNSET;
    }

    public boolean isSet() {
        return minExpiry != null;
    }

    public Optional<Instant> expiry() {
        return Optional.ofNullable(minExpiry);
    }

    /**
     * @param expiry weiterer Ablaufzeitpunkt oder {@code null}
     * @return Fenster mit dem früheren der beiden Zeitpunkte
     */
    public ExpiryWindow include(Instant expiry) {
        if (expiry == null) return this;
        if (minExpiry == null || expiry.isBefore(minExpiry)) return new ExpiryWindow(expiry);
        return this;
    }
}

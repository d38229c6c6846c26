package de.htwsaar.datalinker.datalink.hips;

/**
 * Zustände einer Collection-Liste: {@code EMPTY → FRESH → STALE → REFRESHING → FRESH|STALE}.
 */
public enum CacheState {
    EMPTY,
    FRESH,
    STALE,
    REFRESHING
}

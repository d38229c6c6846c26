package de.htwsaar.datalinker.datalink.web;

/**
 * Selbstbeschreibung des Dienstes.
 */
public record ServiceMetadata(
        String name, String version, String description, String repositoryUrl, String documentationUrl) {}

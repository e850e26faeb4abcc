package org.learningjava.ees.domain.service;

public final class ModelNames {

    /** "nomic-embed-text:latest" -> "nomic-embed-text", "llama3.1:8b" -> "llama3.1". */
    public static String stripTag(String name) {
        if (name == null) return null;
        int idx = name.lastIndexOf(':');
        // a colon followed by a path belongs to a registry host:port, not a tag
        if (idx <= 0 || name.indexOf('/', idx) >= 0) return name;
        return name.substring(0, idx);
    }

    /** Picks the first non-blank of request model, configured default, fallback. */
    public static String resolve(String requested, String configured, String fallback) {
        if (requested != null && !requested.isBlank()) return requested;
        if (configured != null && !configured.isBlank()) return configured;
        return fallback;
    }

    private ModelNames() {}
}

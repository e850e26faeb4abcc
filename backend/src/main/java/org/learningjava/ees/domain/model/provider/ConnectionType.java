package org.learningjava.ees.domain.model.provider;

import java.util.Arrays;
import java.util.Optional;

/** Backend kinds a connection can point at. The tag is what gets persisted. */
public enum ConnectionType {
    OLLAMA("ollama"),
    OPENAI_COMPATIBLE("openai-compatible");

    private final String tag;

    ConnectionType(String tag) {
        this.tag = tag;
    }

    public String tag() { return tag; }

    public static Optional<ConnectionType> fromTag(String tag) {
        if (tag == null) return Optional.empty();
        String t = tag.trim();
        return Arrays.stream(values()).filter(v -> v.tag.equals(t)).findFirst();
    }

    @Override
    public String toString() { return tag; }
}

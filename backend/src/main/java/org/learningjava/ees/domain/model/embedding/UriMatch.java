package org.learningjava.ees.domain.model.embedding;

/** How the uri filter of a listing is applied. */
public enum UriMatch {
    EXACT,
    PREFIX
}

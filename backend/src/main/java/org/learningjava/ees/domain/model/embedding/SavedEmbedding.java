package org.learningjava.ees.domain.model.embedding;

/** Summary handed back after creating or upserting an embedding. */
public record SavedEmbedding(long id, String uri, String modelName) {}

package org.learningjava.ees.domain.model.provider;

/**
 * Descriptive metadata about an embedding model. Only {@code name} and {@code provider} are
 * guaranteed; the rest depends on what the backend reports.
 *
 * @param name          normalized name, used for availability checks
 * @param fullName      name as the backend spells it (e.g. with an Ollama {@code :tag}), nullable
 * @param provider      type tag of the provider offering the model
 * @param dimensions    vector length, nullable
 * @param maxTokens     max input tokens, nullable
 * @param pricePerToken nullable
 */
public record ModelInfo(
        String name,
        String fullName,
        String provider,
        Integer dimensions,
        Integer maxTokens,
        Double pricePerToken
) {
    public static ModelInfo of(String name, String provider) {
        return new ModelInfo(name, name, provider, null, null, null);
    }
}

package org.learningjava.ees.domain.model.batch;

/** One input of a batch. {@code modelName} overrides the batch-wide model when set. */
public record BatchItem(String uri, String text, String modelName) {

    public BatchItem(String uri, String text) {
        this(uri, text, null);
    }
}

package org.learningjava.ees.domain.model.batch;

/**
 * @param preserveOriginal keep the source rows after re-embedding
 * @param continueOnError  keep going after a failed record instead of stopping
 * @param pageSize         rows fetched per round trip
 */
public record MigrationOptions(boolean preserveOriginal, boolean continueOnError, int pageSize) {

    public MigrationOptions {
        pageSize = pageSize <= 0 ? 50 : Math.min(pageSize, 100);
    }

    public static MigrationOptions defaults() {
        return new MigrationOptions(true, true, 50);
    }
}

package com.fintech.marketdata.backup;

import java.io.IOException;

/**
 * Durable object storage for series backups.
 */
public interface BlobStore {

    /**
     * Writes {@code content} under {@code name}, replacing any existing blob with that name.
     *
     * @param name Blob name, e.g. {@code AAPL.csv.gz}
     * @param content Complete blob body
     * @throws IOException if the write does not complete
     */
    void writeBlob(String name, byte[] content) throws IOException;

    /**
     * Short description of the target for log lines, e.g. the container or directory.
     */
    String describe();
}

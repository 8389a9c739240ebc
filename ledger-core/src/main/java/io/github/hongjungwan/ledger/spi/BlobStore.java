package io.github.hongjungwan.ledger.spi;

import java.util.Map;

/**
 * SPI for encrypted content storage.
 *
 * <h2>Built-in Implementations:</h2>
 * <ul>
 *   <li>S3BlobStore - Amazon S3 with user metadata as attributes</li>
 *   <li>FileSystemBlobStore - local directory with attribute sidecar files</li>
 *   <li>InMemoryBlobStore - tests</li>
 * </ul>
 */
public interface BlobStore {

    /**
     * Store bytes under a name. Overwrites an existing blob.
     *
     * @throws io.github.hongjungwan.ledger.api.exception.StorageWriteException on failure
     */
    void put(String name, byte[] content, Map<String, String> attributes);

    /**
     * Load bytes and attributes.
     *
     * @throws io.github.hongjungwan.ledger.api.exception.BlobNotFoundException if absent
     * @throws io.github.hongjungwan.ledger.api.exception.StorageReadException on failure
     */
    StoredBlob get(String name);

    boolean exists(String name);

    /**
     * Re-establish the underlying client or session. Called once before the
     * upload retry.
     */
    default void reconnect() {
    }

    /**
     * Get the provider name.
     */
    String getName();
}

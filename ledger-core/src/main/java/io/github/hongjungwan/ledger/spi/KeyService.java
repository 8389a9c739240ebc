package io.github.hongjungwan.ledger.spi;

/**
 * SPI for an external key-management service.
 *
 * <p>Implementations are synchronous and fail closed: any error is raised as a
 * {@link io.github.hongjungwan.ledger.api.exception.LedgerException}, never
 * returned as corrupted output.</p>
 *
 * <h2>Built-in Implementations:</h2>
 * <ul>
 *   <li>AwsKmsKeyService - AWS KMS Encrypt/Decrypt/Sign/Verify</li>
 *   <li>LocalKeyService - in-process keys for development and tests</li>
 * </ul>
 */
public interface KeyService {

    /**
     * Wrap (encrypt) a small secret such as a data key.
     *
     * @param keyRef key encryption key reference
     * @param plaintext secret bytes
     * @return wrapped bytes
     */
    byte[] wrapKey(String keyRef, byte[] plaintext);

    /**
     * Unwrap a secret previously produced by {@link #wrapKey}.
     */
    byte[] unwrapKey(String keyRef, byte[] ciphertext);

    /**
     * Sign a precomputed SHA-256 digest.
     *
     * @param keyVersionRef signing key (version) reference
     * @param digest 32-byte SHA-256 digest
     * @return signature bytes
     */
    byte[] sign(String keyVersionRef, byte[] digest);

    /**
     * Verify a signature over a precomputed SHA-256 digest.
     */
    boolean verify(String keyVersionRef, byte[] digest, byte[] signature);

    /**
     * Get the provider name.
     */
    String getName();
}

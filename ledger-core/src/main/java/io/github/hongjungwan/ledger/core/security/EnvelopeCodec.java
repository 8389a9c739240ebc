package io.github.hongjungwan.ledger.core.security;

import io.github.hongjungwan.ledger.api.config.LedgerConfig;
import io.github.hongjungwan.ledger.api.domain.DocumentMetadata;
import io.github.hongjungwan.ledger.api.domain.EncryptedDocument;
import io.github.hongjungwan.ledger.api.domain.EnvelopeMetadata;
import io.github.hongjungwan.ledger.api.exception.BlobNotFoundException;
import io.github.hongjungwan.ledger.api.exception.DecryptionException;
import io.github.hongjungwan.ledger.api.exception.KeyUnwrapException;
import io.github.hongjungwan.ledger.api.exception.KeyWrapException;
import io.github.hongjungwan.ledger.api.exception.LedgerException;
import io.github.hongjungwan.ledger.api.exception.OperationTimeoutException;
import io.github.hongjungwan.ledger.api.exception.StorageWriteException;
import io.github.hongjungwan.ledger.core.resilience.RetryPolicy;
import io.github.hongjungwan.ledger.spi.BlobStore;
import io.github.hongjungwan.ledger.spi.KeyService;
import io.github.hongjungwan.ledger.spi.StoredBlob;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.jce.provider.BouncyCastleProvider;

import javax.crypto.Cipher;
import javax.crypto.KeyGenerator;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import javax.security.auth.DestroyFailedException;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.Security;
import java.time.Clock;
import java.util.Arrays;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * 문서 봉투 암호화(DEK + KEK). 문서마다 새 DEK를 만들고 DEK만 키 서비스로 래핑.
 * 키 서비스 호출은 문서 크기와 무관하게 32바이트 키 하나로 제한됨.
 */
@Slf4j
public class EnvelopeCodec {

    public static final String ALGORITHM_TAG = "AES-256-GCM+KMS";
    public static final String ENVELOPE_MARKER = "LEDGER_envelope_encryption";

    public static final String ATTR_ORIGINAL_FILENAME = "original_filename";
    public static final String ATTR_FILE_TYPE = "file_type";
    public static final String ATTR_USER_ID = "user_id";
    public static final String ATTR_ENCRYPTED_WITH = "encrypted_with";
    public static final String ATTR_KEY_NAME = "kms_key_name";
    public static final String ATTR_ORIGINAL_SIZE = "original_size";
    public static final String ATTR_ENCRYPTED_SIZE = "encrypted_size";
    public static final String ATTR_WRAPPED_KEY = "envelope_metadata";
    public static final String ATTR_ALGORITHM = "encryption_algorithm";

    private static final String ALGORITHM = "AES";
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int GCM_TAG_LENGTH = 128;
    private static final int GCM_IV_LENGTH = 12;
    private static final int KEY_SIZE = 256;
    private static final String BLOB_PREFIX = "encrypted/";
    private static final String BLOB_SUFFIX = ".enc";

    private final LedgerConfig config;
    private final KeyService keyService;
    private final BlobStore blobStore;
    private final RetryPolicy uploadRetry;
    private final SecureRandom secureRandom;
    private final Clock clock;

    static {
        Security.addProvider(new BouncyCastleProvider());
    }

    public EnvelopeCodec(LedgerConfig config, KeyService keyService, BlobStore blobStore) {
        this(config, keyService, blobStore, Clock.systemUTC());
    }

    public EnvelopeCodec(LedgerConfig config, KeyService keyService, BlobStore blobStore, Clock clock) {
        this.config = config;
        this.keyService = keyService;
        this.blobStore = blobStore;
        this.clock = clock;
        this.secureRandom = new SecureRandom();
        this.uploadRetry = RetryPolicy.builder()
                .maxAttempts(config.getUploadMaxAttempts())
                .fixedDelay(java.time.Duration.ZERO)
                .retryOnExceptions(StorageWriteException.class, OperationTimeoutException.class)
                .beforeRetry(e -> {
                    log.info("Reconnecting blob store '{}' before upload retry", blobStore.getName());
                    blobStore.reconnect();
                })
                .build();
    }

    /**
     * 문서 암호화 후 Blob 저장소에 업로드. 원장에는 아무것도 기록하지 않음.
     */
    public EncryptedDocument encrypt(byte[] content, DocumentMetadata metadata) {
        if (content == null) {
            throw new IllegalArgumentException("Cannot encrypt null content");
        }
        DocumentMetadata meta = metadata == null ? DocumentMetadata.empty() : metadata;
        String keyRef = config.getEncryptionKeyRef();

        log.info("Encrypting document: size={} bytes, user={}", content.length, meta.getUserId());

        SecretKey dek = generateDek();
        byte[] ciphertext;
        byte[] wrappedKey;
        try {
            ciphertext = encryptWithDek(content, dek);
            wrappedKey = wrapDek(keyRef, dek);
        } finally {
            destroyKey(dek);
        }

        String blobName = BLOB_PREFIX + UUID.randomUUID() + BLOB_SUFFIX;
        Map<String, String> attributes = blobAttributes(meta, keyRef, content.length, ciphertext.length, wrappedKey);

        upload(blobName, ciphertext, attributes);

        EnvelopeMetadata envelope = EnvelopeMetadata.builder()
                .wrappedKey(wrappedKey)
                .keyRef(keyRef)
                .algorithm(ALGORITHM_TAG)
                .originalSize(content.length)
                .encryptedSize(ciphertext.length)
                .encryptedAt(clock.instant())
                .build();

        log.info("Document encrypted: blob={}, {} bytes -> {} bytes", blobName, content.length, ciphertext.length);
        return new EncryptedDocument(blobName, envelope);
    }

    /**
     * Blob을 읽어 복호화. 봉투 형식이 아니면 키 서비스 직접 암호화(레거시)로 처리.
     */
    public byte[] decrypt(String blobName) {
        if (!blobStore.exists(blobName)) {
            throw new BlobNotFoundException(blobName);
        }

        StoredBlob blob = blobStore.get(blobName);
        String keyRef = blob.attributes().getOrDefault(ATTR_KEY_NAME, config.getEncryptionKeyRef());

        if (ENVELOPE_MARKER.equals(blob.attribute(ATTR_ENCRYPTED_WITH))) {
            log.debug("Detected envelope encryption: {}", blobName);
            SecretKey dek = unwrapDek(keyRef, decodeWrappedKey(blob, blobName));
            try {
                byte[] plaintext = decryptWithDek(blob.content(), dek);
                log.info("Document decrypted: blob={}, size={} bytes", blobName, plaintext.length);
                return plaintext;
            } finally {
                destroyKey(dek);
            }
        }

        log.info("Using legacy direct decryption: {}", blobName);
        return unwrap(keyRef, blob.content());
    }

    private void upload(String blobName, byte[] ciphertext, Map<String, String> attributes) {
        try {
            uploadRetry.execute(() -> blobStore.put(blobName, ciphertext, attributes));
        } catch (RetryPolicy.RetryExhaustedException e) {
            Throwable cause = e.getCause();
            log.error("Upload failed after {} attempt(s): blob={}", e.getAttempts(), blobName, cause);
            // 타임아웃 등 구분되는 오류는 그대로 전달
            if (cause instanceof LedgerException ledgerException && !(cause instanceof StorageWriteException)) {
                throw ledgerException;
            }
            throw new StorageWriteException("Failed to upload encrypted blob: " + blobName, cause);
        }
    }

    private Map<String, String> blobAttributes(DocumentMetadata meta, String keyRef, long originalSize,
                                               long encryptedSize, byte[] wrappedKey) {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put(ATTR_ORIGINAL_FILENAME, meta.getFileName());
        attributes.put(ATTR_FILE_TYPE, meta.getMimeType());
        attributes.put(ATTR_USER_ID, meta.getUserId());
        attributes.put(ATTR_ENCRYPTED_WITH, ENVELOPE_MARKER);
        attributes.put(ATTR_KEY_NAME, keyRef);
        attributes.put(ATTR_ORIGINAL_SIZE, String.valueOf(originalSize));
        attributes.put(ATTR_ENCRYPTED_SIZE, String.valueOf(encryptedSize));
        attributes.put(ATTR_WRAPPED_KEY, Base64.getEncoder().encodeToString(wrappedKey));
        attributes.put(ATTR_ALGORITHM, ALGORITHM_TAG);
        return attributes;
    }

    /** AES-GCM으로 데이터 암호화. IV + 암호문 반환. */
    private byte[] encryptWithDek(byte[] data, SecretKey dek) {
        byte[] iv = new byte[GCM_IV_LENGTH];
        secureRandom.nextBytes(iv);

        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, dek, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            byte[] ciphertext = cipher.doFinal(data);

            byte[] result = new byte[GCM_IV_LENGTH + ciphertext.length];
            System.arraycopy(iv, 0, result, 0, GCM_IV_LENGTH);
            System.arraycopy(ciphertext, 0, result, GCM_IV_LENGTH, ciphertext.length);
            return result;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM encryption unavailable", e);
        }
    }

    /** DEK로 데이터 복호화. */
    private byte[] decryptWithDek(byte[] encryptedData, SecretKey dek) {
        // IV(12) + 태그(16)
        if (encryptedData.length < GCM_IV_LENGTH + GCM_TAG_LENGTH / 8) {
            throw new DecryptionException("Invalid ciphertext: too short (possible corruption)");
        }

        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, dek,
                    new GCMParameterSpec(GCM_TAG_LENGTH, encryptedData, 0, GCM_IV_LENGTH));
            return cipher.doFinal(encryptedData, GCM_IV_LENGTH, encryptedData.length - GCM_IV_LENGTH);
        } catch (GeneralSecurityException e) {
            throw new DecryptionException("Failed to decrypt document payload", e);
        }
    }

    private byte[] wrapDek(String keyRef, SecretKey dek) {
        byte[] rawKey = dek.getEncoded();
        try {
            return keyService.wrapKey(keyRef, rawKey);
        } catch (LedgerException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new KeyWrapException("Failed to wrap data key", e);
        } finally {
            Arrays.fill(rawKey, (byte) 0);
        }
    }

    private SecretKey unwrapDek(String keyRef, byte[] wrappedKey) {
        byte[] rawKey = unwrap(keyRef, wrappedKey);
        try {
            if (rawKey.length != KEY_SIZE / 8) {
                throw new KeyUnwrapException("Unwrapped data key has unexpected length: " + rawKey.length);
            }
            return new SecretKeySpec(rawKey, ALGORITHM);
        } finally {
            Arrays.fill(rawKey, (byte) 0);
        }
    }

    private byte[] unwrap(String keyRef, byte[] ciphertext) {
        try {
            return keyService.unwrapKey(keyRef, ciphertext);
        } catch (LedgerException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new KeyUnwrapException("Failed to unwrap with key service", e);
        }
    }

    private byte[] decodeWrappedKey(StoredBlob blob, String blobName) {
        String encoded = blob.attribute(ATTR_WRAPPED_KEY);
        if (encoded == null || encoded.isEmpty()) {
            throw new DecryptionException("Envelope metadata not found in blob: " + blobName);
        }
        try {
            return Base64.getDecoder().decode(encoded);
        } catch (IllegalArgumentException e) {
            throw new DecryptionException("Envelope metadata is not valid Base64: " + blobName, e);
        }
    }

    /** SecureRandom으로 새 DEK 생성. */
    private SecretKey generateDek() {
        try {
            KeyGenerator keyGen = KeyGenerator.getInstance(ALGORITHM);
            keyGen.init(KEY_SIZE, secureRandom);
            return keyGen.generateKey();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to generate data key", e);
        }
    }

    /**
     * 키 삭제 (best-effort). JVM 한계로 완전 삭제 불가.
     */
    private void destroyKey(SecretKey key) {
        if (!key.isDestroyed()) {
            try {
                key.destroy();
            } catch (DestroyFailedException e) {
                log.trace("Destroyable.destroy() not supported by {}", key.getClass().getSimpleName());
            }
        }
    }
}

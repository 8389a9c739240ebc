package io.github.hongjungwan.ledger.core.internal;

import io.github.hongjungwan.ledger.api.DocumentLedger;
import io.github.hongjungwan.ledger.api.config.LedgerConfig;
import io.github.hongjungwan.ledger.api.domain.AuditTrail;
import io.github.hongjungwan.ledger.api.domain.ChainVerificationReport;
import io.github.hongjungwan.ledger.api.domain.DocumentMetadata;
import io.github.hongjungwan.ledger.api.domain.EncryptedDocument;
import io.github.hongjungwan.ledger.api.domain.HashRecord;
import io.github.hongjungwan.ledger.api.domain.VerificationResult;
import io.github.hongjungwan.ledger.api.domain.VerificationStatus;
import io.github.hongjungwan.ledger.api.exception.LedgerException;
import io.github.hongjungwan.ledger.api.exception.LedgerReadException;
import io.github.hongjungwan.ledger.core.cache.VerificationCache;
import io.github.hongjungwan.ledger.core.chain.ChainVerifier;
import io.github.hongjungwan.ledger.core.chain.HashChainEngine;
import io.github.hongjungwan.ledger.core.digest.DigestEngine;
import io.github.hongjungwan.ledger.core.metrics.LedgerMetrics;
import io.github.hongjungwan.ledger.core.security.EnvelopeCodec;
import io.github.hongjungwan.ledger.spi.KeyService;
import io.github.hongjungwan.ledger.spi.LedgerStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * DocumentLedger 기본 구현. 암호화, 체인 기록, 캐시 검증 구성요소를 조합.
 */
@Slf4j
public class DefaultDocumentLedger implements DocumentLedger, AutoCloseable {

    private final LedgerConfig config;
    private final KeyService keyService;
    private final LedgerStore ledgerStore;
    private final EnvelopeCodec envelopeCodec;
    private final HashChainEngine chainEngine;
    private final ChainVerifier chainVerifier;
    private final VerificationCache cache;
    private final LedgerMetrics metrics;
    private final Clock clock;
    private final AutoCloseable[] closeables;

    public DefaultDocumentLedger(LedgerConfig config, KeyService keyService, LedgerStore ledgerStore,
                                 EnvelopeCodec envelopeCodec, HashChainEngine chainEngine,
                                 ChainVerifier chainVerifier, VerificationCache cache,
                                 LedgerMetrics metrics, Clock clock, AutoCloseable... closeables) {
        this.config = config;
        this.keyService = keyService;
        this.ledgerStore = ledgerStore;
        this.envelopeCodec = envelopeCodec;
        this.chainEngine = chainEngine;
        this.chainVerifier = chainVerifier;
        this.cache = cache;
        this.metrics = metrics;
        this.clock = clock;
        this.closeables = closeables;
    }

    @Override
    public EncryptedDocument storeDocument(byte[] content, DocumentMetadata metadata) {
        try {
            EncryptedDocument document = envelopeCodec.encrypt(content, metadata);
            metrics.recordDocumentStored(content.length);
            return document;
        } catch (LedgerException e) {
            metrics.recordFailure("store", e);
            throw e;
        }
    }

    @Override
    public UUID recordHash(String documentId, byte[] content, String extractedText, String userId,
                           DocumentMetadata metadata) {
        try {
            UUID hashId = chainEngine.createHashRecord(documentId, content, extractedText, userId, metadata);
            metrics.recordHashRecordCreated();
            // 새 레코드가 현재 레코드가 되므로 이전 검증 결과는 무효
            cache.invalidate(documentId);
            return hashId;
        } catch (LedgerException e) {
            metrics.recordFailure("record", e);
            throw e;
        }
    }

    @Override
    public VerificationResult verify(String documentId, byte[] currentContent) {
        if (documentId == null || currentContent == null) {
            throw new IllegalArgumentException("documentId and content are required");
        }
        LedgerMetrics.Timer timer = metrics.startTimer();
        VerificationResult result = doVerify(documentId, currentContent);
        metrics.recordVerification(result.getStatus(), timer.elapsedNanos());
        return result;
    }

    private VerificationResult doVerify(String documentId, byte[] currentContent) {
        try {
            String currentHash = DigestEngine.fileHash(currentContent);
            boolean throttled = cache.isThrottled(documentId);
            // 스로틀 중에도 같은 콘텐츠에 대한 결과만 재사용
            VerificationResult cached = cache.get(documentId, currentHash);
            if (cached != null) {
                metrics.recordCacheHit();
                return cached;
            }
            if (throttled) {
                return VerificationResult.throttled(documentId, clock.instant());
            }
            metrics.recordCacheMiss();

            Optional<HashRecord> latest = ledgerStore.findLatestHashRecord(documentId);
            if (latest.isEmpty()) {
                log.info("No hash record for document {}", documentId);
                VerificationResult notFound = VerificationResult.notFound(documentId, currentHash, clock.instant());
                cache.set(documentId, notFound, currentHash, config.getNotFoundTtl());
                return notFound;
            }

            HashRecord record = latest.get();
            boolean signatureValid = verifySignature(record);
            VerificationResult result;
            Duration ttl;
            if (record.getFileHash().equals(currentHash)) {
                result = VerificationResult.matched(documentId, record, currentHash, signatureValid, clock.instant());
                ttl = config.getVerifiedTtl();
                log.info("Document verified: document={}, hashId={}", documentId, record.getHashId());
            } else {
                result = VerificationResult.tampered(documentId, record, currentHash, signatureValid, clock.instant());
                ttl = config.getTamperedTtl();
                log.warn("Document tampering detected: document={}, expected={}, actual={}",
                        documentId, record.getFileHash(), currentHash);
            }
            cache.set(documentId, result, currentHash, ttl);
            return result;
        } catch (RuntimeException e) {
            log.error("Verification failed for document {}", documentId, e);
            metrics.recordFailure("verify", e);
            return VerificationResult.error(documentId, e.getMessage(), clock.instant());
        }
    }


    /** 레코드 서명 확인. 키 서비스 장애는 검증 실패가 아니라 false로 처리. */
    private boolean verifySignature(HashRecord record) {
        try {
            byte[] digest = DigestEngine.recordSigningDigest(
                    record.getFileHash(), record.getContentHash(), record.getDocumentId());
            return keyService.verify(record.getKeyVersionRef(), digest, record.getSignature());
        } catch (RuntimeException e) {
            log.warn("Signature check unavailable for hashId={}: {}", record.getHashId(), e.getMessage());
            return false;
        }
    }

    @Override
    public AuditTrail auditTrail(String documentId) {
        try {
            return ledgerStore.readSnapshot(snapshot -> AuditTrail.builder()
                    .documentId(documentId)
                    .hashRecords(snapshot.hashRecordsFor(documentId))
                    .chainBlocks(snapshot.latestBlocks(config.getAuditBlockLimit()))
                    .build());
        } catch (LedgerException e) {
            metrics.recordFailure("audit", e);
            throw e;
        } catch (RuntimeException e) {
            metrics.recordFailure("audit", e);
            throw new LedgerReadException("Failed to read audit trail for " + documentId, e);
        }
    }

    @Override
    public byte[] retrieveDocument(String blobName) {
        try {
            byte[] content = envelopeCodec.decrypt(blobName);
            metrics.recordDocumentRetrieved();
            return content;
        } catch (LedgerException e) {
            metrics.recordFailure("retrieve", e);
            throw e;
        }
    }

    @Override
    public ChainVerificationReport verifyChain() {
        return chainVerifier.verifyChain();
    }

    @Override
    public void invalidate(String documentId) {
        cache.invalidate(documentId);
    }

    public LedgerMetrics getMetrics() {
        return metrics;
    }

    public VerificationCache getCache() {
        return cache;
    }

    @Override
    public void close() {
        for (AutoCloseable closeable : closeables) {
            try {
                closeable.close();
            } catch (Exception e) {
                log.warn("Error closing {}: {}", closeable.getClass().getSimpleName(), e.getMessage());
            }
        }
    }
}

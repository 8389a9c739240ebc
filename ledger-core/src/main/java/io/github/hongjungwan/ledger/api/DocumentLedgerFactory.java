package io.github.hongjungwan.ledger.api;

import com.github.benmanes.caffeine.cache.Ticker;
import io.github.hongjungwan.ledger.api.config.LedgerConfig;
import io.github.hongjungwan.ledger.core.cache.VerificationCache;
import io.github.hongjungwan.ledger.core.chain.ChainVerifier;
import io.github.hongjungwan.ledger.core.chain.HashChainEngine;
import io.github.hongjungwan.ledger.core.internal.DefaultDocumentLedger;
import io.github.hongjungwan.ledger.core.metrics.LedgerMetrics;
import io.github.hongjungwan.ledger.core.security.AwsKmsKeyService;
import io.github.hongjungwan.ledger.core.security.EnvelopeCodec;
import io.github.hongjungwan.ledger.core.security.LocalKeyService;
import io.github.hongjungwan.ledger.core.storage.FileLedgerStore;
import io.github.hongjungwan.ledger.core.storage.FileSystemBlobStore;
import io.github.hongjungwan.ledger.core.storage.S3BlobStore;
import io.github.hongjungwan.ledger.spi.BlobStore;
import io.github.hongjungwan.ledger.spi.KeyService;
import io.github.hongjungwan.ledger.spi.LedgerStore;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * DocumentLedger 조립. 지정하지 않은 구성요소는 설정에 따라 기본 구현을 생성.
 */
@Slf4j
public final class DocumentLedgerFactory {

    private DocumentLedgerFactory() {}

    public static Builder builder() {
        return new Builder();
    }

    /** 로컬 키 허용 시 LocalKeyService, 아니면 AWS KMS */
    public static KeyService createKeyService(LedgerConfig config) {
        if (config.isLocalKeysEnabled()) {
            log.warn("Using local key service - NOT for production");
            return config.getKeyDirectory() == null
                    ? new LocalKeyService()
                    : new LocalKeyService(Path.of(config.getKeyDirectory()));
        }
        if (!config.hasKeyRefs()) {
            throw new IllegalStateException("encryptionKeyRef and signingKeyRef are required when local keys are disabled");
        }
        return new AwsKmsKeyService(config);
    }

    /** 버킷 지정 시 S3, 아니면 로컬 디렉토리 */
    public static BlobStore createBlobStore(LedgerConfig config) {
        if (config.getBlobBucket() != null && !config.getBlobBucket().isBlank()) {
            return new S3BlobStore(config);
        }
        return new FileSystemBlobStore(Path.of(config.getBlobDirectory()));
    }

    public static LedgerStore createLedgerStore(LedgerConfig config) {
        return new FileLedgerStore(Path.of(config.getLedgerDirectory()));
    }

    public static class Builder {
        private LedgerConfig config = LedgerConfig.defaultConfig();
        private KeyService keyService;
        private BlobStore blobStore;
        private LedgerStore ledgerStore;
        private VerificationCache cache;
        private LedgerMetrics metrics;
        private Clock clock = Clock.systemUTC();
        private Ticker ticker = Ticker.systemTicker();

        public Builder config(LedgerConfig config) {
            this.config = config;
            return this;
        }

        public Builder keyService(KeyService keyService) {
            this.keyService = keyService;
            return this;
        }

        public Builder blobStore(BlobStore blobStore) {
            this.blobStore = blobStore;
            return this;
        }

        public Builder ledgerStore(LedgerStore ledgerStore) {
            this.ledgerStore = ledgerStore;
            return this;
        }

        public Builder cache(VerificationCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder metrics(LedgerMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /** 캐시 만료와 스로틀에 사용할 시간원 (cache 미지정 시) */
        public Builder ticker(Ticker ticker) {
            this.ticker = ticker;
            return this;
        }

        public DefaultDocumentLedger build() {
            List<AutoCloseable> owned = new ArrayList<>();
            KeyService keys = keyService != null ? keyService : track(createKeyService(config), owned);
            BlobStore blobs = blobStore != null ? blobStore : track(createBlobStore(config), owned);
            LedgerStore ledger = ledgerStore != null ? ledgerStore : createLedgerStore(config);

            return new DefaultDocumentLedger(
                    config,
                    keys,
                    ledger,
                    new EnvelopeCodec(config, keys, blobs, clock),
                    new HashChainEngine(config, ledger, keys, clock),
                    new ChainVerifier(config, ledger, keys),
                    cache != null ? cache : new VerificationCache(config, ticker),
                    metrics != null ? metrics : new LedgerMetrics(),
                    clock,
                    owned.toArray(new AutoCloseable[0]));
        }

        /** 팩토리가 생성한 자원만 close 대상 */
        private static <T> T track(T component, List<AutoCloseable> owned) {
            if (component instanceof AutoCloseable closeable) {
                owned.add(closeable);
            }
            return component;
        }
    }
}

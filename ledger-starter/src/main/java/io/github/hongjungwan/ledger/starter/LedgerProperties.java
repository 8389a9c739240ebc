package io.github.hongjungwan.ledger.starter;

import io.github.hongjungwan.ledger.api.config.LedgerConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Document Ledger 설정 Properties (prefix: document-ledger).
 */
@Data
@ConfigurationProperties(prefix = "document-ledger")
public class LedgerProperties {

    /** 원장 활성화 여부 */
    private boolean enabled = true;

    /** 키 서비스 설정 */
    private KeyProperties keys = new KeyProperties();

    /** 문서 및 원장 저장소 설정 */
    private StorageProperties storage = new StorageProperties();

    /** 검증 캐시 설정 */
    private CacheProperties cache = new CacheProperties();

    /** 감사 추적 설정 */
    private AuditProperties audit = new AuditProperties();

    /** 기동 시 자가 진단 실행 여부 */
    private boolean diagnoseOnStartup = true;

    @Data
    public static class KeyProperties {
        private String encryptionKeyRef;
        private String signingKeyRef;
        private String signingKeyVersionRef;
        private String region = "ap-northeast-2";

        /** 크로스 계정 접근용 역할 ARN */
        private String roleArn;

        private String signingAlgorithm = "ECDSA_SHA_256";

        /** KMS 대신 로컬 키 사용 (개발용) */
        private boolean localKeysEnabled = false;

        /** 로컬 키 저장 디렉토리 (미지정 시 휘발성 키) */
        private String keyDirectory;
    }

    @Data
    public static class StorageProperties {
        /** 지정 시 S3 사용 */
        private String bucket;
        private String blobDirectory = "ledger/blobs";
        private String ledgerDirectory = "ledger/chain";
        private long operationTimeoutMs = 5000;
        private int uploadMaxAttempts = 2;
    }

    @Data
    public static class CacheProperties {
        private Duration verifiedTtl = Duration.ofHours(1);
        private Duration tamperedTtl = Duration.ofMinutes(30);
        private Duration notFoundTtl = Duration.ofMinutes(5);
        private Duration throttleWindow = Duration.ofSeconds(60);
        private long maximumSize = 10_000;

        /** 만료 엔트리 정리 주기 */
        private Duration cleanupInterval = Duration.ofMinutes(5);
    }

    @Data
    public static class AuditProperties {
        /** 감사 추적에 포함할 최근 블록 수 */
        private int blockLimit = 5;
    }

    public LedgerConfig toConfig() {
        return LedgerConfig.builder()
                .encryptionKeyRef(keys.getEncryptionKeyRef())
                .signingKeyRef(keys.getSigningKeyRef())
                .signingKeyVersionRef(keys.getSigningKeyVersionRef())
                .kmsRegion(keys.getRegion())
                .kmsRoleArn(keys.getRoleArn())
                .kmsSigningAlgorithm(keys.getSigningAlgorithm())
                .localKeysEnabled(keys.isLocalKeysEnabled())
                .keyDirectory(keys.getKeyDirectory())
                .blobBucket(storage.getBucket())
                .blobDirectory(storage.getBlobDirectory())
                .ledgerDirectory(storage.getLedgerDirectory())
                .operationTimeoutMs(storage.getOperationTimeoutMs())
                .uploadMaxAttempts(storage.getUploadMaxAttempts())
                .verifiedTtl(cache.getVerifiedTtl())
                .tamperedTtl(cache.getTamperedTtl())
                .notFoundTtl(cache.getNotFoundTtl())
                .throttleWindow(cache.getThrottleWindow())
                .cacheMaximumSize(cache.getMaximumSize())
                .auditBlockLimit(audit.getBlockLimit())
                .build();
    }
}

package io.github.hongjungwan.ledger.api.config;

import lombok.Builder;
import lombok.Getter;

import java.time.Duration;

/**
 * 원장 설정. 키 참조, 저장소 위치, 검증 캐시 TTL, 타임아웃 설정 포함.
 */
@Getter
@Builder
public class LedgerConfig {

    /** 데이터 키 래핑용 KMS 키 (ID 또는 ARN) */
    private final String encryptionKeyRef;

    /** 서명용 비대칭 KMS 키 (ID 또는 ARN) */
    private final String signingKeyRef;

    /** 해시 레코드에 기록되는 서명 키 버전 참조 (미설정 시 signingKeyRef 사용) */
    private final String signingKeyVersionRef;

    /** KMS 리전 */
    @Builder.Default
    private final String kmsRegion = "ap-northeast-2";

    /** 크로스 계정 KMS 접근용 역할 ARN */
    private final String kmsRoleArn;

    /** KMS 서명 알고리즘 (SigningAlgorithmSpec 이름) */
    @Builder.Default
    private final String kmsSigningAlgorithm = "ECDSA_SHA_256";

    /** KMS / S3 호출 타임아웃 (ms) */
    @Builder.Default
    private final long operationTimeoutMs = 5000;

    /** 암호화 문서 저장 S3 버킷 */
    private final String blobBucket;

    /** S3 미사용 시 로컬 Blob 디렉토리 */
    @Builder.Default
    private final String blobDirectory = "ledger/blobs";

    /** 원장(JSON Lines) 파일 디렉토리 */
    @Builder.Default
    private final String ledgerDirectory = "ledger/chain";

    /** 로컬 키 저장 디렉토리 (null이면 휘발성 키) */
    private final String keyDirectory;

    /** KMS 미구성 시 로컬 키 사용 허용 (프로덕션 비권장) */
    @Builder.Default
    private final boolean localKeysEnabled = false;

    /** VERIFIED 결과 캐시 TTL */
    @Builder.Default
    private final Duration verifiedTtl = Duration.ofHours(1);

    /** TAMPERED 결과 캐시 TTL */
    @Builder.Default
    private final Duration tamperedTtl = Duration.ofMinutes(30);

    /** NOT_FOUND 결과 캐시 TTL */
    @Builder.Default
    private final Duration notFoundTtl = Duration.ofMinutes(5);

    /** 문서별 검증 요청 스로틀 윈도우 */
    @Builder.Default
    private final Duration throttleWindow = Duration.ofSeconds(60);

    /** 검증 캐시 최대 엔트리 수 */
    @Builder.Default
    private final long cacheMaximumSize = 10_000;

    /** 감사 추적에 포함할 최근 블록 수 */
    @Builder.Default
    private final int auditBlockLimit = 5;

    /** Blob 업로드 최대 시도 횟수 (최초 1회 + 재연결 후 재시도) */
    @Builder.Default
    private final int uploadMaxAttempts = 2;

    /** 레코드에 기록할 서명 키 버전. 별도 지정이 없으면 서명 키 참조를 사용. */
    public String resolveSigningKeyVersionRef() {
        if (signingKeyVersionRef != null && !signingKeyVersionRef.isBlank()) {
            return signingKeyVersionRef;
        }
        return signingKeyRef;
    }

    /** 암호화 키와 서명 키 참조가 모두 지정되었는지 여부 */
    public boolean hasKeyRefs() {
        return encryptionKeyRef != null && !encryptionKeyRef.isBlank()
                && signingKeyRef != null && !signingKeyRef.isBlank();
    }

    /** 개발용 기본 설정 (로컬 키 사용) */
    public static LedgerConfig defaultConfig() {
        return LedgerConfig.builder()
                .encryptionKeyRef("local-encryption-key")
                .signingKeyRef("local-signing-key")
                .localKeysEnabled(true)
                .build();
    }

    /** 프로덕션 설정 */
    public static LedgerConfig productionConfig(String encryptionKeyRef, String signingKeyRef, String bucket) {
        return LedgerConfig.builder()
                .encryptionKeyRef(encryptionKeyRef)
                .signingKeyRef(signingKeyRef)
                .blobBucket(bucket)
                .localKeysEnabled(false)
                .build();
    }
}

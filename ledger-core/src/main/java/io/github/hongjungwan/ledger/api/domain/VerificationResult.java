package io.github.hongjungwan.ledger.api.domain;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.UUID;

/**
 * 문서 무결성 검증 결과.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class VerificationResult {

    public static final String ALGORITHM = "SHA-256";
    public static final String NOT_AVAILABLE = "N/A";

    private final String documentId;

    private final boolean verified;

    private final VerificationStatus status;

    /** 원장에 기록된 파일 해시 */
    private final String expectedHash;

    /** 요청 내용의 파일 해시 */
    private final String actualHash;

    @Builder.Default
    private final String algorithm = ALGORITHM;

    /** 비교 대상 해시 레코드 (없으면 null) */
    private final UUID hashId;

    /** 레코드 서명 검증 결과 */
    private final boolean signatureValid;

    private final String message;

    private final Instant checkedAt;

    public static VerificationResult matched(String documentId, HashRecord record, String actualHash,
                                             boolean signatureValid, Instant now) {
        return VerificationResult.builder()
                .documentId(documentId)
                .verified(true)
                .status(VerificationStatus.VERIFIED)
                .expectedHash(record.getFileHash())
                .actualHash(actualHash)
                .hashId(record.getHashId())
                .signatureValid(signatureValid)
                .message("Document integrity verified")
                .checkedAt(now)
                .build();
    }

    public static VerificationResult tampered(String documentId, HashRecord record, String actualHash,
                                              boolean signatureValid, Instant now) {
        return VerificationResult.builder()
                .documentId(documentId)
                .verified(false)
                .status(VerificationStatus.TAMPERED)
                .expectedHash(record.getFileHash())
                .actualHash(actualHash)
                .hashId(record.getHashId())
                .signatureValid(signatureValid)
                .message("Document content does not match the recorded hash")
                .checkedAt(now)
                .build();
    }

    public static VerificationResult notFound(String documentId, String actualHash, Instant now) {
        return VerificationResult.builder()
                .documentId(documentId)
                .verified(false)
                .status(VerificationStatus.NOT_FOUND)
                .expectedHash(NOT_AVAILABLE)
                .actualHash(actualHash)
                .message("No hash record found for document")
                .checkedAt(now)
                .build();
    }

    public static VerificationResult throttled(String documentId, Instant now) {
        return VerificationResult.builder()
                .documentId(documentId)
                .verified(false)
                .status(VerificationStatus.THROTTLED)
                .expectedHash(NOT_AVAILABLE)
                .actualHash(NOT_AVAILABLE)
                .message("Request throttled - please wait before retrying")
                .checkedAt(now)
                .build();
    }

    public static VerificationResult error(String documentId, String reason, Instant now) {
        return VerificationResult.builder()
                .documentId(documentId)
                .verified(false)
                .status(VerificationStatus.ERROR)
                .expectedHash(NOT_AVAILABLE)
                .actualHash(NOT_AVAILABLE)
                .message("Verification failed: " + reason)
                .checkedAt(now)
                .build();
    }
}

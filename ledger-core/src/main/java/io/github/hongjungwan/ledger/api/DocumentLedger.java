package io.github.hongjungwan.ledger.api;

import io.github.hongjungwan.ledger.api.domain.AuditTrail;
import io.github.hongjungwan.ledger.api.domain.ChainVerificationReport;
import io.github.hongjungwan.ledger.api.domain.DocumentMetadata;
import io.github.hongjungwan.ledger.api.domain.EncryptedDocument;
import io.github.hongjungwan.ledger.api.domain.VerificationResult;

import java.util.UUID;

/**
 * 문서 무결성 원장의 메인 인터페이스. 봉투 암호화 저장, 서명된 해시 기록, 무결성 검증.
 *
 * <p>저장과 기록 실패는 {@link io.github.hongjungwan.ledger.api.exception.LedgerException}으로 전파되고,
 * 검증은 예외 대신 {@code ERROR} 상태 결과를 반환.
 */
public interface DocumentLedger {

    /** 문서를 암호화하여 Blob 저장소에 업로드. 원장에는 기록하지 않음. */
    EncryptedDocument storeDocument(byte[] content, DocumentMetadata metadata);

    /**
     * 문서의 서명된 해시 레코드를 기록하고 체인 블록에 연결.
     *
     * @return 생성된 hashId
     */
    UUID recordHash(String documentId, byte[] content, String extractedText, String userId,
                    DocumentMetadata metadata);

    /** 현재 내용을 최신 해시 레코드와 비교. 스로틀 및 캐시 적용. */
    VerificationResult verify(String documentId, byte[] currentContent);

    /** 문서의 해시 레코드 이력과 최근 체인 블록 */
    AuditTrail auditTrail(String documentId);

    /** 저장된 문서 복호화 */
    byte[] retrieveDocument(String blobName);

    /** 전체 체인 재검증 */
    ChainVerificationReport verifyChain();

    /** 문서의 캐시된 검증 결과 제거 */
    void invalidate(String documentId);
}

package io.github.hongjungwan.ledger.api.domain;

/**
 * storeDocument 결과. 호출자가 Blob 이름과 봉투 메타데이터를 보관.
 */
public record EncryptedDocument(String blobName, EnvelopeMetadata envelopeMetadata) {
}

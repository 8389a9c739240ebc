package io.github.hongjungwan.ledger.api.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.UUID;

/**
 * 문서 해시 레코드. 생성 후 변경되지 않음.
 * 동일 documentId에 여러 레코드가 존재할 수 있으며 최신 timestamp가 현재 레코드.
 */
@Getter
@Builder
@JsonDeserialize(builder = HashRecord.HashRecordBuilder.class)
public class HashRecord {

    public enum Status {
        VERIFIED
    }

    private final UUID hashId;

    private final String documentId;

    /** 원본 바이트 SHA-256 (hex) */
    private final String fileHash;

    /** 추출 텍스트 SHA-256 (hex) */
    private final String contentHash;

    /** 서명 키 버전 참조 */
    private final String keyVersionRef;

    /** SHA256(fileHash:contentHash:documentId) 서명 */
    private final byte[] signature;

    private final Instant timestamp;

    private final String userId;

    private final long fileSize;

    private final String mimeType;

    private final String metadataJson;

    @Builder.Default
    private final Status verificationStatus = Status.VERIFIED;

    public byte[] getSignature() {
        return signature == null ? null : signature.clone();
    }

    @JsonPOJOBuilder(withPrefix = "")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class HashRecordBuilder {
    }
}

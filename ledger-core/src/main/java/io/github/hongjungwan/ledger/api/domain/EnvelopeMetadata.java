package io.github.hongjungwan.ledger.api.domain;

import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.Base64;

/**
 * 봉투 암호화 메타데이터. 래핑된 데이터 키와 알고리즘 정보.
 * 암호문 복호화에 필요하며 업로드 후 변경되지 않음.
 */
@Getter
@Builder
public class EnvelopeMetadata {

    /** 키 서비스로 래핑된 데이터 키 */
    private final byte[] wrappedKey;

    /** 래핑에 사용된 키 참조 */
    private final String keyRef;

    /** 암호화 알고리즘 태그 */
    private final String algorithm;

    /** 원본 크기 (bytes) */
    private final long originalSize;

    /** 암호문 크기 (bytes, IV + 태그 포함) */
    private final long encryptedSize;

    /** 암호화 시각 */
    private final Instant encryptedAt;

    public String getWrappedKeyBase64() {
        return Base64.getEncoder().encodeToString(wrappedKey);
    }
}

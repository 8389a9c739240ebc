package io.github.hongjungwan.ledger.core.digest;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.UUID;

/**
 * SHA-256 다이제스트 및 서명 대상 정규 문자열 계산. 외부 의존성 없는 순수 함수.
 *
 * <p>서명 페이로드와 블록 해시 문자열 형식은 기존 레코드 서명 검증과 직결되므로
 * 구분자와 순서를 바꾸면 안 됨.
 */
public final class DigestEngine {

    public static final String HASH_ALGORITHM = "SHA-256";

    /** 제네시스 블록의 previousHash 직렬화 값 */
    public static final String GENESIS_PREVIOUS_HASH = "null";

    private static final HexFormat HEX = HexFormat.of();

    private DigestEngine() {}

    /** 원본 바이트 해시 (hex) */
    public static String fileHash(byte[] content) {
        return HEX.formatHex(sha256(content));
    }

    /** 추출 텍스트 해시 (UTF-8, hex) */
    public static String textHash(String text) {
        return HEX.formatHex(sha256(text.getBytes(StandardCharsets.UTF_8)));
    }

    /** 해시 레코드 서명 페이로드: fileHash:contentHash:documentId */
    public static String recordSigningPayload(String fileHash, String contentHash, String documentId) {
        return fileHash + ":" + contentHash + ":" + documentId;
    }

    /** 해시 레코드 서명 대상 다이제스트 */
    public static byte[] recordSigningDigest(String fileHash, String contentHash, String documentId) {
        return sha256(recordSigningPayload(fileHash, contentHash, documentId).getBytes(StandardCharsets.UTF_8));
    }

    /**
     * 단순화된 Merkle root. 트리가 아니라 해시 ID 문자열을 삽입 순서대로 이어 붙인 뒤 한 번 해시.
     */
    public static String merkleRoot(List<UUID> hashIds) {
        StringBuilder joined = new StringBuilder(hashIds.size() * 36);
        for (UUID hashId : hashIds) {
            joined.append(hashId);
        }
        return HEX.formatHex(sha256(joined.toString().getBytes(StandardCharsets.UTF_8)));
    }

    /** 블록 해시 원문: {blockNumber}:{previousHash}:{merkleRoot} */
    public static String blockPayload(long blockNumber, String previousHash, String merkleRoot) {
        String previous = previousHash == null ? GENESIS_PREVIOUS_HASH : previousHash;
        return blockNumber + ":" + previous + ":" + merkleRoot;
    }

    public static String blockHash(long blockNumber, String previousHash, String merkleRoot) {
        return HEX.formatHex(sha256(
                blockPayload(blockNumber, previousHash, merkleRoot).getBytes(StandardCharsets.UTF_8)));
    }

    /** 블록 서명 대상 다이제스트: SHA256(currentHash) */
    public static byte[] blockSigningDigest(String currentHash) {
        return sha256(currentHash.getBytes(StandardCharsets.UTF_8));
    }

    public static byte[] sha256(byte[] data) {
        try {
            return MessageDigest.getInstance(HASH_ALGORITHM).digest(data);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Hash algorithm not available: " + HASH_ALGORITHM, e);
        }
    }

    /** 64자리 hex SHA-256 형식 여부 */
    public static boolean isHexDigest(String value) {
        return value != null && value.length() == 64 && value.matches("[0-9a-f]+");
    }
}

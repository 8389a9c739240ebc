package io.github.hongjungwan.ledger.api.exception;

/**
 * 암호문 복호화 실패 (인증 태그 불일치, 잘린 페이로드 등).
 */
public class DecryptionException extends LedgerException {

    public DecryptionException(String message) {
        super(ErrorCode.DECRYPT_FAILED, message);
    }

    public DecryptionException(String message, Throwable cause) {
        super(ErrorCode.DECRYPT_FAILED, message, cause);
    }
}

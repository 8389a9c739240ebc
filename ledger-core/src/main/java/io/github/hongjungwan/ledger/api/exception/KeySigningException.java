package io.github.hongjungwan.ledger.api.exception;

/**
 * 해시 레코드 또는 블록 서명 실패.
 */
public class KeySigningException extends LedgerException {

    public KeySigningException(String message) {
        super(ErrorCode.SIGNING_FAILED, message);
    }

    public KeySigningException(String message, Throwable cause) {
        super(ErrorCode.SIGNING_FAILED, message, cause);
    }
}

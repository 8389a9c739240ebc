package io.github.hongjungwan.ledger.api.exception;

/**
 * 데이터 키 래핑 실패.
 */
public class KeyWrapException extends LedgerException {

    public KeyWrapException(String message) {
        super(ErrorCode.WRAP_FAILED, message);
    }

    public KeyWrapException(String message, Throwable cause) {
        super(ErrorCode.WRAP_FAILED, message, cause);
    }
}

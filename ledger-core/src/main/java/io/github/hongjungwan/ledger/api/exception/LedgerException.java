package io.github.hongjungwan.ledger.api.exception;

/**
 * 원장 작업 실패의 공통 상위 예외.
 */
public abstract class LedgerException extends RuntimeException {

    private final ErrorCode errorCode;

    protected LedgerException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected LedgerException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}

package io.github.hongjungwan.ledger.api.exception;

/**
 * 원장 저장소 읽기 실패.
 */
public class LedgerReadException extends LedgerException {

    public LedgerReadException(String message) {
        super(ErrorCode.LEDGER_READ_FAILED, message);
    }

    public LedgerReadException(String message, Throwable cause) {
        super(ErrorCode.LEDGER_READ_FAILED, message, cause);
    }
}

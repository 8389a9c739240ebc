package io.github.hongjungwan.ledger.api.exception;

/**
 * 원장 저장소 쓰기 실패.
 */
public class LedgerWriteException extends LedgerException {

    public LedgerWriteException(String message) {
        super(ErrorCode.LEDGER_WRITE_FAILED, message);
    }

    public LedgerWriteException(String message, Throwable cause) {
        super(ErrorCode.LEDGER_WRITE_FAILED, message, cause);
    }
}

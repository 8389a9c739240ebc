package io.github.hongjungwan.ledger.api.exception;

/**
 * Blob 저장소 읽기 실패.
 */
public class StorageReadException extends LedgerException {

    public StorageReadException(String message) {
        super(ErrorCode.STORAGE_READ_FAILED, message);
    }

    public StorageReadException(String message, Throwable cause) {
        super(ErrorCode.STORAGE_READ_FAILED, message, cause);
    }

    protected StorageReadException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}

package io.github.hongjungwan.ledger.api.exception;

/**
 * Blob 저장소 쓰기 실패 (재연결 후 재시도까지 실패한 경우).
 */
public class StorageWriteException extends LedgerException {

    public StorageWriteException(String message) {
        super(ErrorCode.STORAGE_WRITE_FAILED, message);
    }

    public StorageWriteException(String message, Throwable cause) {
        super(ErrorCode.STORAGE_WRITE_FAILED, message, cause);
    }
}

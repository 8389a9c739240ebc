package io.github.hongjungwan.ledger.api.exception;

/**
 * 원장 오류 분류. 호출자(전송 계층)가 재시도 여부를 판단하는 기준.
 */
public enum ErrorCode {
    KEY_SERVICE_UNAVAILABLE,
    WRAP_FAILED,
    UNWRAP_FAILED,
    SIGNING_FAILED,
    STORAGE_WRITE_FAILED,
    STORAGE_READ_FAILED,
    BLOB_NOT_FOUND,
    DECRYPT_FAILED,
    LEDGER_WRITE_FAILED,
    LEDGER_READ_FAILED,
    CHAIN_CORRUPTION,
    TIMEOUT
}

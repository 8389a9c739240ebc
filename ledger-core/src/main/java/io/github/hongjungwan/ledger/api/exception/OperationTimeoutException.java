package io.github.hongjungwan.ledger.api.exception;

/**
 * 외부 호출이 설정된 타임아웃 내에 끝나지 않은 경우.
 */
public class OperationTimeoutException extends LedgerException {

    public OperationTimeoutException(String message) {
        super(ErrorCode.TIMEOUT, message);
    }

    public OperationTimeoutException(String message, Throwable cause) {
        super(ErrorCode.TIMEOUT, message, cause);
    }
}

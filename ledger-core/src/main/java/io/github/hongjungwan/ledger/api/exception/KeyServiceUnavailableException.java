package io.github.hongjungwan.ledger.api.exception;

/**
 * 키 서비스에 연결할 수 없거나 응답이 없는 경우.
 */
public class KeyServiceUnavailableException extends LedgerException {

    public KeyServiceUnavailableException(String message) {
        super(ErrorCode.KEY_SERVICE_UNAVAILABLE, message);
    }

    public KeyServiceUnavailableException(String message, Throwable cause) {
        super(ErrorCode.KEY_SERVICE_UNAVAILABLE, message, cause);
    }
}

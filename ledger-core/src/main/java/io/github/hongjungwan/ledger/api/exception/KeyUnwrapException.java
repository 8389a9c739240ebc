package io.github.hongjungwan.ledger.api.exception;

/**
 * 래핑된 데이터 키 복원 실패. 페이로드 손상과 구분됨.
 */
public class KeyUnwrapException extends LedgerException {

    public KeyUnwrapException(String message) {
        super(ErrorCode.UNWRAP_FAILED, message);
    }

    public KeyUnwrapException(String message, Throwable cause) {
        super(ErrorCode.UNWRAP_FAILED, message, cause);
    }
}

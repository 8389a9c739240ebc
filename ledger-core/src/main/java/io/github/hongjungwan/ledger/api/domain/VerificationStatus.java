package io.github.hongjungwan.ledger.api.domain;

/**
 * 무결성 검증 결과 상태. 모두 정상적인 반환값이며 예외로 전달되지 않음.
 */
public enum VerificationStatus {
    /** 현재 내용이 최신 해시 레코드와 일치 */
    VERIFIED,
    /** 현재 내용이 최신 해시 레코드와 불일치 */
    TAMPERED,
    /** 문서의 해시 레코드 없음 */
    NOT_FOUND,
    /** 스로틀 윈도우 내 반복 요청 (캐시 결과 없음) */
    THROTTLED,
    /** 원장 조회 실패 등 예기치 못한 오류 */
    ERROR
}

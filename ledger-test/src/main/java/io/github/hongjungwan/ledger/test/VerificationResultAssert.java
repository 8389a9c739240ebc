package io.github.hongjungwan.ledger.test;

import io.github.hongjungwan.ledger.api.domain.VerificationResult;
import io.github.hongjungwan.ledger.api.domain.VerificationStatus;
import org.assertj.core.api.AbstractAssert;

import java.util.UUID;

/**
 * 검증 결과 Fluent API TestKit. AssertJ 스타일 메서드 체이닝 지원.
 */
public class VerificationResultAssert extends AbstractAssert<VerificationResultAssert, VerificationResult> {

    public VerificationResultAssert(VerificationResult actual) {
        super(actual, VerificationResultAssert.class);
    }

    public static VerificationResultAssert assertThatResult(VerificationResult actual) {
        return new VerificationResultAssert(actual);
    }

    /** 상태 일치 검증 */
    public VerificationResultAssert hasStatus(VerificationStatus status) {
        isNotNull();

        if (actual.getStatus() != status) {
            failWithMessage("Expected status to be <%s> but was <%s> (%s)", status, actual.getStatus(), actual.getMessage());
        }

        return this;
    }

    /** VERIFIED 및 verified 플래그 검증 */
    public VerificationResultAssert isVerified() {
        hasStatus(VerificationStatus.VERIFIED);

        if (!actual.isVerified()) {
            failWithMessage("Expected verified flag to be true for <%s>", actual.getDocumentId());
        }

        return this;
    }

    public VerificationResultAssert isTampered() {
        hasStatus(VerificationStatus.TAMPERED);

        if (actual.isVerified()) {
            failWithMessage("Expected verified flag to be false for tampered document <%s>", actual.getDocumentId());
        }

        return this;
    }

    public VerificationResultAssert isNotFound() {
        return hasStatus(VerificationStatus.NOT_FOUND);
    }

    public VerificationResultAssert isThrottled() {
        return hasStatus(VerificationStatus.THROTTLED);
    }

    /** 레코드 서명 유효 검증 */
    public VerificationResultAssert hasValidSignature() {
        isNotNull();

        if (!actual.isSignatureValid()) {
            failWithMessage("Expected record signature of <%s> to be valid", actual.getDocumentId());
        }

        return this;
    }

    public VerificationResultAssert hasInvalidSignature() {
        isNotNull();

        if (actual.isSignatureValid()) {
            failWithMessage("Expected record signature of <%s> to be invalid", actual.getDocumentId());
        }

        return this;
    }

    public VerificationResultAssert hasHashId(UUID hashId) {
        isNotNull();

        if (!hashId.equals(actual.getHashId())) {
            failWithMessage("Expected hash id to be <%s> but was <%s>", hashId, actual.getHashId());
        }

        return this;
    }

    public VerificationResultAssert hasExpectedHash(String hash) {
        isNotNull();

        if (!hash.equals(actual.getExpectedHash())) {
            failWithMessage("Expected recorded hash to be <%s> but was <%s>", hash, actual.getExpectedHash());
        }

        return this;
    }

    public VerificationResultAssert hasActualHash(String hash) {
        isNotNull();

        if (!hash.equals(actual.getActualHash())) {
            failWithMessage("Expected actual hash to be <%s> but was <%s>", hash, actual.getActualHash());
        }

        return this;
    }
}

package io.github.hongjungwan.ledger.core.diagnostics;

import io.github.hongjungwan.ledger.api.config.LedgerConfig;
import io.github.hongjungwan.ledger.api.domain.ChainVerificationReport;
import io.github.hongjungwan.ledger.core.chain.ChainVerifier;
import io.github.hongjungwan.ledger.core.digest.DigestEngine;
import io.github.hongjungwan.ledger.spi.BlobStore;
import io.github.hongjungwan.ledger.spi.KeyService;
import io.github.hongjungwan.ledger.spi.StoredBlob;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 원장 자가 진단. 키 서비스 왕복, Blob 저장소 왕복, 체인 무결성 검사.
 */
@Slf4j
public class LedgerDoctor {

    /** 진단용 Blob. 매 실행마다 같은 이름을 덮어씀 */
    static final String PROBE_BLOB = "diagnostics/ledger-doctor.probe";

    private final LedgerConfig config;
    private final KeyService keyService;
    private final BlobStore blobStore;
    private final ChainVerifier chainVerifier;

    public LedgerDoctor(LedgerConfig config, KeyService keyService, BlobStore blobStore, ChainVerifier chainVerifier) {
        this.config = config;
        this.keyService = keyService;
        this.blobStore = blobStore;
        this.chainVerifier = chainVerifier;
    }

    /** 모든 진단 검사 실행 */
    public DiagnosticReport diagnose() {
        log.info("Running document ledger diagnostic checks...");

        List<DiagnosticResult> results = new ArrayList<>();
        results.add(checkKeyWrapping());
        results.add(checkSigning());
        results.add(checkBlobStore());
        results.add(checkChainIntegrity());

        DiagnosticReport report = new DiagnosticReport(results);

        if (report.hasFailures()) {
            log.warn("Diagnostic failures detected:");
            report.getFailedChecks().forEach(result ->
                    log.warn("  - {}: {}", result.getName(), result.getMessage())
            );
        } else {
            log.info("All diagnostic checks passed successfully");
        }

        return report;
    }

    /** 검사 1: 키 래핑 왕복 */
    private DiagnosticResult checkKeyWrapping() {
        String name = "Key Wrapping";
        try {
            byte[] probe = new byte[32];
            new SecureRandom().nextBytes(probe);
            byte[] wrapped = keyService.wrapKey(config.getEncryptionKeyRef(), probe);
            byte[] unwrapped = keyService.unwrapKey(config.getEncryptionKeyRef(), wrapped);

            if (Arrays.equals(probe, unwrapped)) {
                return DiagnosticResult.success(name, "Round trip succeeded with " + keyService.getName());
            }
            return DiagnosticResult.failure(name, "Unwrapped key does not match");
        } catch (Exception e) {
            return DiagnosticResult.failure(name, "Key service error: " + e.getMessage());
        }
    }

    /** 검사 2: 서명 및 검증 */
    private DiagnosticResult checkSigning() {
        String name = "Signing";
        try {
            String keyVersionRef = config.resolveSigningKeyVersionRef();
            byte[] digest = DigestEngine.sha256(("ledger-doctor:" + UUID.randomUUID()).getBytes(StandardCharsets.UTF_8));
            byte[] signature = keyService.sign(keyVersionRef, digest);

            if (keyService.verify(keyVersionRef, digest, signature)) {
                return DiagnosticResult.success(name, "Signature verified");
            }
            return DiagnosticResult.failure(name, "Signature did not verify");
        } catch (Exception e) {
            return DiagnosticResult.failure(name, "Signing error: " + e.getMessage());
        }
    }

    /** 검사 3: Blob 저장소 쓰기/읽기 */
    private DiagnosticResult checkBlobStore() {
        String name = "Blob Store";
        try {
            // 이전 실행의 Blob과 구분되도록 내용은 매번 새로 생성
            byte[] content = ("probe:" + UUID.randomUUID()).getBytes(StandardCharsets.UTF_8);
            blobStore.put(PROBE_BLOB, content, Map.of("purpose", "diagnostics"));
            StoredBlob blob = blobStore.get(PROBE_BLOB);

            if (Arrays.equals(content, blob.content()) && "diagnostics".equals(blob.attribute("purpose"))) {
                return DiagnosticResult.success(name, blobStore.getName() + " store is writable");
            }
            return DiagnosticResult.failure(name, "Read-back verification failed");
        } catch (Exception e) {
            return DiagnosticResult.failure(name, "Cannot write to " + blobStore.getName() + ": " + e.getMessage());
        }
    }

    /** 검사 4: 체인 무결성. 고아 레코드는 경고. */
    private DiagnosticResult checkChainIntegrity() {
        String name = "Chain Integrity";
        try {
            ChainVerificationReport report = chainVerifier.verifyChain();
            if (!report.isValid()) {
                return DiagnosticResult.failure(name, "Block " + report.getFirstInvalidBlock()
                        + ": " + report.getFailureReason());
            }
            if (!report.getOrphanedHashIds().isEmpty()) {
                return DiagnosticResult.warning(name, report.getOrphanedHashIds().size()
                        + " hash record(s) not linked to any block");
            }
            return DiagnosticResult.success(name, report.getBlocksChecked() + " block(s) verified");
        } catch (Exception e) {
            return DiagnosticResult.failure(name, "Chain verification error: " + e.getMessage());
        }
    }

    /** 진단 결과 */
    public static class DiagnosticResult {
        private final String name;
        private final Status status;
        private final String message;

        public enum Status {
            SUCCESS, WARNING, FAILURE
        }

        private DiagnosticResult(String name, Status status, String message) {
            this.name = name;
            this.status = status;
            this.message = message;
        }

        public static DiagnosticResult success(String name, String message) {
            return new DiagnosticResult(name, Status.SUCCESS, message);
        }

        public static DiagnosticResult warning(String name, String message) {
            return new DiagnosticResult(name, Status.WARNING, message);
        }

        public static DiagnosticResult failure(String name, String message) {
            return new DiagnosticResult(name, Status.FAILURE, message);
        }

        public String getName() {
            return name;
        }

        public Status getStatus() {
            return status;
        }

        public String getMessage() {
            return message;
        }

        public boolean isFailure() {
            return status == Status.FAILURE;
        }
    }

    /** 진단 리포트 */
    public static class DiagnosticReport {
        private final List<DiagnosticResult> results;

        public DiagnosticReport(List<DiagnosticResult> results) {
            this.results = List.copyOf(results);
        }

        public boolean hasFailures() {
            return results.stream().anyMatch(DiagnosticResult::isFailure);
        }

        public List<DiagnosticResult> getFailedChecks() {
            return results.stream()
                    .filter(DiagnosticResult::isFailure)
                    .toList();
        }

        public List<DiagnosticResult> getAllResults() {
            return results;
        }
    }
}

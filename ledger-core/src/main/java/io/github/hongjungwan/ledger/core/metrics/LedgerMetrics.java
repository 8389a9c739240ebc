package io.github.hongjungwan.ledger.core.metrics;

import io.github.hongjungwan.ledger.api.domain.VerificationStatus;
import io.github.hongjungwan.ledger.api.exception.LedgerException;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import java.util.stream.Collectors;

/**
 * 원장 메트릭 수집 (LongAdder 기반 lock-free). 작업 건수, 검증 결과 분포, 캐시 적중률, 지연 시간.
 */
public final class LedgerMetrics {

    private final Instant startTime = Instant.now();

    private final LongAdder documentsStored = new LongAdder();
    private final LongAdder documentsRetrieved = new LongAdder();
    private final LongAdder hashRecordsCreated = new LongAdder();
    private final LongAdder bytesEncrypted = new LongAdder();
    private final LongAdder cacheHits = new LongAdder();
    private final LongAdder cacheMisses = new LongAdder();
    private final Map<VerificationStatus, LongAdder> verifications = new EnumMap<>(VerificationStatus.class);
    private final Map<String, LongAdder> errorCounters = new ConcurrentHashMap<>();
    private final LatencyHistogram verificationLatency = new LatencyHistogram("verify");

    public LedgerMetrics() {
        for (VerificationStatus status : VerificationStatus.values()) {
            verifications.put(status, new LongAdder());
        }
    }

    public void recordDocumentStored(long bytes) {
        documentsStored.increment();
        bytesEncrypted.add(bytes);
    }

    public void recordDocumentRetrieved() {
        documentsRetrieved.increment();
    }

    public void recordHashRecordCreated() {
        hashRecordsCreated.increment();
    }

    public void recordVerification(VerificationStatus status, long nanos) {
        verifications.get(status).increment();
        verificationLatency.record(nanos);
    }

    public void recordCacheHit() {
        cacheHits.increment();
    }

    public void recordCacheMiss() {
        cacheMisses.increment();
    }

    public void recordFailure(String operation, Throwable error) {
        // 원장 예외는 오류 코드, 그 외는 예외 타입으로 집계
        String kind = error instanceof LedgerException ledgerError
                ? ledgerError.getErrorCode().name()
                : error.getClass().getSimpleName();
        String errorKey = operation + ":" + kind;
        errorCounters.computeIfAbsent(errorKey, k -> new LongAdder()).increment();
    }

    public Timer startTimer() {
        return new Timer();
    }

    public static class Timer {
        private final long startNanos = System.nanoTime();

        public long elapsedNanos() {
            return System.nanoTime() - startNanos;
        }
    }

    public Snapshot getSnapshot() {
        return new Snapshot(
                Instant.now(),
                startTime,
                documentsStored.sum(),
                documentsRetrieved.sum(),
                hashRecordsCreated.sum(),
                bytesEncrypted.sum(),
                cacheHits.sum(),
                cacheMisses.sum(),
                verifications.entrySet().stream()
                        .collect(Collectors.toMap(Map.Entry::getKey, e -> e.getValue().sum())),
                errorCounters.entrySet().stream()
                        .collect(Collectors.toMap(Map.Entry::getKey, e -> e.getValue().sum())),
                verificationLatency.getStats()
        );
    }

    public void reset() {
        documentsStored.reset();
        documentsRetrieved.reset();
        hashRecordsCreated.reset();
        bytesEncrypted.reset();
        cacheHits.reset();
        cacheMisses.reset();
        verifications.values().forEach(LongAdder::reset);
        errorCounters.clear();
        verificationLatency.reset();
    }

    /** Latency 히스토그램 (평균, 최소, 최대) */
    static class LatencyHistogram {
        private final String name;
        private final LongAdder count = new LongAdder();
        private final LongAdder totalNanos = new LongAdder();
        private final AtomicLong minNanos = new AtomicLong(Long.MAX_VALUE);
        private final AtomicLong maxNanos = new AtomicLong(0);

        LatencyHistogram(String name) {
            this.name = name;
        }

        void record(long nanos) {
            count.increment();
            totalNanos.add(nanos);
            minNanos.accumulateAndGet(nanos, Math::min);
            maxNanos.accumulateAndGet(nanos, Math::max);
        }

        LatencyStats getStats() {
            long c = count.sum();
            if (c == 0) {
                return new LatencyStats(name, 0, 0, 0, 0);
            }
            return new LatencyStats(
                    name,
                    c,
                    (double) totalNanos.sum() / c / 1_000_000,
                    (double) minNanos.get() / 1_000_000,
                    (double) maxNanos.get() / 1_000_000
            );
        }

        void reset() {
            count.reset();
            totalNanos.reset();
            minNanos.set(Long.MAX_VALUE);
            maxNanos.set(0);
        }
    }

    public record LatencyStats(String name, long count, double avgMs, double minMs, double maxMs) {}

    public record Snapshot(
            Instant snapshotTime,
            Instant startTime,
            long documentsStored,
            long documentsRetrieved,
            long hashRecordsCreated,
            long bytesEncrypted,
            long cacheHits,
            long cacheMisses,
            Map<VerificationStatus, Long> verifications,
            Map<String, Long> errorCounts,
            LatencyStats verificationLatency
    ) {
        public Duration uptime() {
            return Duration.between(startTime, snapshotTime);
        }

        public long verificationCount(VerificationStatus status) {
            return verifications.getOrDefault(status, 0L);
        }

        public double cacheHitRate() {
            long total = cacheHits + cacheMisses;
            if (total == 0) return 0;
            return (double) cacheHits / total;
        }
    }
}

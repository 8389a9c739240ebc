package io.github.hongjungwan.ledger.core.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import io.github.hongjungwan.ledger.api.config.LedgerConfig;
import io.github.hongjungwan.ledger.api.domain.VerificationResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 검증 결과 캐시와 문서별 요청 스로틀.
 *
 * <p>엔트리마다 TTL이 다르므로 Caffeine 가변 만료를 사용. 시간은 주입된 {@link Ticker} 기준.
 * 내부 오류는 로그만 남기고 캐시 미스로 처리.
 */
@Slf4j
public class VerificationCache {

    /** 콘텐츠 키에 사용하는 해시 접두사 길이 */
    static final int CONTENT_PREFIX_LENGTH = 16;

    private static final Duration DEFAULT_TTL = Duration.ofHours(1);

    private final Cache<CacheKey, Entry> results;
    private final Map<String, Long> lastChecks = new ConcurrentHashMap<>();
    private final Ticker ticker;
    private final long throttleWindowNanos;

    public VerificationCache(LedgerConfig config) {
        this(config, Ticker.systemTicker());
    }

    public VerificationCache(LedgerConfig config, Ticker ticker) {
        this.ticker = ticker;
        this.throttleWindowNanos = config.getThrottleWindow().toNanos();
        this.results = Caffeine.newBuilder()
                .maximumSize(config.getCacheMaximumSize())
                .expireAfter(new PerEntryExpiry())
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
    }

    /**
     * 캐시 조회. contentHash가 없으면 문서 단위 키.
     *
     * @return 결과, 미스 또는 만료 시 null
     */
    public VerificationResult get(String documentId, String contentHash) {
        try {
            Entry entry = results.getIfPresent(CacheKey.of(documentId, contentHash));
            if (entry == null) {
                log.debug("Cache miss: document={}", documentId);
                return null;
            }
            log.debug("Cache hit: document={}", documentId);
            return entry.result();
        } catch (RuntimeException e) {
            log.warn("Cache read failed for document {}: {}", documentId, e.getMessage());
            return null;
        }
    }

    public VerificationResult get(String documentId) {
        return get(documentId, null);
    }

    /**
     * 결과 저장 (덮어쓰기). ttl이 null이면 1시간.
     */
    public void set(String documentId, VerificationResult result, String contentHash, Duration ttl) {
        Duration effectiveTtl = ttl == null ? DEFAULT_TTL : ttl;
        try {
            results.put(CacheKey.of(documentId, contentHash), new Entry(result, effectiveTtl.toNanos()));
            log.debug("Cached {} for document={} (ttl={})", result.getStatus(), documentId, effectiveTtl);
        } catch (RuntimeException e) {
            log.warn("Cache write failed for document {}: {}", documentId, e.getMessage());
        }
    }

    /**
     * 스로틀 확인과 기록을 원자적으로 수행. 윈도우 안의 재요청은 true이며 윈도우를 연장하지 않음.
     */
    public boolean isThrottled(String documentId) {
        try {
            long now = ticker.read();
            boolean[] throttled = {false};
            lastChecks.compute(documentId, (key, last) -> {
                if (last != null && now - last < throttleWindowNanos) {
                    throttled[0] = true;
                    return last;
                }
                return now;
            });
            if (throttled[0]) {
                log.warn("Verification throttled: document={}", documentId);
            }
            return throttled[0];
        } catch (RuntimeException e) {
            log.warn("Throttle check failed for document {}: {}", documentId, e.getMessage());
            return false;
        }
    }

    /** 문서 네임스페이스의 모든 엔트리와 스로틀 기록 삭제 */
    public void invalidate(String documentId) {
        try {
            results.asMap().keySet().removeIf(key -> key.documentId().equals(documentId));
            lastChecks.remove(documentId);
            log.debug("Cache invalidated: document={}", documentId);
        } catch (RuntimeException e) {
            log.warn("Cache invalidation failed for document {}: {}", documentId, e.getMessage());
        }
    }

    /** 만료 엔트리와 지난 스로틀 기록 정리 */
    public void clearExpired() {
        try {
            long before = results.estimatedSize();
            results.cleanUp();
            long now = ticker.read();
            lastChecks.values().removeIf(last -> now - last >= throttleWindowNanos);
            long removed = before - results.estimatedSize();
            if (removed > 0) {
                log.debug("Cleared {} expired cache entries", removed);
            }
        } catch (RuntimeException e) {
            log.warn("Cache cleanup failed: {}", e.getMessage());
        }
    }

    public CacheStats getStats() {
        long total = results.estimatedSize();
        // 만료된 엔트리는 asMap 뷰에서 보이지 않음
        long active = results.asMap().values().stream().count();
        return new CacheStats(total, Math.max(0, total - active), active);
    }

    /**
     * 캐시 통계.
     */
    public record CacheStats(long totalEntries, long expiredEntries, long activeEntries) {
    }

    record CacheKey(String documentId, String contentPrefix) {

        static CacheKey of(String documentId, String contentHash) {
            if (contentHash == null || contentHash.isEmpty()) {
                return new CacheKey(documentId, null);
            }
            String prefix = contentHash.length() > CONTENT_PREFIX_LENGTH
                    ? contentHash.substring(0, CONTENT_PREFIX_LENGTH)
                    : contentHash;
            return new CacheKey(documentId, prefix);
        }
    }

    private record Entry(VerificationResult result, long ttlNanos) {
    }

    private static final class PerEntryExpiry implements Expiry<CacheKey, Entry> {

        @Override
        public long expireAfterCreate(CacheKey key, Entry value, long currentTime) {
            return value.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(CacheKey key, Entry value, long currentTime, long currentDuration) {
            return value.ttlNanos();
        }

        @Override
        public long expireAfterRead(CacheKey key, Entry value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}

package io.github.hongjungwan.ledger.core.resilience;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * 고정 간격 재시도 정책. 재시도 직전 복구 훅(재연결 등) 실행 지원.
 *
 * <p>소진 시 최초 실패를 원인으로 보고하고 이후 실패는 suppressed로 첨부.
 */
@Slf4j
public final class RetryPolicy {

    private final int maxAttempts;
    private final long delayMs;
    private final Set<Class<? extends Exception>> retryableExceptions;
    private final Consumer<Exception> beforeRetry;

    private RetryPolicy(Builder builder) {
        this.maxAttempts = builder.maxAttempts;
        this.delayMs = builder.delayMs;
        this.retryableExceptions = builder.retryableExceptions;
        this.beforeRetry = builder.beforeRetry;
    }

    /**
     * 재시도 정책에 따라 작업 실행
     */
    public <T> T execute(Supplier<T> operation) throws RetryExhaustedException {
        Exception firstException = null;
        int attempt = 0;

        while (attempt < maxAttempts) {
            try {
                return operation.get();
            } catch (Exception e) {
                if (firstException == null) {
                    firstException = e;
                } else if (e != firstException) {
                    firstException.addSuppressed(e);
                }
                attempt++;

                if (!shouldRetry(e, attempt)) {
                    break;
                }

                log.debug("Retry attempt {}/{} after {}ms: {}", attempt, maxAttempts, delayMs, e.getMessage());
                sleep(delayMs);
                if (!runBeforeRetry(e, firstException)) {
                    break;
                }
            }
        }

        throw new RetryExhaustedException(
                String.format("Failed after %d attempt(s)", attempt),
                attempt,
                firstException
        );
    }

    /**
     * Runnable 실행
     */
    public void execute(Runnable operation) throws RetryExhaustedException {
        execute(() -> {
            operation.run();
            return null;
        });
    }

    private boolean shouldRetry(Exception e, int attempt) {
        if (attempt >= maxAttempts) {
            return false;
        }

        if (!retryableExceptions.isEmpty()) {
            return retryableExceptions.stream()
                    .anyMatch(clazz -> clazz.isInstance(e));
        }

        return true;
    }

    /** 복구 훅 실행. 훅 자체가 실패하면 재시도 중단. */
    private boolean runBeforeRetry(Exception cause, Exception firstException) {
        if (beforeRetry == null) {
            return true;
        }
        try {
            beforeRetry.accept(cause);
            return true;
        } catch (Exception hookFailure) {
            log.warn("Recovery before retry failed: {}", hookFailure.getMessage());
            firstException.addSuppressed(hookFailure);
            return false;
        }
    }

    private void sleep(long ms) {
        if (ms <= 0) {
            return;
        }
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxAttempts = 3;
        private long delayMs = 100;
        private Set<Class<? extends Exception>> retryableExceptions = Set.of();
        private Consumer<Exception> beforeRetry;

        /**
         * 최대 시도 횟수 (기본: 3, 최초 시도 포함)
         */
        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be >= 1: " + maxAttempts);
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        /**
         * 고정 딜레이 설정
         */
        public Builder fixedDelay(Duration delay) {
            this.delayMs = delay.toMillis();
            return this;
        }

        /**
         * 재시도할 예외 클래스 설정
         */
        @SafeVarargs
        public final Builder retryOnExceptions(Class<? extends Exception>... exceptions) {
            this.retryableExceptions = Set.of(exceptions);
            return this;
        }

        /**
         * 재시도 직전 실행할 복구 작업 (클라이언트 재연결 등)
         */
        public Builder beforeRetry(Consumer<Exception> beforeRetry) {
            this.beforeRetry = beforeRetry;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(this);
        }
    }

    /**
     * 재시도 소진 시 발생하는 예외. cause는 최초 실패.
     */
    public static class RetryExhaustedException extends RuntimeException {

        private final int attempts;

        public RetryExhaustedException(String message, int attempts, Throwable cause) {
            super(message, cause);
            this.attempts = attempts;
        }

        public int getAttempts() {
            return attempts;
        }
    }
}

package io.github.hongjungwan.zkvault.core.resilience;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * 고정 간격 재시도 정책. 재시도 대상이 아닌 예외는 감싸지 않고 그대로 전파.
 */
@Slf4j
public final class RetryPolicy {

    private final int maxAttempts;
    private final long delayMs;
    private final Predicate<RuntimeException> retryPredicate;
    private final Set<Class<? extends RuntimeException>> retryableExceptions;

    private RetryPolicy(Builder builder) {
        this.maxAttempts = builder.maxAttempts;
        this.delayMs = builder.delayMs;
        this.retryPredicate = builder.retryPredicate;
        this.retryableExceptions = builder.retryableExceptions;
    }

    /**
     * 재시도 정책에 따라 작업 실행
     *
     * @throws RetryExhaustedException 재시도 대상 예외로 모든 시도가 실패한 경우
     */
    public <T> T execute(Supplier<T> operation) {
        RuntimeException lastException = null;
        int attempt = 0;

        while (attempt < maxAttempts) {
            try {
                return operation.get();
            } catch (RuntimeException e) {
                if (!isRetryable(e)) {
                    throw e;
                }
                lastException = e;
                attempt++;

                if (attempt < maxAttempts) {
                    log.debug("Retry attempt {}/{} after {}ms: {}", attempt, maxAttempts, delayMs, e.getMessage());
                    sleep(delayMs);
                }
            }
        }

        throw new RetryExhaustedException(
                String.format("Exhausted %d retry attempts", maxAttempts),
                attempt,
                lastException
        );
    }

    /**
     * Runnable 실행
     */
    public void execute(Runnable operation) {
        execute(() -> {
            operation.run();
            return null;
        });
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    Duration getDelay() {
        return Duration.ofMillis(delayMs);
    }

    private boolean isRetryable(RuntimeException e) {
        // 커스텀 predicate 우선
        if (retryPredicate != null) {
            return retryPredicate.test(e);
        }

        if (!retryableExceptions.isEmpty()) {
            return retryableExceptions.stream()
                    .anyMatch(clazz -> clazz.isInstance(e));
        }

        // 기본: 모든 예외 재시도
        return true;
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

    /**
     * 기본 정책 생성 (3회 시도, 50ms 간격)
     */
    public static RetryPolicy defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxAttempts = 3;
        private long delayMs = 50;
        private Predicate<RuntimeException> retryPredicate;
        private Set<Class<? extends RuntimeException>> retryableExceptions = Set.of();

        /**
         * 최대 시도 횟수 (기본: 3)
         */
        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be at least 1, got: " + maxAttempts);
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
         * 재시도 조건 설정
         */
        public Builder retryOn(Predicate<RuntimeException> predicate) {
            this.retryPredicate = predicate;
            return this;
        }

        /**
         * 재시도할 예외 클래스 설정
         */
        @SafeVarargs
        public final Builder retryOnExceptions(Class<? extends RuntimeException>... exceptions) {
            this.retryableExceptions = Set.of(exceptions);
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(this);
        }
    }

    /**
     * 재시도 소진 시 발생하는 예외
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

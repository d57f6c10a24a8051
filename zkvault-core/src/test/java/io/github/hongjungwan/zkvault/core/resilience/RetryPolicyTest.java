package io.github.hongjungwan.zkvault.core.resilience;

import io.github.hongjungwan.zkvault.api.exception.InvalidTokenException;
import io.github.hongjungwan.zkvault.api.exception.WriteConflictException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RetryPolicy")
class RetryPolicyTest {

    @Nested
    @DisplayName("Retry Behavior")
    class RetryBehaviorTests {

        @Test
        @DisplayName("should stop retrying once the operation succeeds")
        void shouldSucceedOnLastAttempt() {
            RetryPolicy policy = RetryPolicy.builder()
                    .maxAttempts(3)
                    .fixedDelay(Duration.ofMillis(1))
                    .build();
            AtomicInteger attempts = new AtomicInteger();

            String result = policy.execute(() -> {
                if (attempts.incrementAndGet() < 3) {
                    throw new WriteConflictException("busy");
                }
                return "stored";
            });

            assertThat(result).isEqualTo("stored");
            assertThat(attempts.get()).isEqualTo(3);
        }

        @Test
        @DisplayName("should report attempts and last cause when exhausted")
        void shouldExhaust() {
            RetryPolicy policy = RetryPolicy.builder()
                    .maxAttempts(4)
                    .fixedDelay(Duration.ZERO)
                    .build();
            AtomicInteger attempts = new AtomicInteger();

            assertThatThrownBy(() -> policy.execute(() -> {
                throw new WriteConflictException("attempt " + attempts.incrementAndGet());
            }))
                    .isInstanceOf(RetryPolicy.RetryExhaustedException.class)
                    .hasCauseInstanceOf(WriteConflictException.class)
                    .satisfies(e -> {
                        RetryPolicy.RetryExhaustedException exhausted = (RetryPolicy.RetryExhaustedException) e;
                        assertThat(exhausted.getAttempts()).isEqualTo(4);
                        assertThat(exhausted.getCause()).hasMessage("attempt 4");
                    });
        }

        @Test
        @DisplayName("should rethrow non-retryable exceptions unchanged")
        void shouldRethrowNonRetryable() {
            RetryPolicy policy = RetryPolicy.builder()
                    .retryOnExceptions(WriteConflictException.class)
                    .fixedDelay(Duration.ZERO)
                    .build();
            AtomicInteger attempts = new AtomicInteger();

            assertThatThrownBy(() -> policy.execute(() -> {
                attempts.incrementAndGet();
                throw new InvalidTokenException("unknown token");
            })).isInstanceOf(InvalidTokenException.class);

            assertThat(attempts.get()).isEqualTo(1);
        }

        @Test
        @DisplayName("should use custom retry predicate")
        void shouldUseCustomRetryPredicate() {
            RetryPolicy policy = RetryPolicy.builder()
                    .maxAttempts(5)
                    .retryOn(e -> e.getMessage() != null && e.getMessage().contains("retry"))
                    .fixedDelay(Duration.ZERO)
                    .build();
            AtomicInteger attempts = new AtomicInteger();

            assertThatThrownBy(() -> policy.execute(() -> {
                if (attempts.incrementAndGet() < 2) {
                    throw new IllegalStateException("please retry");
                }
                throw new IllegalStateException("fatal");
            })).isInstanceOf(IllegalStateException.class).hasMessage("fatal");

            assertThat(attempts.get()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("Configuration")
    class ConfigurationTests {

        @Test
        @DisplayName("defaults should allow three attempts")
        void shouldProvideDefaults() {
            RetryPolicy policy = RetryPolicy.defaults();

            assertThat(policy.getMaxAttempts()).isEqualTo(3);
            assertThat(policy.getDelay()).isEqualTo(Duration.ofMillis(50));
        }

        @Test
        @DisplayName("should reject fewer than one attempt")
        void shouldRejectZeroAttempts() {
            assertThatThrownBy(() -> RetryPolicy.builder().maxAttempts(0))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("runnable variant should retry too")
        void shouldRetryRunnable() {
            AtomicInteger attempts = new AtomicInteger();

            RetryPolicy.builder().fixedDelay(Duration.ZERO).build().execute(() -> {
                if (attempts.incrementAndGet() == 1) {
                    throw new WriteConflictException("busy");
                }
            });

            assertThat(attempts.get()).isEqualTo(2);
        }
    }
}

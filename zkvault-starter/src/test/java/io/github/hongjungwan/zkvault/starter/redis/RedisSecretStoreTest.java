package io.github.hongjungwan.zkvault.starter.redis;

import io.github.hongjungwan.zkvault.api.exception.SecretStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.when;

/**
 * RedisSecretStore 단위 테스트.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("RedisSecretStore 테스트")
class RedisSecretStoreTest {

    @Mock
    private StringRedisTemplate template;

    @Mock
    private HashOperations<String, String, String> hashes;

    private RedisSecretStore store;

    @BeforeEach
    void setUp() {
        doReturn(hashes).when(template).opsForHash();
        store = new RedisSecretStore(template);
    }

    @Nested
    @DisplayName("해시 명령")
    class HashCommandTests {

        @Test
        @DisplayName("없는 키는 빈 맵 반환")
        void shouldReturnEmptyMapForMissingKey() {
            when(hashes.entries("production:billing")).thenReturn(Map.of());

            assertThat(store.hgetAll("production:billing")).isEmpty();
        }

        @Test
        @DisplayName("HDEL 결과가 null이면 0")
        void shouldTreatNullDeleteAsZero() {
            when(hashes.delete("production:billing", "DB_URL")).thenReturn(null);

            assertThat(store.hdel("production:billing", "DB_URL")).isZero();
        }

        @Test
        @DisplayName("통신 실패는 SecretStoreException으로 변환")
        void shouldWrapDataAccessException() {
            when(hashes.get("meta@billing", "salt")).thenThrow(new RedisConnectionFailureException("down"));

            assertThatThrownBy(() -> store.hget("meta@billing", "salt"))
                    .isInstanceOf(SecretStoreException.class)
                    .hasMessageContaining("HGET meta@billing")
                    .hasCauseInstanceOf(RedisConnectionFailureException.class);
        }
    }

    @Nested
    @DisplayName("Compare-and-set")
    class CompareAndSetTests {

        @Test
        @DisplayName("should flag absent expectation")
        void shouldPassAbsentFlag() {
            when(template.execute(eq(RedisSecretStore.COMPARE_AND_SET), eq(List.of("meta@billing")),
                    eq("serviceTokens"), eq(""), eq("1"), eq("{}")))
                    .thenReturn(1L);

            assertThat(store.compareAndSetField("meta@billing", "serviceTokens", null, "{}")).isTrue();
        }

        @Test
        @DisplayName("should report mismatch")
        void shouldReportMismatch() {
            when(template.execute(eq(RedisSecretStore.COMPARE_AND_SET), eq(List.of("production:billing")),
                    eq("DB_URL"), eq("[old]"), eq("0"), eq("[new]")))
                    .thenReturn(0L);

            assertThat(store.compareAndSetField("production:billing", "DB_URL", "[old]", "[new]")).isFalse();
        }
    }
}

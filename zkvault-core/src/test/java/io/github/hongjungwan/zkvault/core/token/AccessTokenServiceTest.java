package io.github.hongjungwan.zkvault.core.token;

import io.github.hongjungwan.zkvault.api.config.VaultConfig;
import io.github.hongjungwan.zkvault.api.domain.ServiceToken;
import io.github.hongjungwan.zkvault.api.domain.TokenCredentials;
import io.github.hongjungwan.zkvault.api.exception.DecryptionFailedException;
import io.github.hongjungwan.zkvault.api.exception.ErrorCode;
import io.github.hongjungwan.zkvault.api.exception.InvalidTokenException;
import io.github.hongjungwan.zkvault.api.exception.NotFoundException;
import io.github.hongjungwan.zkvault.api.exception.SecretStoreException;
import io.github.hongjungwan.zkvault.core.crypto.AeadCodec;
import io.github.hongjungwan.zkvault.core.crypto.KeyDerivation;
import io.github.hongjungwan.zkvault.core.keys.KeyHierarchy;
import io.github.hongjungwan.zkvault.core.store.InMemorySecretStore;
import io.github.hongjungwan.zkvault.core.store.StoreKeys;
import io.github.hongjungwan.zkvault.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import javax.crypto.SecretKey;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AccessTokenService 테스트")
class AccessTokenServiceTest {

    private static final String PROJECT = "billing";

    private MutableClock clock;
    private InMemorySecretStore store;
    private KeyHierarchy keyHierarchy;
    private AccessTokenService tokenService;
    private SecretKey pek;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        store = new InMemorySecretStore(clock);
        keyHierarchy = new KeyHierarchy(new AeadCodec(), new KeyDerivation());
        VaultConfig config = VaultConfig.builder()
                .clock(clock)
                .executor(Runnable::run)
                .writeRetryDelay(Duration.ZERO)
                .build();
        tokenService = new AccessTokenService(store, keyHierarchy, config);
        pek = keyHierarchy.generatePek();
        store.hset(StoreKeys.metaKey(PROJECT), StoreKeys.FIELD_HISTORY_LIMIT, "10");
    }

    @Nested
    @DisplayName("서비스 토큰")
    class ServiceTokenTests {

        @Test
        @DisplayName("발급한 토큰으로 같은 PEK를 복원할 수 있어야 한다")
        void shouldUnwrapWithIssuedToken() {
            TokenCredentials credentials = tokenService.issueServiceToken(PROJECT, pek, "api", "API server");

            SecretKey unwrapped = tokenService.unwrapWithToken(PROJECT, credentials.publicId(), credentials.secret());

            assertThat(unwrapped.getEncoded()).isEqualTo(pek.getEncoded());
        }

        @Test
        @DisplayName("publicId와 시크릿 형식")
        void shouldUseExpectedIdentifierFormat() {
            TokenCredentials credentials = tokenService.issueServiceToken(PROJECT, pek, "api", null);

            assertThat(credentials.publicId()).matches("stk_[A-Za-z0-9_-]{16}");
            assertThat(credentials.secret()).matches("redenv_sk_[A-Za-z0-9_-]{32}");
            assertThat(credentials.toString()).doesNotContain(credentials.secret());
        }

        @Test
        @DisplayName("토큰 목록에는 시크릿이 없고 토큰마다 다른 salt를 사용해야 한다")
        void shouldListTokensWithoutSecrets() {
            TokenCredentials first = tokenService.issueServiceToken(PROJECT, pek, "api", "");
            TokenCredentials second = tokenService.issueServiceToken(PROJECT, pek, "worker", "");

            Map<String, ServiceToken> tokens = tokenService.listServiceTokens(PROJECT);

            assertThat(tokens).containsOnlyKeys(first.publicId(), second.publicId());
            assertThat(tokens.get(first.publicId()).getSalt()).isNotEqualTo(tokens.get(second.publicId()).getSalt());
            String raw = store.hget(StoreKeys.metaKey(PROJECT), StoreKeys.FIELD_SERVICE_TOKENS).orElseThrow();
            assertThat(raw).doesNotContain(first.secret()).doesNotContain(second.secret());
        }

        @Test
        @DisplayName("잘못된 시크릿은 DecryptionFailedException")
        void shouldRejectWrongSecret() {
            TokenCredentials credentials = tokenService.issueServiceToken(PROJECT, pek, "api", "");

            assertThatThrownBy(() -> tokenService.unwrapWithToken(PROJECT, credentials.publicId(), "redenv_sk_wrong"))
                    .isInstanceOf(DecryptionFailedException.class);
        }

        @Test
        @DisplayName("알 수 없는 publicId는 INVALID_TOKEN_ID")
        void shouldRejectUnknownTokenId() {
            assertThatThrownBy(() -> tokenService.unwrapWithToken(PROJECT, "stk_unknown", "secret"))
                    .isInstanceOf(InvalidTokenException.class)
                    .extracting("code").isEqualTo(ErrorCode.INVALID_TOKEN_ID);
        }

        @Test
        @DisplayName("프로젝트가 없으면 PROJECT_NOT_FOUND")
        void shouldRejectUnknownProject() {
            assertThatThrownBy(() -> tokenService.unwrapWithToken("ghost", "stk_x", "secret"))
                    .isInstanceOf(NotFoundException.class)
                    .extracting("code").isEqualTo(ErrorCode.PROJECT_NOT_FOUND);
        }
    }

    @Nested
    @DisplayName("폐기")
    class RevocationTests {

        @Test
        @DisplayName("폐기 후에는 올바른 시크릿으로도 복원할 수 없어야 한다")
        void shouldFailAfterRevocation() {
            TokenCredentials revoked = tokenService.issueServiceToken(PROJECT, pek, "api", "");
            TokenCredentials kept = tokenService.issueServiceToken(PROJECT, pek, "worker", "");

            tokenService.revoke(PROJECT, revoked.publicId());

            assertThatThrownBy(() -> tokenService.unwrapWithToken(PROJECT, revoked.publicId(), revoked.secret()))
                    .isInstanceOf(InvalidTokenException.class);
            assertThat(tokenService.unwrapWithToken(PROJECT, kept.publicId(), kept.secret()).getEncoded())
                    .isEqualTo(pek.getEncoded());
        }

        @Test
        @DisplayName("없는 토큰 폐기는 InvalidTokenException")
        void shouldRejectUnknownRevocation() {
            assertThatThrownBy(() -> tokenService.revoke(PROJECT, "stk_missing"))
                    .isInstanceOf(InvalidTokenException.class);
            assertThatThrownBy(() -> tokenService.revoke(PROJECT, "etk_missing"))
                    .isInstanceOf(InvalidTokenException.class);
        }
    }

    @Nested
    @DisplayName("임시 토큰")
    class EphemeralTokenTests {

        @Test
        @DisplayName("임시 토큰은 별도 필드에 저장되고 레지스트리에 등록되어야 한다")
        void shouldStoreAndRegisterEphemeralToken() {
            EphemeralTokenRegistry registry = new EphemeralTokenRegistry();

            TokenCredentials credentials = tokenService.issueEphemeralToken(PROJECT, pek, Duration.ofMinutes(10), registry);

            assertThat(credentials.publicId()).startsWith("etk_");
            assertThat(registry.contains(credentials.publicId())).isTrue();
            assertThat(store.hget(StoreKeys.metaKey(PROJECT), "ephemeral:" + credentials.publicId())).isPresent();
            assertThat(tokenService.listEphemeralTokens(PROJECT)).containsOnlyKeys(credentials.publicId());
            assertThat(tokenService.listServiceTokens(PROJECT)).isEmpty();
            assertThat(tokenService.unwrapWithToken(PROJECT, credentials.publicId(), credentials.secret()).getEncoded())
                    .isEqualTo(pek.getEncoded());
        }

        @Test
        @DisplayName("TTL이 지나면 저장소에서 사라져 복원할 수 없어야 한다")
        void shouldExpireWithStoreTtl() {
            TokenCredentials credentials = tokenService.issueEphemeralToken(
                    PROJECT, pek, Duration.ofMinutes(10), new EphemeralTokenRegistry());

            clock.advance(Duration.ofMinutes(10));

            assertThatThrownBy(() -> tokenService.unwrapWithToken(PROJECT, credentials.publicId(), credentials.secret()))
                    .isInstanceOf(InvalidTokenException.class);
            assertThat(tokenService.listEphemeralTokens(PROJECT)).isEmpty();
        }

        @Test
        @DisplayName("만료 설정에 실패하면 저장한 토큰을 지우고 예외를 전파해야 한다")
        void shouldRemoveTokenWhenExpiryFails() {
            InMemorySecretStore failingStore = new InMemorySecretStore(clock) {
                @Override
                public void expireField(String key, String field, Duration ttl) {
                    throw new SecretStoreException("HPEXPIRE not supported", null);
                }
            };
            failingStore.hset(StoreKeys.metaKey(PROJECT), StoreKeys.FIELD_HISTORY_LIMIT, "10");
            AccessTokenService service = new AccessTokenService(failingStore, keyHierarchy,
                    VaultConfig.builder().clock(clock).executor(Runnable::run).build());
            EphemeralTokenRegistry registry = new EphemeralTokenRegistry();

            assertThatThrownBy(() -> service.issueEphemeralToken(PROJECT, pek, Duration.ofMinutes(10), registry))
                    .isInstanceOf(SecretStoreException.class);

            assertThat(failingStore.hgetAll(StoreKeys.metaKey(PROJECT)))
                    .allSatisfy((field, value) -> assertThat(field).doesNotStartWith(StoreKeys.EPHEMERAL_FIELD_PREFIX));
            assertThat(registry.size()).isZero();
        }

        @Test
        @DisplayName("양수가 아닌 TTL은 거부")
        void shouldRejectNonPositiveTtl() {
            assertThatThrownBy(() -> tokenService.issueEphemeralToken(PROJECT, pek, Duration.ZERO, new EphemeralTokenRegistry()))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}

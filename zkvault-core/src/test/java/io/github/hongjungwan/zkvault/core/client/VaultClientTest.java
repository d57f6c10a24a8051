package io.github.hongjungwan.zkvault.core.client;

import io.github.hongjungwan.zkvault.api.config.VaultConfig;
import io.github.hongjungwan.zkvault.api.domain.SecretVersion;
import io.github.hongjungwan.zkvault.api.domain.TokenCredentials;
import io.github.hongjungwan.zkvault.api.exception.InvalidTokenException;
import io.github.hongjungwan.zkvault.api.exception.MissingConfigException;
import io.github.hongjungwan.zkvault.core.crypto.AeadCodec;
import io.github.hongjungwan.zkvault.core.crypto.KeyDerivation;
import io.github.hongjungwan.zkvault.core.keys.KeyHierarchy;
import io.github.hongjungwan.zkvault.core.project.ProjectRegistry;
import io.github.hongjungwan.zkvault.core.store.InMemorySecretStore;
import io.github.hongjungwan.zkvault.core.store.VersionedSecretStore;
import io.github.hongjungwan.zkvault.core.token.AccessTokenService;
import io.github.hongjungwan.zkvault.support.ManualExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import javax.crypto.KeyGenerator;
import javax.crypto.SecretKey;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

@DisplayName("VaultClient")
class VaultClientTest {

    private static final String PROJECT = "billing";
    private static final String ENV = "production";

    private InMemorySecretStore store;
    private AccessTokenService tokenService;
    private VersionedSecretStore secrets;
    private SecretKey pek;
    private TokenCredentials token;
    private AtomicLong nanos;
    private ManualExecutor refreshExecutor;

    @BeforeEach
    void setUp() {
        store = spy(new InMemorySecretStore());
        VaultConfig adminConfig = VaultConfig.builder().executor(Runnable::run).build();
        AeadCodec codec = new AeadCodec();
        KeyHierarchy keyHierarchy = new KeyHierarchy(codec, new KeyDerivation());
        tokenService = new AccessTokenService(store, keyHierarchy, adminConfig);
        secrets = new VersionedSecretStore(store, codec, adminConfig);

        pek = new ProjectRegistry(store, keyHierarchy, adminConfig).register(PROJECT, "master-password");
        token = tokenService.issueServiceToken(PROJECT, pek, "api", "");
        secrets.writeSecret(PROJECT, ENV, "DB_URL", "postgres://db", pek, "alice");
        secrets.writeSecret(PROJECT, ENV, "API_KEY", "key-1", pek, "alice");

        nanos = new AtomicLong();
        refreshExecutor = new ManualExecutor();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("DB_URL");
        System.clearProperty("API_KEY");
    }

    private VaultClient newClient(boolean populateSystemProperties) {
        VaultConfig config = VaultConfig.builder()
                .project(PROJECT)
                .environment(ENV)
                .tokenId(token.publicId())
                .token(token.secret())
                .cacheTtl(Duration.ofSeconds(1))
                .cacheStaleWhileRevalidate(Duration.ofSeconds(5))
                .cacheTicker(nanos::get)
                .executor(refreshExecutor)
                .populateSystemProperties(populateSystemProperties)
                .build();
        return new VaultClient(config, tokenService, secrets);
    }

    @Nested
    @DisplayName("Configuration")
    class ConfigurationTests {

        @Test
        @DisplayName("should list every missing option")
        void shouldReportAllMissingOptions() {
            assertThatThrownBy(() -> new VaultClient(VaultConfig.defaultConfig(), null))
                    .isInstanceOf(MissingConfigException.class)
                    .hasMessageContaining("project")
                    .hasMessageContaining("tokenId")
                    .hasMessageContaining("token")
                    .hasMessageContaining("secretStore");
        }

        @Test
        @DisplayName("should accept a complete configuration")
        void shouldAcceptCompleteConfig() {
            VaultConfig config = VaultConfig.clientConfig(PROJECT, ENV, token.publicId(), token.secret());

            assertThat(new VaultClient(config, store).get("API_KEY")).contains("key-1");
        }
    }

    @Nested
    @DisplayName("Reads")
    class ReadTests {

        @Test
        @DisplayName("should return every decrypted secret")
        void shouldLoadAll() {
            VaultClient client = newClient(false);

            assertThat(client.load()).containsOnlyKeys("DB_URL", "API_KEY");
            assertThat(client.get("DB_URL")).contains("postgres://db");
            assertThat(client.get("MISSING")).isEmpty();
        }

        @Test
        @DisplayName("should drop keys that do not decrypt")
        void shouldDropUndecryptableKeys() throws Exception {
            KeyGenerator keyGen = KeyGenerator.getInstance("AES");
            keyGen.init(256);
            secrets.writeSecret(PROJECT, ENV, "FOREIGN", "x", keyGen.generateKey(), "mallory");

            assertThat(newClient(false).load()).containsOnlyKeys("DB_URL", "API_KEY");
        }

        @Test
        @DisplayName("should not touch the store while fresh")
        void shouldServeFreshFromCache() {
            VaultClient client = newClient(false);
            client.load();
            clearInvocations(store);

            nanos.addAndGet(Duration.ofMillis(500).toNanos());
            client.get("API_KEY");
            refreshExecutor.runAll();

            verify(store, never()).hgetAll("production:billing");
            assertThat(client.cacheState()).isEqualTo(SecretCache.State.FRESH);
        }

        @Test
        @DisplayName("should export secrets as system properties when enabled")
        void shouldPopulateSystemProperties() {
            newClient(true).load();

            assertThat(System.getProperty("API_KEY")).isEqualTo("key-1");
        }
    }

    @Nested
    @DisplayName("Writes")
    class WriteTests {

        @Test
        @DisplayName("should record the token id as author and invalidate the cache")
        void shouldWriteThroughAndInvalidate() {
            VaultClient client = newClient(false);
            assertThat(client.get("API_KEY")).contains("key-1");

            SecretVersion written = client.set("API_KEY", "key-2");

            assertThat(written.getVersion()).isEqualTo(2);
            assertThat(written.getAuthor()).isEqualTo(token.publicId());
            assertThat(client.cacheState()).isEqualTo(SecretCache.State.EMPTY);
            assertThat(client.get("API_KEY")).contains("key-2");
        }
    }

    @Nested
    @DisplayName("Revocation")
    class RevocationTests {

        @Test
        @DisplayName("should keep serving stale values until the cache expires after revocation")
        void shouldFailOnceCacheExpires() {
            VaultClient client = newClient(false);
            client.load();

            tokenService.revoke(PROJECT, token.publicId());

            nanos.addAndGet(Duration.ofSeconds(2).toNanos());
            assertThat(client.get("API_KEY")).contains("key-1");
            refreshExecutor.runAll();
            assertThat(client.get("API_KEY")).contains("key-1");

            nanos.addAndGet(Duration.ofSeconds(5).toNanos());
            assertThatThrownBy(() -> client.get("API_KEY"))
                    .isInstanceOf(InvalidTokenException.class);
        }
    }
}

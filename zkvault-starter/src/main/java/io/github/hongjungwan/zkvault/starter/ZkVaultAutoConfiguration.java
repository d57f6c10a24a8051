package io.github.hongjungwan.zkvault.starter;

import io.github.hongjungwan.zkvault.api.config.VaultConfig;
import io.github.hongjungwan.zkvault.core.admin.VaultAdmin;
import io.github.hongjungwan.zkvault.core.audit.SystemAuditIdentityProvider;
import io.github.hongjungwan.zkvault.core.client.VaultClient;
import io.github.hongjungwan.zkvault.core.crypto.AeadCodec;
import io.github.hongjungwan.zkvault.core.crypto.KeyDerivation;
import io.github.hongjungwan.zkvault.core.diagnostics.VaultDoctor;
import io.github.hongjungwan.zkvault.core.keys.KeyHierarchy;
import io.github.hongjungwan.zkvault.core.project.ProjectRegistry;
import io.github.hongjungwan.zkvault.core.session.VaultSession;
import io.github.hongjungwan.zkvault.core.store.InMemorySecretStore;
import io.github.hongjungwan.zkvault.core.store.VersionedSecretStore;
import io.github.hongjungwan.zkvault.core.token.AccessTokenService;
import io.github.hongjungwan.zkvault.spi.AuditIdentityProvider;
import io.github.hongjungwan.zkvault.spi.SecretStore;
import io.github.hongjungwan.zkvault.starter.audit.SecurityContextAuditIdentityProvider;
import io.github.hongjungwan.zkvault.starter.redis.RedisSecretStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * zkvault Spring Boot 자동 설정.
 */
@AutoConfiguration(afterName = "org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration")
@EnableConfigurationProperties(ZkVaultProperties.class)
@ConditionalOnProperty(prefix = "zkvault", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class ZkVaultAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public VaultConfig vaultConfig(ZkVaultProperties properties) {
        return VaultConfig.builder()
                .project(properties.getProject())
                .environment(properties.getEnvironment())
                .tokenId(properties.getTokenId())
                .token(properties.getToken())
                .cacheTtl(properties.getCache().getTtl())
                .cacheStaleWhileRevalidate(properties.getCache().getStaleWhileRevalidate())
                .defaultHistoryLimit(properties.getHistoryLimit())
                .writeRetries(properties.getWriteRetries())
                .populateSystemProperties(properties.isPopulateSystemProperties())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public SecretStore secretStore(ObjectProvider<StringRedisTemplate> redisTemplate) {
        StringRedisTemplate template = redisTemplate.getIfAvailable();
        if (template != null) {
            return new RedisSecretStore(template);
        }
        log.warn("No StringRedisTemplate available - using in-memory secret store (not shared across processes)");
        return new InMemorySecretStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public AeadCodec aeadCodec() {
        return new AeadCodec();
    }

    @Bean
    @ConditionalOnMissingBean
    public KeyDerivation keyDerivation() {
        return new KeyDerivation();
    }

    @Bean
    @ConditionalOnMissingBean
    public KeyHierarchy keyHierarchy(AeadCodec codec, KeyDerivation keyDerivation) {
        return new KeyHierarchy(codec, keyDerivation);
    }

    @Bean
    @ConditionalOnMissingBean
    public VersionedSecretStore versionedSecretStore(SecretStore store, AeadCodec codec, VaultConfig config) {
        return new VersionedSecretStore(store, codec, config);
    }

    @Bean
    @ConditionalOnMissingBean
    public AccessTokenService accessTokenService(SecretStore store, KeyHierarchy keyHierarchy, VaultConfig config) {
        return new AccessTokenService(store, keyHierarchy, config);
    }

    @Bean
    @ConditionalOnMissingBean
    public ProjectRegistry projectRegistry(SecretStore store, KeyHierarchy keyHierarchy, VaultConfig config) {
        return new ProjectRegistry(store, keyHierarchy, config);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public VaultSession vaultSession(AccessTokenService tokenService) {
        return new VaultSession(tokenService);
    }

    @Bean
    @ConditionalOnMissingBean
    public AuditIdentityProvider auditIdentityProvider() {
        return new SecurityContextAuditIdentityProvider(new SystemAuditIdentityProvider());
    }

    @Bean
    @ConditionalOnMissingBean
    public VaultAdmin vaultAdmin(ProjectRegistry projectRegistry, VersionedSecretStore secretStore,
                                 AccessTokenService tokenService, VaultSession session,
                                 AuditIdentityProvider identityProvider) {
        return new VaultAdmin(projectRegistry, secretStore, tokenService, session, identityProvider);
    }

    /**
     * 서비스 토큰이 설정된 경우에만 등록되는 런타임 클라이언트.
     */
    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "zkvault", name = {"project", "token-id", "token"})
    public VaultClient vaultClient(VaultConfig config, AccessTokenService tokenService,
                                   VersionedSecretStore secretStore) {
        return new VaultClient(config, tokenService, secretStore);
    }

    @Bean
    @ConditionalOnMissingBean
    public VaultDoctor vaultDoctor(VaultConfig config, SecretStore store, ProjectRegistry projectRegistry) {
        return new VaultDoctor(config, store, projectRegistry);
    }

    @Bean
    public ZkVaultLifecycle zkVaultLifecycle(VaultDoctor doctor, VaultSession session, ZkVaultProperties properties) {
        return new ZkVaultLifecycle(doctor, session, properties.isDiagnoseOnStartup());
    }

    /**
     * 시작 시 자가 진단, 종료 시 세션 정리(임시 토큰 폐기, 키 삭제)를 담당하는 SmartLifecycle 구현체.
     */
    static class ZkVaultLifecycle implements SmartLifecycle {

        private final VaultDoctor doctor;
        private final VaultSession session;
        private final boolean diagnoseOnStartup;
        private volatile boolean running = false;

        ZkVaultLifecycle(VaultDoctor doctor, VaultSession session, boolean diagnoseOnStartup) {
            this.doctor = doctor;
            this.session = session;
            this.diagnoseOnStartup = diagnoseOnStartup;
        }

        @Override
        public void start() {
            log.info("Starting zkvault SDK...");

            if (diagnoseOnStartup) {
                VaultDoctor.DiagnosticReport report = doctor.diagnose();
                if (report.hasFailures()) {
                    log.warn("Diagnostic failures detected - secret reads may fail until they are resolved");
                }
            }

            running = true;
        }

        @Override
        public void stop() {
            log.info("Stopping zkvault SDK...");
            session.close();
            running = false;
        }

        @Override
        public boolean isRunning() {
            return running;
        }

        @Override
        public int getPhase() {
            return Integer.MIN_VALUE + 100;
        }
    }
}

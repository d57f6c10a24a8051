package io.github.hongjungwan.zkvault.core.client;

import io.github.hongjungwan.zkvault.api.config.VaultConfig;
import io.github.hongjungwan.zkvault.api.domain.SecretVersion;
import io.github.hongjungwan.zkvault.api.exception.MissingConfigException;
import io.github.hongjungwan.zkvault.core.crypto.AeadCodec;
import io.github.hongjungwan.zkvault.core.crypto.KeyDerivation;
import io.github.hongjungwan.zkvault.core.keys.KeyHierarchy;
import io.github.hongjungwan.zkvault.core.store.VersionedSecretStore;
import io.github.hongjungwan.zkvault.core.token.AccessTokenService;
import io.github.hongjungwan.zkvault.spi.SecretStore;
import lombok.extern.slf4j.Slf4j;

import javax.crypto.SecretKey;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 서비스 토큰 기반 런타임 클라이언트. 복호화된 시크릿을 stale-while-revalidate 캐시로 제공.
 *
 * <p>갱신마다 토큰으로 PEK를 다시 복원하므로 토큰 폐기는 다음 갱신부터 반영됨.</p>
 */
@Slf4j
public class VaultClient {

    private final VaultConfig config;
    private final AccessTokenService tokenService;
    private final VersionedSecretStore secretStore;
    private final SecretCache cache;
    private final SecretCache.Key cacheKey;

    public VaultClient(VaultConfig config, SecretStore store) {
        this(config, store, new AeadCodec());
    }

    private VaultClient(VaultConfig config, SecretStore store, AeadCodec codec) {
        this(config,
                store == null ? null : new AccessTokenService(store, new KeyHierarchy(codec, new KeyDerivation()), config),
                store == null ? null : new VersionedSecretStore(store, codec, config));
    }

    public VaultClient(VaultConfig config, AccessTokenService tokenService, VersionedSecretStore secretStore) {
        validate(config, tokenService, secretStore);
        this.config = config;
        this.tokenService = tokenService;
        this.secretStore = secretStore;
        this.cacheKey = new SecretCache.Key(config.getProject(), config.getEnvironment());
        this.cache = new SecretCache(
                config.getCacheTtl(),
                config.getCacheStaleWhileRevalidate(),
                config.getExecutor(),
                config.getCacheTicker(),
                key -> fetchAndDecrypt());
    }

    /** 환경의 모든 시크릿 */
    public Map<String, String> load() {
        Map<String, String> secrets = cache.get(cacheKey);
        if (config.isPopulateSystemProperties()) {
            secrets.forEach(System::setProperty);
        }
        return secrets;
    }

    public Map<String, String> getAll() {
        return load();
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(load().get(key));
    }

    /**
     * 시크릿 기록 (작성자 = tokenId). 성공 여부와 관계없이 캐시 무효화.
     */
    public SecretVersion set(String key, String value) {
        try {
            SecretKey pek = unwrapPek();
            try {
                return secretStore.writeSecret(
                        config.getProject(), config.getEnvironment(), key, value, pek, config.getTokenId());
            } finally {
                KeyHierarchy.destroyKey(pek);
            }
        } finally {
            cache.invalidate(cacheKey);
        }
    }

    public SecretCache.State cacheState() {
        return cache.state(cacheKey);
    }

    private Map<String, String> fetchAndDecrypt() {
        SecretKey pek = unwrapPek();
        try {
            // 복호화 실패 키는 readAll에서 기록 후 제외
            return secretStore.readAll(config.getProject(), config.getEnvironment(), pek).values();
        } finally {
            KeyHierarchy.destroyKey(pek);
        }
    }

    private SecretKey unwrapPek() {
        return tokenService.unwrapWithToken(config.getProject(), config.getTokenId(), config.getToken());
    }

    private static void validate(VaultConfig config, AccessTokenService tokenService, VersionedSecretStore secretStore) {
        List<String> missing = new ArrayList<>();
        if (isBlank(config.getProject())) {
            missing.add("project");
        }
        if (isBlank(config.getTokenId())) {
            missing.add("tokenId");
        }
        if (isBlank(config.getToken())) {
            missing.add("token");
        }
        if (tokenService == null || secretStore == null) {
            missing.add("secretStore");
        }
        if (!missing.isEmpty()) {
            throw new MissingConfigException(missing);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

package io.github.hongjungwan.zkvault.core.token;

import io.github.hongjungwan.zkvault.api.config.VaultConfig;
import io.github.hongjungwan.zkvault.api.domain.ServiceToken;
import io.github.hongjungwan.zkvault.api.domain.TokenCredentials;
import io.github.hongjungwan.zkvault.api.exception.InvalidTokenException;
import io.github.hongjungwan.zkvault.api.exception.NotFoundException;
import io.github.hongjungwan.zkvault.api.exception.WriteConflictException;
import io.github.hongjungwan.zkvault.core.keys.KeyHierarchy;
import io.github.hongjungwan.zkvault.core.resilience.RetryPolicy;
import io.github.hongjungwan.zkvault.core.store.StoreKeys;
import io.github.hongjungwan.zkvault.spi.SecretStore;
import lombok.extern.slf4j.Slf4j;

import javax.crypto.SecretKey;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * 액세스 토큰 발급/폐기. 토큰마다 자체 salt로 파생한 키로 PEK를 독립 래핑.
 * 토큰 시크릿은 발급 시 한 번만 반환되며 저장되지 않음.
 */
@Slf4j
public class AccessTokenService {

    private final SecretStore store;
    private final KeyHierarchy keyHierarchy;
    private final ServiceTokenCodec tokenCodec;
    private final Clock clock;
    private final SecureRandom secureRandom;
    private final RetryPolicy writeRetryPolicy;

    public AccessTokenService(SecretStore store, KeyHierarchy keyHierarchy, VaultConfig config) {
        this(store, keyHierarchy, new ServiceTokenCodec(), config, new SecureRandom());
    }

    public AccessTokenService(SecretStore store, KeyHierarchy keyHierarchy, ServiceTokenCodec tokenCodec,
                              VaultConfig config, SecureRandom secureRandom) {
        this.store = store;
        this.keyHierarchy = keyHierarchy;
        this.tokenCodec = tokenCodec;
        this.clock = config.getClock();
        this.secureRandom = secureRandom;
        this.writeRetryPolicy = RetryPolicy.builder()
                .maxAttempts(config.getWriteRetries())
                .fixedDelay(config.getWriteRetryDelay())
                .retryOnExceptions(WriteConflictException.class)
                .build();
    }

    /**
     * 서비스 토큰 발급.
     *
     * @return publicId와 시크릿 (재조회 불가)
     */
    public TokenCredentials issueServiceToken(String project, SecretKey pek, String name, String description) {
        requireProject(project);

        String publicId = TokenIds.newServiceTokenId(secureRandom);
        String secret = TokenIds.newSecret(secureRandom);
        ServiceToken token = newToken(publicId, secret, pek, name, description, null);

        updateTokenMap(project, tokens -> {
            tokens.put(publicId, token);
            return tokens;
        });

        log.info("Issued service token {} for project {}", TokenIds.mask(publicId), project);
        return new TokenCredentials(publicId, secret);
    }

    /**
     * 임시 토큰 발급. 저장소 필드 만료(ttl)가 최종 보장이며, 세션 종료 시 registry가 먼저 폐기.
     */
    public TokenCredentials issueEphemeralToken(String project, SecretKey pek, Duration ttl,
                                                EphemeralTokenRegistry registry) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Ephemeral token ttl must be positive");
        }
        requireProject(project);

        String publicId = TokenIds.newEphemeralTokenId(secureRandom);
        String secret = TokenIds.newSecret(secureRandom);
        Instant expiresAt = clock.instant().plus(ttl).truncatedTo(ChronoUnit.MILLIS);
        ServiceToken token = newToken(publicId, secret, pek, "ephemeral", "Temporary access token", expiresAt);

        String metaKey = StoreKeys.metaKey(project);
        String field = StoreKeys.ephemeralField(publicId);
        store.hset(metaKey, field, tokenCodec.encode(token));
        try {
            store.expireField(metaKey, field, ttl);
        } catch (RuntimeException e) {
            // 만료가 걸리지 않은 토큰은 남기지 않음
            try {
                store.hdel(metaKey, field);
            } catch (RuntimeException cleanup) {
                e.addSuppressed(cleanup);
            }
            log.warn("Failed to set expiry on ephemeral token {} for project {}", TokenIds.mask(publicId), project);
            throw e;
        }
        registry.register(project, publicId);

        log.info("Issued ephemeral token {} for project {} (ttl={})", TokenIds.mask(publicId), project, ttl);
        return new TokenCredentials(publicId, secret);
    }

    /** 서비스 토큰 목록 (시크릿 미포함) */
    public Map<String, ServiceToken> listServiceTokens(String project) {
        Map<String, String> meta = requireProject(project);
        return tokenCodec.decodeMap(meta.get(StoreKeys.FIELD_SERVICE_TOKENS));
    }

    /** 만료되지 않은 임시 토큰 목록 */
    public Map<String, ServiceToken> listEphemeralTokens(String project) {
        Map<String, String> meta = requireProject(project);
        Instant now = clock.instant();
        Map<String, ServiceToken> tokens = new LinkedHashMap<>();
        meta.forEach((field, json) -> {
            if (field.startsWith(StoreKeys.EPHEMERAL_FIELD_PREFIX)) {
                String publicId = field.substring(StoreKeys.EPHEMERAL_FIELD_PREFIX.length());
                ServiceToken token = tokenCodec.decode(publicId, json);
                if (token.getExpiresAt() == null || token.getExpiresAt().isAfter(now)) {
                    tokens.put(publicId, token);
                }
            }
        });
        return tokens;
    }

    /**
     * 토큰 폐기. 래핑된 PEK 사본이 삭제되므로 이후 해당 시크릿으로는 복원 불가.
     *
     * @throws InvalidTokenException 존재하지 않는 토큰
     */
    public void revoke(String project, String publicId) {
        if (TokenIds.isEphemeral(publicId)) {
            long removed = store.hdel(StoreKeys.metaKey(project), StoreKeys.ephemeralField(publicId));
            if (removed == 0) {
                throw new InvalidTokenException("Token " + TokenIds.mask(publicId) + " not found in project " + project);
            }
        } else {
            requireProject(project);
            updateTokenMap(project, tokens -> {
                if (tokens.remove(publicId) == null) {
                    throw new InvalidTokenException("Token " + TokenIds.mask(publicId) + " not found in project " + project);
                }
                return tokens;
            });
        }
        log.info("Revoked token {} for project {}", TokenIds.mask(publicId), project);
    }

    /**
     * 토큰 자격 증명으로 PEK 복원.
     *
     * @throws NotFoundException 프로젝트 메타데이터 없음
     * @throws InvalidTokenException 알 수 없거나 만료된 publicId
     * @throws io.github.hongjungwan.zkvault.api.exception.DecryptionFailedException 잘못된 시크릿
     */
    public SecretKey unwrapWithToken(String project, String publicId, String secret) {
        Map<String, String> meta = requireProject(project);

        ServiceToken token = findToken(meta, publicId)
                .orElseThrow(() -> new InvalidTokenException("Invalid token ID"));
        if (token.getExpiresAt() != null && !clock.instant().isBefore(token.getExpiresAt())) {
            throw new InvalidTokenException("Token " + TokenIds.mask(publicId) + " has expired");
        }

        return keyHierarchy.unwrapWithSecret(token.getEncryptedPek(), secret, token.getSalt());
    }

    private Optional<ServiceToken> findToken(Map<String, String> meta, String publicId) {
        ServiceToken token = tokenCodec.decodeMap(meta.get(StoreKeys.FIELD_SERVICE_TOKENS)).get(publicId);
        if (token != null) {
            return Optional.of(token);
        }
        String ephemeral = meta.get(StoreKeys.ephemeralField(publicId));
        if (ephemeral != null) {
            return Optional.of(tokenCodec.decode(publicId, ephemeral));
        }
        return Optional.empty();
    }

    private ServiceToken newToken(String publicId, String secret, SecretKey pek,
                                  String name, String description, Instant expiresAt) {
        String saltHex = keyHierarchy.keyDerivation().generateSaltHex();
        return ServiceToken.builder()
                .publicId(publicId)
                .encryptedPek(keyHierarchy.wrapWithSecret(pek, secret, saltHex))
                .salt(saltHex)
                .name(name)
                .description(description == null ? "" : description)
                .createdAt(clock.instant().truncatedTo(ChronoUnit.MILLIS))
                .expiresAt(expiresAt)
                .build();
    }

    /** serviceTokens 필드 compare-and-set 갱신 */
    private void updateTokenMap(String project, UnaryOperator<Map<String, ServiceToken>> mutation) {
        String metaKey = StoreKeys.metaKey(project);
        try {
            writeRetryPolicy.execute(() -> {
                String raw = store.hget(metaKey, StoreKeys.FIELD_SERVICE_TOKENS).orElse(null);
                Map<String, ServiceToken> updated = mutation.apply(tokenCodec.decodeMap(raw));
                if (!store.compareAndSetField(metaKey, StoreKeys.FIELD_SERVICE_TOKENS, raw, tokenCodec.encodeMap(updated))) {
                    throw new WriteConflictException("Service token map of " + project + " changed during update");
                }
            });
        } catch (RetryPolicy.RetryExhaustedException e) {
            throw new WriteConflictException(
                    "Concurrent modification of service tokens for " + project + " could not be resolved", e.getCause());
        }
    }

    private Map<String, String> requireProject(String project) {
        Map<String, String> meta = store.hgetAll(StoreKeys.metaKey(project));
        if (meta.isEmpty()) {
            throw NotFoundException.project(project);
        }
        return meta;
    }
}

package io.github.hongjungwan.zkvault.core.session;

import io.github.hongjungwan.zkvault.api.domain.TokenCredentials;
import io.github.hongjungwan.zkvault.api.exception.InvalidTokenException;
import io.github.hongjungwan.zkvault.core.keys.KeyHierarchy;
import io.github.hongjungwan.zkvault.core.token.AccessTokenService;
import io.github.hongjungwan.zkvault.core.token.EphemeralTokenRegistry;
import io.github.hongjungwan.zkvault.core.token.TokenIds;
import lombok.extern.slf4j.Slf4j;

import javax.crypto.SecretKey;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * 잠금 해제된 PEK와 임시 토큰 정리 목록을 소유하는 명시적 컨텍스트.
 * {@link #close()} 시 임시 토큰을 폐기하고 보관 중인 키를 삭제.
 */
@Slf4j
public class VaultSession implements AutoCloseable {

    private final AccessTokenService tokenService;
    private final EphemeralTokenRegistry ephemeralTokens = new EphemeralTokenRegistry();
    private final Map<String, SecretKey> unlockedKeys = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile Thread shutdownHook;

    public VaultSession(AccessTokenService tokenService) {
        this.tokenService = tokenService;
    }

    /** 보관 중인 PEK */
    public Optional<SecretKey> unlocked(String project) {
        return Optional.ofNullable(unlockedKeys.get(project));
    }

    /** 보관 중인 PEK 반환, 없으면 unlocker로 복원 후 보관 */
    public SecretKey pek(String project, Supplier<SecretKey> unlocker) {
        ensureOpen();
        SecretKey existing = unlockedKeys.get(project);
        if (existing != null) {
            return existing;
        }
        // KDF 호출 중에는 맵 락을 잡지 않음
        SecretKey unlocked = unlocker.get();
        SecretKey raced = unlockedKeys.putIfAbsent(project, unlocked);
        return raced != null ? raced : unlocked;
    }

    public void remember(String project, SecretKey pek) {
        ensureOpen();
        unlockedKeys.put(project, pek);
    }

    public void forget(String project) {
        KeyHierarchy.destroyKey(unlockedKeys.remove(project));
    }

    /** 이 세션 종료 시 폐기되는 임시 토큰 발급 */
    public TokenCredentials issueEphemeralToken(String project, SecretKey pek, Duration ttl) {
        ensureOpen();
        return tokenService.issueEphemeralToken(project, pek, ttl, ephemeralTokens);
    }

    /** 임시 토큰 즉시 폐기 */
    public void revokeEphemeralToken(String project, String publicId) {
        ephemeralTokens.unregister(publicId);
        tokenService.revoke(project, publicId);
    }

    public EphemeralTokenRegistry ephemeralTokens() {
        return ephemeralTokens;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * JVM 종료(SIGINT/SIGTERM) 시 close() 실행. 저장소 TTL이 최종 보장.
     */
    public synchronized void registerShutdownHook() {
        if (shutdownHook != null || closed.get()) {
            return;
        }
        Thread hook = new Thread(this::close, "zkvault-session-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        shutdownHook = hook;
    }

    /**
     * 임시 토큰 순차 폐기 (best-effort) 후 키 삭제. 여러 번 호출해도 한 번만 수행.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        ephemeralTokens.drain((project, publicId) -> {
            try {
                tokenService.revoke(project, publicId);
            } catch (InvalidTokenException e) {
                log.debug("Ephemeral token {} already gone", TokenIds.mask(publicId));
            }
        });

        unlockedKeys.values().forEach(KeyHierarchy::destroyKey);
        unlockedKeys.clear();

        removeShutdownHook();
        log.debug("Vault session closed");
    }

    private void removeShutdownHook() {
        Thread hook = shutdownHook;
        if (hook == null || Thread.currentThread() == hook) {
            return;
        }
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM 종료 진행 중
            log.trace("Shutdown in progress, hook not removed");
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Vault session is closed");
        }
    }
}

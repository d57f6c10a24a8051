package io.github.hongjungwan.zkvault.core.store;

import io.github.hongjungwan.zkvault.api.config.VaultConfig;
import io.github.hongjungwan.zkvault.api.domain.BulkReadResult;
import io.github.hongjungwan.zkvault.api.domain.DecryptedVersion;
import io.github.hongjungwan.zkvault.api.domain.SecretVersion;
import io.github.hongjungwan.zkvault.api.exception.NotFoundException;
import io.github.hongjungwan.zkvault.api.exception.SecretStoreException;
import io.github.hongjungwan.zkvault.api.exception.WriteConflictException;
import io.github.hongjungwan.zkvault.core.crypto.AeadCodec;
import io.github.hongjungwan.zkvault.core.resilience.RetryPolicy;
import io.github.hongjungwan.zkvault.spi.SecretStore;
import lombok.extern.slf4j.Slf4j;

import javax.crypto.SecretKey;
import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * 버전 관리 시크릿 저장소. 키마다 최신 버전이 앞에 오는 암호화 히스토리를 유지.
 *
 * <p>쓰기는 read-modify-write 사이클이며, 마지막 저장 단계는 읽은 값과 비교하는 compare-and-set.
 * 다른 쓰기와 충돌하면 사이클 전체를 재시도하고 소진 시 {@link WriteConflictException}.</p>
 */
@Slf4j
public class VersionedSecretStore {

    private final SecretStore store;
    private final AeadCodec codec;
    private final SecretHistoryCodec historyCodec;
    private final Executor executor;
    private final Clock clock;
    private final int defaultHistoryLimit;
    private final RetryPolicy writeRetryPolicy;

    public VersionedSecretStore(SecretStore store, AeadCodec codec, VaultConfig config) {
        this(store, codec, new SecretHistoryCodec(), config);
    }

    public VersionedSecretStore(SecretStore store, AeadCodec codec, SecretHistoryCodec historyCodec, VaultConfig config) {
        this.store = store;
        this.codec = codec;
        this.historyCodec = historyCodec;
        this.executor = config.getExecutor();
        this.clock = config.getClock();
        this.defaultHistoryLimit = config.getDefaultHistoryLimit();
        this.writeRetryPolicy = RetryPolicy.builder()
                .maxAttempts(config.getWriteRetries())
                .fixedDelay(config.getWriteRetryDelay())
                .retryOnExceptions(WriteConflictException.class)
                .build();
    }

    /**
     * 새 버전 기록. 버전 번호는 현재 최신 + 1 (없으면 1), 히스토리 한도 초과분은 오래된 것부터 제거.
     *
     * @throws NotFoundException 프로젝트 메타데이터가 없는 경우
     * @throws WriteConflictException 동시 쓰기 충돌 재시도 소진
     */
    public SecretVersion writeSecret(String project, String environment, String key,
                                     String plaintext, SecretKey pek, String author) {
        StoreKeys.requireValidName("Project", project);
        StoreKeys.requireValidName("Environment", environment);
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(plaintext, "plaintext");

        try {
            return writeRetryPolicy.execute(
                    () -> attemptWrite(project, environment, key, plaintext, pek, author));
        } catch (RetryPolicy.RetryExhaustedException e) {
            log.warn("Write to '{}' in {}:{} failed after {} attempts due to concurrent writers",
                    key, environment, project, e.getAttempts());
            throw new WriteConflictException(
                    "Concurrent modification of \"" + key + "\" in " + environment
                            + " could not be resolved after " + e.getAttempts() + " attempts", e.getCause());
        }
    }

    private SecretVersion attemptWrite(String project, String environment, String key,
                                       String plaintext, SecretKey pek, String author) {
        String environmentKey = StoreKeys.environmentKey(environment, project);

        CompletableFuture<Map<String, String>> metaFuture =
                CompletableFuture.supplyAsync(() -> store.hgetAll(StoreKeys.metaKey(project)), executor);
        CompletableFuture<Optional<String>> historyFuture =
                CompletableFuture.supplyAsync(() -> store.hget(environmentKey, key), executor);

        Map<String, String> meta = join(metaFuture);
        String rawHistory = join(historyFuture).orElse(null);

        if (meta.isEmpty()) {
            throw NotFoundException.project(project);
        }

        int historyLimit = parseHistoryLimit(meta.get(StoreKeys.FIELD_HISTORY_LIMIT));
        List<SecretVersion> history = historyCodec.decode(rawHistory);
        int nextVersion = history.isEmpty() ? 1 : history.get(0).getVersion() + 1;

        SecretVersion newVersion = SecretVersion.builder()
                .version(nextVersion)
                .ciphertext(codec.encrypt(plaintext, pek))
                .author(author)
                .createdAt(clock.instant().truncatedTo(ChronoUnit.MILLIS))
                .build();

        List<SecretVersion> updated = new ArrayList<>(history.size() + 1);
        updated.add(newVersion);
        updated.addAll(history);
        if (historyLimit > 0 && updated.size() > historyLimit) {
            updated = updated.subList(0, historyLimit);
        }

        boolean stored = store.compareAndSetField(environmentKey, key, rawHistory, historyCodec.encode(updated));
        if (!stored) {
            log.debug("Concurrent write detected on '{}' in {}:{}, retrying", key, environment, project);
            throw new WriteConflictException("History of \"" + key + "\" changed during write");
        }

        log.debug("Wrote version {} of '{}' to {}:{}", nextVersion, key, environment, project);
        return newVersion;
    }

    /**
     * 최신 버전 평문 조회.
     *
     * @throws NotFoundException 키가 없거나 히스토리가 빈 경우
     */
    public String readLatest(String project, String environment, String key, SecretKey pek) {
        List<SecretVersion> history = history(project, environment, key);
        if (history.isEmpty()) {
            throw NotFoundException.secret(environment, key);
        }
        return codec.decrypt(history.get(0).getCiphertext(), pek);
    }

    /**
     * 환경 내 모든 키의 최신 값을 병렬 복호화. 키별 실패는 격리되어 failures에 기록.
     */
    public BulkReadResult readAll(String project, String environment, SecretKey pek) {
        Map<String, String> raw = store.hgetAll(StoreKeys.environmentKey(environment, project));

        Map<String, CompletableFuture<String>> pending = new LinkedHashMap<>();
        raw.forEach((key, rawHistory) -> pending.put(key, CompletableFuture.supplyAsync(() -> {
            List<SecretVersion> history = historyCodec.decode(rawHistory);
            return history.isEmpty() ? null : codec.decrypt(history.get(0).getCiphertext(), pek);
        }, executor)));

        Map<String, String> values = new LinkedHashMap<>();
        Map<String, Throwable> failures = new LinkedHashMap<>();
        pending.forEach((key, future) -> {
            try {
                String value = future.join();
                if (value != null) {
                    values.put(key, value);
                }
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("Failed to decrypt secret '{}' in {}:{}: {}",
                        key, environment, project, cause.getClass().getSimpleName());
                failures.put(key, cause);
            }
        });
        return new BulkReadResult(values, failures);
    }

    /** 히스토리 (최신 우선, 없으면 빈 목록) */
    public List<SecretVersion> history(String project, String environment, String key) {
        return store.hget(StoreKeys.environmentKey(environment, project), key)
                .map(historyCodec::decode)
                .orElse(List.of());
    }

    /** 버전별 복호화. 실패한 버전은 원인과 함께 반환 */
    public List<DecryptedVersion> decryptHistory(String project, String environment, String key, SecretKey pek) {
        List<DecryptedVersion> result = new ArrayList<>();
        for (SecretVersion version : history(project, environment, key)) {
            try {
                result.add(DecryptedVersion.decrypted(version, codec.decrypt(version.getCiphertext(), pek)));
            } catch (RuntimeException e) {
                log.warn("Failed to decrypt version {} of '{}': {}", version.getVersion(), key, e.getClass().getSimpleName());
                result.add(DecryptedVersion.failed(version, e));
            }
        }
        return result;
    }

    /**
     * 이전 버전으로 롤백. 과거 내용을 새 버전(최신 + 1)으로 다시 기록하며 히스토리는 보존.
     *
     * @throws IllegalArgumentException 대상이 이미 최신 버전인 경우
     * @throws NotFoundException 보존된 히스토리에 대상 버전이 없는 경우
     */
    public SecretVersion rollback(String project, String environment, String key,
                                  int targetVersion, SecretKey pek, String author) {
        List<SecretVersion> history = history(project, environment, key);
        if (history.isEmpty()) {
            throw NotFoundException.secret(environment, key);
        }
        if (history.get(0).getVersion() == targetVersion) {
            throw new IllegalArgumentException(
                    "Cannot roll back to version " + targetVersion + " because it is already the current version");
        }

        SecretVersion target = history.stream()
                .filter(v -> v.getVersion() == targetVersion)
                .findFirst()
                .orElseThrow(() -> NotFoundException.version(key, targetVersion));

        String plaintext = codec.decrypt(target.getCiphertext(), pek);
        SecretVersion written = writeSecret(project, environment, key, plaintext, pek, author);
        log.info("Rolled back '{}' in {}:{} to version {} as version {}",
                key, environment, project, targetVersion, written.getVersion());
        return written;
    }

    /** 키 삭제. 실제 삭제된 개수 반환 */
    public long removeSecrets(String project, String environment, String... keys) {
        long removed = store.hdel(StoreKeys.environmentKey(environment, project), keys);
        log.info("Removed {} secret(s) from {}:{}", removed, environment, project);
        return removed;
    }

    /**
     * 원본 환경의 새 키 또는 값이 다른 키를 대상 환경으로 승격. 대상 환경은 자체 히스토리 유지.
     *
     * @return 승격된 키와 대상 환경에 기록된 버전
     */
    public Map<String, SecretVersion> promote(String project, String sourceEnvironment, String targetEnvironment,
                                              SecretKey pek, String author) {
        return promote(project, sourceEnvironment, targetEnvironment, List.of(), pek, author);
    }

    /**
     * 지정한 키만 승격 (빈 컬렉션이면 변경된 모든 키).
     */
    public Map<String, SecretVersion> promote(String project, String sourceEnvironment, String targetEnvironment,
                                              Collection<String> keys, SecretKey pek, String author) {
        BulkReadResult source = readAll(project, sourceEnvironment, pek);
        BulkReadResult target = readAll(project, targetEnvironment, pek);

        Map<String, SecretVersion> promoted = new LinkedHashMap<>();
        source.values().forEach((key, value) -> {
            if (!keys.isEmpty() && !keys.contains(key)) {
                return;
            }
            if (value.equals(target.values().get(key))) {
                return;
            }
            promoted.put(key, writeSecret(project, targetEnvironment, key, value, pek, author));
        });

        log.info("Promoted {} secret(s) from {} to {} in {}",
                promoted.size(), sourceEnvironment, targetEnvironment, project);
        return promoted;
    }

    private int parseHistoryLimit(String raw) {
        if (raw == null || raw.isBlank()) {
            return defaultHistoryLimit;
        }
        try {
            return Math.max(0, Integer.parseInt(raw.trim()));
        } catch (NumberFormatException e) {
            log.warn("Ignoring malformed historyLimit '{}', using default {}", raw, defaultHistoryLimit);
            return defaultHistoryLimit;
        }
    }

    private static <T> T join(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new SecretStoreException("Store request failed", cause);
        }
    }
}

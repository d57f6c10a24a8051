package io.github.hongjungwan.zkvault.core.project;

import io.github.hongjungwan.zkvault.api.config.VaultConfig;
import io.github.hongjungwan.zkvault.api.exception.DecryptionFailedException;
import io.github.hongjungwan.zkvault.api.exception.ErrorCode;
import io.github.hongjungwan.zkvault.api.exception.InvalidFormatException;
import io.github.hongjungwan.zkvault.api.exception.NotFoundException;
import io.github.hongjungwan.zkvault.api.exception.ProjectAlreadyExistsException;
import io.github.hongjungwan.zkvault.api.exception.VaultException;
import io.github.hongjungwan.zkvault.core.keys.KeyHierarchy;
import io.github.hongjungwan.zkvault.core.store.StoreKeys;
import io.github.hongjungwan.zkvault.spi.SecretStore;
import lombok.extern.slf4j.Slf4j;

import javax.crypto.SecretKey;
import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 프로젝트 등록, 마스터 비밀번호 잠금 해제/교체, 히스토리 한도, 환경/프로젝트 삭제.
 */
@Slf4j
public class ProjectRegistry {

    static final int MIN_PASSWORD_LENGTH = 8;
    static final String KDF_NAME = "pbkdf2-sha256";
    static final String ALGORITHM_NAME = "aes-256-gcm";

    private final SecretStore store;
    private final KeyHierarchy keyHierarchy;
    private final Clock clock;
    private final int defaultHistoryLimit;

    public ProjectRegistry(SecretStore store, KeyHierarchy keyHierarchy, VaultConfig config) {
        this.store = store;
        this.keyHierarchy = keyHierarchy;
        this.clock = config.getClock();
        this.defaultHistoryLimit = config.getDefaultHistoryLimit();
    }

    /**
     * 새 프로젝트 등록. PEK를 생성하여 마스터 비밀번호 파생 키로 래핑 후 메타데이터 기록.
     *
     * @return 새 PEK (호출자가 세션에 보관)
     */
    public SecretKey register(String project, String masterPassword) {
        StoreKeys.requireValidName("Project", project);
        requirePassword(masterPassword);

        String metaKey = StoreKeys.metaKey(project);
        if (store.exists(metaKey)) {
            throw new ProjectAlreadyExistsException(project);
        }

        SecretKey pek = keyHierarchy.generatePek();
        String saltHex = keyHierarchy.keyDerivation().generateSaltHex();

        // 동시 등록 시 래핑된 PEK를 먼저 선점한 쪽만 나머지 필드를 기록
        String wrapped = keyHierarchy.wrapWithSecret(pek, masterPassword, saltHex);
        if (!store.compareAndSetField(metaKey, StoreKeys.FIELD_ENCRYPTED_PEK, null, wrapped)) {
            throw new ProjectAlreadyExistsException(project);
        }

        Map<String, String> meta = new LinkedHashMap<>();
        meta.put(StoreKeys.FIELD_SALT, saltHex);
        meta.put(StoreKeys.FIELD_HISTORY_LIMIT, String.valueOf(defaultHistoryLimit));
        meta.put(StoreKeys.FIELD_KDF, KDF_NAME);
        meta.put(StoreKeys.FIELD_ALGORITHM, ALGORITHM_NAME);
        meta.put(StoreKeys.FIELD_CREATED_AT, clock.instant().truncatedTo(ChronoUnit.MILLIS).toString());
        store.hset(metaKey, meta);

        log.info("Registered project {}", project);
        return pek;
    }

    /**
     * 마스터 비밀번호로 PEK 복원.
     *
     * @throws DecryptionFailedException 잘못된 비밀번호
     */
    public SecretKey unlock(String project, String masterPassword) {
        Map<String, String> meta = requireMeta(project);
        String wrapped = meta.get(StoreKeys.FIELD_ENCRYPTED_PEK);
        String salt = meta.get(StoreKeys.FIELD_SALT);
        if (wrapped == null || salt == null) {
            throw new InvalidFormatException("Project metadata of " + project + " is incomplete");
        }
        return keyHierarchy.unwrapWithSecret(wrapped, masterPassword, salt);
    }

    public boolean verifyPassword(String project, String masterPassword) {
        try {
            KeyHierarchy.destroyKey(unlock(project, masterPassword));
            return true;
        } catch (DecryptionFailedException e) {
            return false;
        }
    }

    /**
     * 마스터 비밀번호 교체. 같은 PEK를 새 salt로 재래핑하며 토큰별 래핑 사본은 그대로 유지.
     */
    public void changePassword(String project, String oldPassword, String newPassword) {
        requirePassword(newPassword);
        SecretKey pek = unlock(project, oldPassword);
        try {
            String newSalt = keyHierarchy.keyDerivation().generateSaltHex();
            Map<String, String> update = new LinkedHashMap<>();
            update.put(StoreKeys.FIELD_ENCRYPTED_PEK, keyHierarchy.wrapWithSecret(pek, newPassword, newSalt));
            update.put(StoreKeys.FIELD_SALT, newSalt);
            store.hset(StoreKeys.metaKey(project), update);
        } finally {
            KeyHierarchy.destroyKey(pek);
        }
        log.info("Master password rotated for project {}", project);
    }

    /** 히스토리 보존 개수 설정 (0 = 무제한) */
    public void setHistoryLimit(String project, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("History limit must be a non-negative number");
        }
        requireMeta(project);
        store.hset(StoreKeys.metaKey(project), StoreKeys.FIELD_HISTORY_LIMIT, String.valueOf(limit));
        log.info("History limit for project {} set to {}", project, limit);
    }

    public int getHistoryLimit(String project) {
        String raw = requireMeta(project).get(StoreKeys.FIELD_HISTORY_LIMIT);
        if (raw == null || raw.isBlank()) {
            return defaultHistoryLimit;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new InvalidFormatException("historyLimit of " + project + " is not a number: " + raw, e);
        }
    }

    public boolean exists(String project) {
        return store.exists(StoreKeys.metaKey(project));
    }

    public List<String> listProjects() {
        return store.scan(StoreKeys.projectPattern()).stream()
                .map(StoreKeys::projectFromMetaKey)
                .sorted()
                .toList();
    }

    public List<String> listEnvironments(String project) {
        StoreKeys.requireValidName("Project", project);
        return store.scan(StoreKeys.environmentPattern(project)).stream()
                .map(StoreKeys::environmentFromKey)
                .sorted()
                .toList();
    }

    public boolean dropEnvironment(String project, String environment) {
        boolean deleted = store.del(StoreKeys.environmentKey(environment, project));
        if (deleted) {
            log.info("Dropped environment {} of project {}", environment, project);
        }
        return deleted;
    }

    /** 모든 환경 키 삭제 후 메타데이터 삭제 */
    public void dropProject(String project) {
        requireMeta(project);
        for (String environment : listEnvironments(project)) {
            store.del(StoreKeys.environmentKey(environment, project));
        }
        store.del(StoreKeys.metaKey(project));
        log.info("Dropped project {}", project);
    }

    private Map<String, String> requireMeta(String project) {
        Map<String, String> meta = store.hgetAll(StoreKeys.metaKey(project));
        if (meta.isEmpty()) {
            throw NotFoundException.project(project);
        }
        return meta;
    }

    private static void requirePassword(String password) {
        if (password == null || password.length() < MIN_PASSWORD_LENGTH) {
            throw new VaultException(
                    "Master password must be at least " + MIN_PASSWORD_LENGTH + " characters long",
                    ErrorCode.INVALID_CONFIG);
        }
    }
}

package io.github.hongjungwan.zkvault.core.admin;

import io.github.hongjungwan.zkvault.api.domain.BulkReadResult;
import io.github.hongjungwan.zkvault.api.domain.DecryptedVersion;
import io.github.hongjungwan.zkvault.api.domain.SecretVersion;
import io.github.hongjungwan.zkvault.api.domain.ServiceToken;
import io.github.hongjungwan.zkvault.api.domain.TokenCredentials;
import io.github.hongjungwan.zkvault.core.project.ProjectRegistry;
import io.github.hongjungwan.zkvault.core.session.VaultSession;
import io.github.hongjungwan.zkvault.core.store.VersionedSecretStore;
import io.github.hongjungwan.zkvault.core.token.AccessTokenService;
import io.github.hongjungwan.zkvault.spi.AuditIdentityProvider;

import javax.crypto.SecretKey;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * 마스터 비밀번호로 잠금 해제한 프로젝트에 대한 관리 작업 진입점.
 * PEK는 세션이 보관하고, 쓰기 작성자는 {@link AuditIdentityProvider}가 결정.
 */
public class VaultAdmin {

    private final ProjectRegistry projectRegistry;
    private final VersionedSecretStore secretStore;
    private final AccessTokenService tokenService;
    private final VaultSession session;
    private final AuditIdentityProvider identityProvider;

    public VaultAdmin(ProjectRegistry projectRegistry, VersionedSecretStore secretStore,
                      AccessTokenService tokenService, VaultSession session,
                      AuditIdentityProvider identityProvider) {
        this.projectRegistry = projectRegistry;
        this.secretStore = secretStore;
        this.tokenService = tokenService;
        this.session = session;
        this.identityProvider = identityProvider;
    }

    /** 프로젝트 등록 후 잠금 해제 상태로 보관 */
    public void register(String project, String masterPassword) {
        session.remember(project, projectRegistry.register(project, masterPassword));
    }

    /** 마스터 비밀번호로 잠금 해제 (이미 해제된 경우 재파생하지 않음) */
    public void unlock(String project, String masterPassword) {
        session.pek(project, () -> projectRegistry.unlock(project, masterPassword));
    }

    public void lock(String project) {
        session.forget(project);
    }

    public SecretVersion set(String project, String environment, String key, String value) {
        return secretStore.writeSecret(project, environment, key, value, pek(project), identityProvider.currentIdentity());
    }

    public String get(String project, String environment, String key) {
        return secretStore.readLatest(project, environment, key, pek(project));
    }

    public BulkReadResult getAll(String project, String environment) {
        return secretStore.readAll(project, environment, pek(project));
    }

    public List<DecryptedVersion> history(String project, String environment, String key) {
        return secretStore.decryptHistory(project, environment, key, pek(project));
    }

    public SecretVersion rollback(String project, String environment, String key, int targetVersion) {
        return secretStore.rollback(project, environment, key, targetVersion, pek(project),
                identityProvider.currentIdentity());
    }

    public long remove(String project, String environment, String... keys) {
        return secretStore.removeSecrets(project, environment, keys);
    }

    public Map<String, SecretVersion> promote(String project, String sourceEnvironment, String targetEnvironment) {
        return secretStore.promote(project, sourceEnvironment, targetEnvironment, pek(project),
                identityProvider.currentIdentity());
    }

    public TokenCredentials issueServiceToken(String project, String name, String description) {
        return tokenService.issueServiceToken(project, pek(project), name, description);
    }

    public TokenCredentials issueEphemeralToken(String project, Duration ttl) {
        return session.issueEphemeralToken(project, pek(project), ttl);
    }

    public Map<String, ServiceToken> listServiceTokens(String project) {
        return tokenService.listServiceTokens(project);
    }

    public void revoke(String project, String publicId) {
        if (session.ephemeralTokens().contains(publicId)) {
            session.revokeEphemeralToken(project, publicId);
        } else {
            tokenService.revoke(project, publicId);
        }
    }

    /** 비밀번호 교체. 보관 중인 PEK는 동일하므로 세션 상태 유지 */
    public void changePassword(String project, String oldPassword, String newPassword) {
        projectRegistry.changePassword(project, oldPassword, newPassword);
    }

    private SecretKey pek(String project) {
        return session.unlocked(project)
                .orElseThrow(() -> new IllegalStateException("Project \"" + project + "\" is locked; unlock it first"));
    }
}

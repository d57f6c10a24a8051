package io.github.hongjungwan.zkvault.core.store;

import io.github.hongjungwan.zkvault.api.exception.ErrorCode;
import io.github.hongjungwan.zkvault.api.exception.VaultException;

/**
 * 저장소 키/필드 이름 규칙. 기존 저장 데이터와 비트 단위로 호환.
 */
public final class StoreKeys {

    public static final String META_PREFIX = "meta@";
    public static final String ENV_SEPARATOR = ":";

    public static final String FIELD_ENCRYPTED_PEK = "encryptedPEK";
    public static final String FIELD_SALT = "salt";
    public static final String FIELD_HISTORY_LIMIT = "historyLimit";
    public static final String FIELD_SERVICE_TOKENS = "serviceTokens";
    public static final String FIELD_KDF = "kdf";
    public static final String FIELD_ALGORITHM = "algorithm";
    public static final String FIELD_CREATED_AT = "createdAt";
    public static final String EPHEMERAL_FIELD_PREFIX = "ephemeral:";

    private static final String RESERVED_CHARS = ":@*?[]\\";

    private StoreKeys() {}

    /** {@code meta@{project}} */
    public static String metaKey(String project) {
        return META_PREFIX + project;
    }

    /** {@code {environment}:{project}} */
    public static String environmentKey(String environment, String project) {
        return environment + ENV_SEPARATOR + project;
    }

    public static String ephemeralField(String publicId) {
        return EPHEMERAL_FIELD_PREFIX + publicId;
    }

    public static String projectPattern() {
        return META_PREFIX + "*";
    }

    public static String environmentPattern(String project) {
        return "*" + ENV_SEPARATOR + project;
    }

    public static String projectFromMetaKey(String metaKey) {
        return metaKey.substring(META_PREFIX.length());
    }

    public static String environmentFromKey(String environmentKey) {
        return environmentKey.substring(0, environmentKey.lastIndexOf(ENV_SEPARATOR));
    }

    /** 프로젝트/환경 이름 검증. 구분자 ':' '@' 와 SCAN 패턴 문자 사용 불가 */
    public static String requireValidName(String kind, String name) {
        if (name == null || name.isBlank()) {
            throw new VaultException(kind + " name must not be empty", ErrorCode.INVALID_CONFIG);
        }
        for (int i = 0; i < name.length(); i++) {
            if (RESERVED_CHARS.indexOf(name.charAt(i)) >= 0) {
                throw new VaultException(kind + " name must not contain any of '" + RESERVED_CHARS + "': " + name,
                        ErrorCode.INVALID_CONFIG);
            }
        }
        return name;
    }
}

package io.github.hongjungwan.zkvault.api.exception;

import java.util.List;
import java.util.Map;

/**
 * 필수 연결 설정 누락.
 */
public class MissingConfigException extends VaultException {

    public MissingConfigException(List<String> missing) {
        super("Missing required configuration options: " + String.join(", ", missing),
                ErrorCode.MISSING_CONFIG, Map.of("missing", List.copyOf(missing)), null);
    }
}

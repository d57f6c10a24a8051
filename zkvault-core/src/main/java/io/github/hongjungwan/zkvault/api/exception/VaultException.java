package io.github.hongjungwan.zkvault.api.exception;

import lombok.Getter;

import java.util.Map;

/**
 * 볼트 예외의 최상위 타입. {@link ErrorCode}와 선택적 컨텍스트 정보를 함께 전달.
 */
@Getter
public class VaultException extends RuntimeException {

    private final ErrorCode code;
    private final Map<String, Object> context;

    public VaultException(String message, ErrorCode code) {
        this(message, code, Map.of(), null);
    }

    public VaultException(String message, ErrorCode code, Throwable cause) {
        this(message, code, Map.of(), cause);
    }

    public VaultException(String message, ErrorCode code, Map<String, Object> context, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.context = context == null ? Map.of() : Map.copyOf(context);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + code + "]: " + getMessage();
    }
}

package io.github.hongjungwan.zkvault.api.exception;

/**
 * 백엔드 저장소 통신 실패.
 */
public class SecretStoreException extends VaultException {

    public SecretStoreException(String message, Throwable cause) {
        super(message, ErrorCode.STORE_ERROR, cause);
    }
}

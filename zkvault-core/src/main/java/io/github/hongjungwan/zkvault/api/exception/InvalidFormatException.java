package io.github.hongjungwan.zkvault.api.exception;

/**
 * 암호문 와이어 포맷 또는 저장된 JSON 형식 오류.
 */
public class InvalidFormatException extends VaultException {

    public InvalidFormatException(String message) {
        super(message, ErrorCode.INVALID_FORMAT);
    }

    public InvalidFormatException(String message, Throwable cause) {
        super(message, ErrorCode.INVALID_FORMAT, cause);
    }
}

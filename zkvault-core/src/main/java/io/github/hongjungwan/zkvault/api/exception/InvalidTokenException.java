package io.github.hongjungwan.zkvault.api.exception;

/**
 * 토큰 맵에 존재하지 않는 publicId. 폐기되었거나 만료된 토큰 포함.
 */
public class InvalidTokenException extends VaultException {

    public InvalidTokenException(String message) {
        super(message, ErrorCode.INVALID_TOKEN_ID);
    }
}
